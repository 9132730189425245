package com.scanprev.script.seq;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.scanprev.script.error.EmptySequenceException;
import com.scanprev.script.error.EmptySourceException;

/**
 * Sequence primitives shared by the engine and by host code.
 *
 * All of them work on single-pass {@link Iterator}s and never index or buffer their input:
 *
 * <pre>
 *   scan(add, [1, 2, 3])             -> 1, 3, 6
 *   scan(add, [1, 2, 3], 10)         -> 10, 11, 13, 16
 *   scan(add, [1, 2, 3], 10, false)  -> 11, 13, 16
 *   last(scan(add, [1, 2, 3]))       -> 6
 *   prepend(0, [1, 2])               -> 0, 1, 2
 * </pre>
 *
 * The returned iterators are lazy: an output element is computed when it is requested, which keeps
 * them usable on unbounded sources. They are not thread-safe.
 */
public final class Sequences {

    private Sequences() {}

    /**
     * Scan without a start value: the first source element is emitted unchanged and seeds the
     * accumulator. Asking an empty source for its first output throws {@link EmptySourceException}.
     */
    public static <T> Iterator<T> scan(BiFunction<? super T, ? super T, ? extends T> step, Iterator<? extends T> source) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(source, "source");
        return new ScanIterator<T, T>(step, source, Function.identity(), null, false, true, true);
    }

    public static <T> Iterator<T> scan(BiFunction<? super T, ? super T, ? extends T> step, Iterable<? extends T> source) {
        return scan(step, source.iterator());
    }

    /** Scan from an explicit start value, which is emitted first. */
    public static <A, E> Iterator<A> scan(BiFunction<? super A, ? super E, ? extends A> step, Iterator<? extends E> source, A start) {
        return scan(step, source, start, true);
    }

    public static <A, E> Iterator<A> scan(BiFunction<? super A, ? super E, ? extends A> step, Iterable<? extends E> source, A start) {
        return scan(step, source.iterator(), start, true);
    }

    /**
     * Scan from an explicit start value. With {@code echoStart == false} the start value only seeds
     * the accumulator and the output has exactly one element per source element.
     */
    public static <A, E> Iterator<A> scan(BiFunction<? super A, ? super E, ? extends A> step, Iterator<? extends E> source,
                                          A start, boolean echoStart) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(source, "source");
        return new ScanIterator<A, E>(step, source, null, start, true, echoStart, false);
    }

    public static <A, E> Iterator<A> scan(BiFunction<? super A, ? super E, ? extends A> step, Iterable<? extends E> source,
                                          A start, boolean echoStart) {
        return scan(step, source.iterator(), start, echoStart);
    }

    /**
     * The no-start scan with the first output derived from the first element by {@code seed}.
     * An empty source gives an empty sequence rather than an error.
     */
    public static <A, E> Iterator<A> scanFromFirst(Function<? super E, ? extends A> seed,
                                                   BiFunction<? super A, ? super E, ? extends A> step,
                                                   Iterator<? extends E> source) {
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(source, "source");
        return new ScanIterator<A, E>(step, source, seed, null, false, true, false);
    }

    /** Consumes the whole sequence and returns its final element. */
    public static <T> T last(Iterator<? extends T> sequence) {
        if (!sequence.hasNext()) throw new EmptySequenceException();
        T item = sequence.next();
        while (sequence.hasNext()) item = sequence.next();
        return item;
    }

    public static <T> T last(Iterable<? extends T> sequence) {
        return last(sequence.iterator());
    }

    /** Yields {@code value}, then every element of {@code sequence}; the sequence is untouched until then. */
    public static <T> Iterator<T> prepend(T value, Iterator<? extends T> sequence) {
        Objects.requireNonNull(sequence, "sequence");
        return new Iterator<T>() {
            private boolean headPending = true;

            @Override
            public boolean hasNext() {
                return headPending || sequence.hasNext();
            }

            @Override
            public T next() {
                if (headPending) {
                    headPending = false;
                    return value;
                }
                return sequence.next();
            }
        };
    }

    public static <T> Iterator<T> prepend(T value, Iterable<? extends T> sequence) {
        return prepend(value, sequence.iterator());
    }

    private static final class ScanIterator<A, E> implements Iterator<A> {
        private final BiFunction<? super A, ? super E, ? extends A> step;
        private final Iterator<? extends E> source;
        private final Function<? super E, ? extends A> seed; // null when started explicitly
        private final boolean failOnEmpty;

        private A acc;
        private boolean started;
        private boolean pendingStart; // start value still to be echoed

        ScanIterator(BiFunction<? super A, ? super E, ? extends A> step, Iterator<? extends E> source,
                     Function<? super E, ? extends A> seed, A start, boolean hasStart, boolean echoStart,
                     boolean failOnEmpty) {
            this.step = step;
            this.source = source;
            this.seed = seed;
            this.failOnEmpty = failOnEmpty;
            if (hasStart) {
                this.acc = start;
                this.started = true;
                this.pendingStart = echoStart;
            }
        }

        @Override
        public boolean hasNext() {
            if (pendingStart) return true;
            if (!started && failOnEmpty && !source.hasNext()) throw new EmptySourceException();
            return source.hasNext();
        }

        @Override
        public A next() {
            if (pendingStart) {
                pendingStart = false;
                return acc;
            }
            if (!hasNext()) throw new NoSuchElementException();
            E item = source.next();
            if (!started) {
                started = true;
                acc = seed.apply(item);
            } else {
                acc = step.apply(acc, item);
            }
            return acc;
        }
    }
}

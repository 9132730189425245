import org.junit.jupiter.api.Test;

import com.scanprev.script.error.EmptySequenceException;
import com.scanprev.script.error.EmptySourceException;
import com.scanprev.script.error.ScanException;
import com.scanprev.script.seq.Sequences;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

public class SequencesTest {

    private static final BiFunction<Integer, Integer, Integer> ADD = Integer::sum;

    private static <T> List<T> drain(Iterator<T> it) {
        List<T> out = new ArrayList<>();
        it.forEachRemaining(out::add);
        return out;
    }

    /** Counts how often the source is pulled. */
    private static final class CountingIterator implements Iterator<Integer> {
        private final Iterator<Integer> inner;
        int hasNextCalls = 0;
        int nextCalls = 0;

        CountingIterator(Integer... items) {
            this.inner = Arrays.asList(items).iterator();
        }

        @Override
        public boolean hasNext() {
            hasNextCalls++;
            return inner.hasNext();
        }

        @Override
        public Integer next() {
            nextCalls++;
            return inner.next();
        }
    }

    /** 0, 1, 2, ... without end. */
    private static Iterator<Integer> naturals() {
        return new Iterator<Integer>() {
            private int n = 0;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Integer next() {
                return n++;
            }
        };
    }

    @Test
    void runningSum_withoutStart() {
        assertEquals(Arrays.asList(1, 3, 6, 10, 15), drain(Sequences.scan(ADD, Arrays.asList(1, 2, 3, 4, 5))));
    }

    @Test
    void lastOfScan_squaringProduct() {
        BiFunction<Integer, Integer, Integer> step = (p, x) -> p * x * x;
        int last = Sequences.last(Sequences.scan(step, Arrays.asList(1, -2, 3, 2)));
        assertEquals(144, last);
    }

    @Test
    void withStart_echoesStartFirst() {
        List<Integer> out = drain(Sequences.scan(ADD, Arrays.asList(1, 2, 3), 10));
        assertEquals(Arrays.asList(10, 11, 13, 16), out);
    }

    @Test
    void lengthLaw_startAddsOneElement() {
        List<Integer> src = Arrays.asList(4, 5, 6, 7);
        assertEquals(src.size(), drain(Sequences.scan(ADD, src)).size());
        assertEquals(src.size() + 1, drain(Sequences.scan(ADD, src, 0)).size());
        assertEquals(src.size(), drain(Sequences.scan(ADD, src, 0, false)).size());
    }

    @Test
    void suppressedEcho_startOnlySeeds() {
        List<Integer> out = drain(Sequences.scan(ADD, Arrays.asList(1, 2, 3), 10, false));
        assertEquals(Arrays.asList(11, 13, 16), out);
    }

    @Test
    void suppressedEcho_emptySourceGivesNothing() {
        assertTrue(drain(Sequences.scan(ADD, Collections.<Integer>emptyList(), 10, false)).isEmpty());
    }

    @Test
    void withStart_emptySourceGivesStartOnly() {
        assertEquals(Collections.singletonList(10), drain(Sequences.scan(ADD, Collections.<Integer>emptyList(), 10)));
    }

    @Test
    void lastOfScan_equalsLeftFold() {
        List<Integer> src = Arrays.asList(3, 1, 4, 1, 5, 9, 2, 6);
        BiFunction<Integer, Integer, Integer> step = (acc, x) -> acc * 2 - x;

        int fold = 7;
        for (int x : src) fold = step.apply(fold, x);

        int last = Sequences.last(Sequences.scan(step, src, 7));
        assertEquals(fold, last);
    }

    @Test
    void accumulatorMayDifferFromElementType() {
        BiFunction<String, Integer, String> step = (acc, x) -> acc + x;
        List<String> out = drain(Sequences.scan(step, Arrays.asList(1, 2, 3), ""));
        assertEquals(Arrays.asList("", "1", "12", "123"), out);
    }

    @Test
    void noStart_emptySourceThrowsOnFirstPull() {
        Iterator<Integer> out = Sequences.scan(ADD, Collections.<Integer>emptyList());
        EmptySourceException e = assertThrows(EmptySourceException.class, out::hasNext);
        assertEquals(ScanException.Phase.EVALUATION, e.phase());

        Iterator<Integer> again = Sequences.scan(ADD, Collections.<Integer>emptyList());
        assertThrows(EmptySourceException.class, again::next);
    }

    @Test
    void scan_isLazy() {
        CountingIterator src = new CountingIterator(1, 2, 3);
        Iterator<Integer> out = Sequences.scan(ADD, src);
        assertEquals(0, src.nextCalls);

        assertEquals(1, out.next());
        assertEquals(1, src.nextCalls);
        assertEquals(3, out.next());
        assertEquals(2, src.nextCalls);
    }

    @Test
    void scan_overInfiniteSource() {
        Iterator<Integer> out = Sequences.scan(ADD, naturals());
        List<Integer> firsts = new ArrayList<>();
        for (int i = 0; i < 5; i++) firsts.add(out.next());
        assertEquals(Arrays.asList(0, 1, 3, 6, 10), firsts);
    }

    @Test
    void scanFromFirst_seedsFromFirstElement() {
        Iterator<String> out = Sequences.scanFromFirst(
                (Integer x) -> "<" + x + ">",
                (String acc, Integer x) -> acc + x,
                Arrays.asList(1, 2, 3).iterator());
        assertEquals(Arrays.asList("<1>", "<1>2", "<1>23"), drain(out));
    }

    @Test
    void scanFromFirst_emptySourceGivesEmptySequence() {
        Iterator<Integer> out = Sequences.scanFromFirst(
                (Integer x) -> x, ADD, Collections.<Integer>emptyIterator());
        assertFalse(out.hasNext());
    }

    @Test
    void last_ofEmptyThrows() {
        assertThrows(EmptySequenceException.class, () -> Sequences.last(Collections.emptyList()));
    }

    @Test
    void last_consumesSinglePassIterator() {
        Iterator<Integer> it = Arrays.asList(1, 2, 3).iterator();
        int last = Sequences.last(it);
        assertEquals(3, last);
        assertFalse(it.hasNext());
    }

    @Test
    void prepend_yieldsHeadThenSequence() {
        assertEquals(Arrays.asList(15, 5, 6, 7, 8), drain(Sequences.prepend(15, Arrays.asList(5, 6, 7, 8))));
    }

    @Test
    void prepend_doesNotTouchSequenceForHead() {
        CountingIterator src = new CountingIterator(5, 6);
        Iterator<Integer> out = Sequences.prepend(15, src);

        assertTrue(out.hasNext());
        assertEquals(15, out.next());
        assertEquals(0, src.hasNextCalls);
        assertEquals(0, src.nextCalls);

        assertEquals(5, out.next());
        assertEquals(1, src.nextCalls);
    }

    @Test
    void prependThenScan_differenceAgainstPrevious() {
        BiFunction<Integer, Integer, Integer> step = (prev, el) -> el - Math.abs(prev);
        List<Integer> out = drain(Sequences.scan(step, Sequences.prepend(15, Arrays.asList(5, 6, 7, 8))));
        assertEquals(Arrays.asList(15, -10, -4, 3, 5), out);
    }
}

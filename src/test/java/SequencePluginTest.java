import org.junit.jupiter.api.Test;

import com.scanprev.script.ScanScript;
import com.scanprev.script.error.EmptySequenceException;
import com.scanprev.script.error.EmptySourceException;
import com.scanprev.script.parser.Value;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SequencePluginTest {

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Expected variable in env: " + name);
        return val;
    }

    private static final String ADD = "function add(a, b) { return a + b; }\n";

    @Test
    void scan_runningSum() {
        Map<String, Value> env = new ScanScript().run(ADD + "let s = list(scan(add, [1, 2, 3, 4, 5]));");
        assertEquals(Value.numbers(1, 3, 6, 10, 15), v(env, "s"));
    }

    @Test
    void scan_withStart_andSuppressedEcho() {
        Map<String, Value> env = new ScanScript().run(ADD
                + "let a = list(scan(add, [1, 2, 3], 10));\n"
                + "let b = list(scan(add, [1, 2, 3], 10, false));\n");
        assertEquals(Value.numbers(10, 11, 13, 16), v(env, "a"));
        assertEquals(Value.numbers(11, 13, 16), v(env, "b"));
    }

    @Test
    void lastOfScan_squaringProduct() {
        Map<String, Value> env = new ScanScript().run(
                "function step(p, x) { return p * x ** 2; }\n"
                + "let r = last(scan(step, [1, -2, 3, 2]));");
        assertEquals(144.0, v(env, "r").asNumber(), 1e-9);
    }

    @Test
    void scan_acceptsBuiltinsAsStep() {
        Map<String, Value> env = new ScanScript().run("let m = list(scan(max, [3, 1, 4, 1, 5]));");
        assertEquals(Value.numbers(3, 3, 4, 4, 5), v(env, "m"));
    }

    @Test
    void scan_overEmptyWithoutStart_fails() {
        ScanScript es = new ScanScript();
        assertThrows(EmptySourceException.class, () -> es.run(ADD + "let s = list(scan(add, []));"));
    }

    @Test
    void last_ofEmpty_fails() {
        ScanScript es = new ScanScript();
        assertThrows(EmptySequenceException.class, () -> es.run("let x = last([]);"));
    }

    @Test
    void reduce_withAndWithoutStart() {
        Map<String, Value> env = new ScanScript().run(ADD
                + "let a = reduce(add, [1, 2, 3]);\n"
                + "let b = reduce(add, [], 7);\n");
        assertEquals(6.0, v(env, "a").asNumber(), 1e-9);
        assertEquals(7.0, v(env, "b").asNumber(), 1e-9);
    }

    @Test
    void prepend_putsValueFirst() {
        Map<String, Value> env = new ScanScript().run("let p = list(prepend(0, [1, 2]));");
        assertEquals(Value.numbers(0, 1, 2), v(env, "p"));
    }

    @Test
    void range_forms() {
        Map<String, Value> env = new ScanScript().run(String.join("\n",
                "let a = list(range(4));",
                "let b = list(range(2, 5));",
                "let c = list(range(10, 0, -3));",
                "let d = list(range(0));"));
        assertEquals(Value.numbers(0, 1, 2, 3), v(env, "a"));
        assertEquals(Value.numbers(2, 3, 4), v(env, "b"));
        assertEquals(Value.numbers(10, 7, 4, 1), v(env, "c"));
        assertTrue(v(env, "d").asArray().isEmpty());
    }

    @Test
    void range_zeroStep_fails() {
        ScanScript es = new ScanScript();
        RuntimeException ex = assertThrows(RuntimeException.class, () -> es.run("let r = range(0, 5, 0);"));
        assertTrue(ex.getMessage().contains("step must not be zero"));
    }

    @Test
    void countAndTake_areLazy() {
        Map<String, Value> env = new ScanScript().run("let odd = list(take(count(1, 2), 4));");
        assertEquals(Value.numbers(1, 3, 5, 7), v(env, "odd"));
    }

    @Test
    void setAndUnion() {
        Map<String, Value> env = new ScanScript().run(String.join("\n",
                "let s = set([1, 2, 2, 3]);",
                "let u = union({1, 2}, [2, 3, 4]);",
                "let n = len(s);",
                "let m = len(u);"));
        assertEquals(3.0, v(env, "n").asNumber(), 1e-9);
        assertEquals(4.0, v(env, "m").asNumber(), 1e-9);
    }

    @Test
    void wrongArity_isReported() {
        ScanScript es = new ScanScript();
        RuntimeException ex = assertThrows(RuntimeException.class, () -> es.run("let x = take([1]);"));
        assertTrue(ex.getMessage().contains("take() expects 2 arguments, got 1"));
    }

    @Test
    void nonFunctionStep_isReported() {
        ScanScript es = new ScanScript();
        RuntimeException ex = assertThrows(RuntimeException.class, () -> es.run("let x = scan(1, [1]);"));
        assertTrue(ex.getMessage().contains("must be a function"));
    }
}

import org.junit.jupiter.api.Test;

import com.scanprev.script.ScanScript;
import com.scanprev.script.parser.Value;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScanScriptTest {

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Expected variable in env: " + name);
        return val;
    }

    @Test
    void letAndAssignment_number() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(
                "let x = 10;\n" +
                "x = x + 5;\n" +
                "let y = x;\n"
        );

        assertEquals(15.0, v(env, "x").asNumber(), 1e-9);
        assertEquals(15.0, v(env, "y").asNumber(), 1e-9);
    }

    @Test
    void arithmetic_precedence() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(
                "let a = 2 + 3 * 4;\n" +
                "let b = (2 + 3) * 4;\n" +
                "let c = 10 / 2 + 6;\n" +
                "let d = 10 % 4;\n" +
                "let e = 2 ** 3 ** 2;\n" +
                "let f = -2 ** 2;\n" +
                "let g = 2 * 3 ** 2;\n"
        );

        assertEquals(14.0, v(env, "a").asNumber(), 1e-9);
        assertEquals(20.0, v(env, "b").asNumber(), 1e-9);
        assertEquals(11.0, v(env, "c").asNumber(), 1e-9);
        assertEquals(2.0, v(env, "d").asNumber(), 1e-9);
        assertEquals(512.0, v(env, "e").asNumber(), 1e-9);
        assertEquals(-4.0, v(env, "f").asNumber(), 1e-9);
        assertEquals(18.0, v(env, "g").asNumber(), 1e-9);
    }

    @Test
    void comparisonsAndEquality() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(
                "let a = 3;\n" +
                "let b = 5;\n" +
                "let lt = a < b;\n" +
                "let ge = b >= 5;\n" +
                "let eq = (a + 2) == b;\n" +
                "let ne = a != b;\n" +
                "let arrEq = [1, 2] == [1, 2];\n"
        );

        assertTrue(v(env, "lt").asBool());
        assertTrue(v(env, "ge").asBool());
        assertTrue(v(env, "eq").asBool());
        assertTrue(v(env, "ne").asBool());
        assertTrue(v(env, "arrEq").asBool());
    }

    @Test
    void logicalOperators_shortCircuit() {
        ScanScript es = new ScanScript();

        Map<String, Value> env1 = es.run("let ok = true || doesNotExist(1);\n");
        assertTrue(v(env1, "ok").asBool());

        Map<String, Value> env2 = es.run("let ok = false && doesNotExist(1);\n");
        assertFalse(v(env2, "ok").asBool());
    }

    @Test
    void stringConcatenation_printsWholeNumbersWithoutFraction() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(
                "let s = \"n=\" + 3;\n" +
                "let t = str(2.5) + \"!\";\n"
        );

        assertEquals("n=3", v(env, "s").asString());
        assertEquals("2.5!", v(env, "t").asString());
    }

    @Test
    void ifElse_whileBreak_forLoop() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(String.join("\n",
                "let sign = 0;",
                "if (-3 < 0) { sign = -1; } else { sign = 1; }",
                "let i = 0;",
                "while (true) {",
                "    i = i + 1;",
                "    if (i >= 4) break;",
                "}",
                "let total = 0;",
                "for (let k = 0; k < 5; k = k + 1) {",
                "    total = total + k;",
                "}"
        ));

        assertEquals(-1.0, v(env, "sign").asNumber(), 1e-9);
        assertEquals(4.0, v(env, "i").asNumber(), 1e-9);
        assertEquals(10.0, v(env, "total").asNumber(), 1e-9);
        assertFalse(env.containsKey("k"));
    }

    @Test
    void userFunctions_andRecursion() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(String.join("\n",
                "function fact(n) {",
                "    if (n <= 1) return 1;",
                "    return n * fact(n - 1);",
                "}",
                "let r = fact(5);"
        ));

        assertEquals(120.0, v(env, "r").asNumber(), 1e-9);
    }

    @Test
    void functionValues_canBePassedAndCalled() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(String.join("\n",
                "function add(a, b) { return a + b; }",
                "function apply(f, x, y) { return f(x, y); }",
                "let r = apply(add, 2, 3);",
                "let m = apply(max, 2, 3);",
                "let t = typeof(add);"
        ));

        assertEquals(5.0, v(env, "r").asNumber(), 1e-9);
        assertEquals(3.0, v(env, "m").asNumber(), 1e-9);
        assertEquals("function", v(env, "t").asString());
    }

    @Test
    void spreadArguments() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(String.join("\n",
                "function add3(a, b, c) { return a + b + c; }",
                "let args = [1, 2];",
                "let r = add3(**args, 10);",
                "let m = max(**[4, 9, 2]);"
        ));

        assertEquals(13.0, v(env, "r").asNumber(), 1e-9);
        assertEquals(9.0, v(env, "m").asNumber(), 1e-9);
    }

    @Test
    void indexing_andIndexAssignment() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(String.join("\n",
                "let a = [1, 2, 3];",
                "a[0] = 10;",
                "a[len(a)] = 4;",
                "let first = a[0];",
                "let ch = \"abc\"[1];"
        ));

        assertEquals(Value.numbers(10, 2, 3, 4), v(env, "a"));
        assertEquals(10.0, v(env, "first").asNumber(), 1e-9);
        assertEquals("b", v(env, "ch").asString());
    }

    @Test
    void setLiterals_deduplicate() {
        ScanScript es = new ScanScript();
        Map<String, Value> env = es.run(String.join("\n",
                "let s = {1, 2, 2, 3, 1};",
                "let n = len(s);",
                "let e = len({});",
                "let t = typeof(s);"
        ));

        assertEquals(3.0, v(env, "n").asNumber(), 1e-9);
        assertEquals(0.0, v(env, "e").asNumber(), 1e-9);
        assertEquals("set", v(env, "t").asString());
    }

    @Test
    void initialEnvironment_isVisible() {
        ScanScript es = new ScanScript();
        Map<String, Value> initial = new LinkedHashMap<>();
        initial.put("base", Value.number(40));

        Map<String, Value> env = es.run("let answer = base + 2;", initial);
        assertEquals(42.0, v(env, "answer").asNumber(), 1e-9);
    }

    @Test
    void entryFunction_returnsValue() {
        ScanScript es = new ScanScript();
        Value out = es.run(
                "function twice(x) { return x * 2; }",
                "twice",
                Collections.singletonList(Value.number(21))
        );
        assertEquals(42.0, out.asNumber(), 1e-9);
    }

    @Test
    void entryFunction_wrongArity() {
        ScanScript es = new ScanScript();
        RuntimeException ex = assertThrows(RuntimeException.class, () -> es.run(
                "function twice(x) { return x * 2; }",
                "twice",
                Arrays.asList(Value.number(1), Value.number(2))
        ));
        assertTrue(ex.getMessage().contains("expects 1 arguments"));
    }

    @Test
    void undefinedVariable_throwsWithLine() {
        ScanScript es = new ScanScript();
        RuntimeException ex = assertThrows(RuntimeException.class, () -> es.run("let a = 1;\nlet b = c;"));
        assertTrue(ex.getMessage().contains("[line 2] Undefined variable: c"), ex.getMessage());
    }

    @Test
    void unknownFunction_throws() {
        ScanScript es = new ScanScript();
        RuntimeException ex = assertThrows(RuntimeException.class, () -> es.run("let a = nope(1);"));
        assertTrue(ex.getMessage().contains("Unknown function: nope"));
    }

    @Test
    void maxCallDepth_isEnforced() {
        ScanScript es = new ScanScript();
        es.setMaxCallDepth(10);
        RuntimeException ex = assertThrows(RuntimeException.class, () -> es.run(
                "function down(n) { return down(n + 1); }\n" +
                "let x = down(0);"
        ));
        assertTrue(ex.getMessage().contains("Max call depth exceeded"));
    }

    @Test
    void functions_onlyAtTopLevel() {
        ScanScript es = new ScanScript();
        RuntimeException ex = assertThrows(RuntimeException.class, () -> es.run(
                "if (true) { function inner() { return 1; } }"
        ));
        assertTrue(ex.getMessage().contains("only be declared at top level"));
    }

    @Test
    void builtinName_cannotBeRedefined() {
        ScanScript es = new ScanScript();
        assertThrows(RuntimeException.class, () -> es.run("function len(x) { return 0; }"));
    }

    @Test
    void hostRegisteredBuiltin_isCallable() {
        ScanScript es = new ScanScript();
        es.registerFunction("triple", (interp, args) -> Value.number(args.get(0).asNumber() * 3));
        Map<String, Value> env = es.run("let r = triple(4);");
        assertEquals(12.0, v(env, "r").asNumber(), 1e-9);
    }
}

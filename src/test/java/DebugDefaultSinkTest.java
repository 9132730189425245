import org.junit.jupiter.api.Test;

import com.scanprev.debug.Debug;
import com.scanprev.debug.Slf4jDebugSink;
import com.scanprev.script.ScanScript;
import com.scanprev.script.parser.Value;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs in its own JVM (surefire does not reuse forks), so nothing here may install a sink:
 * these tests see the hub exactly as a host does on first use.
 */
public class DebugDefaultSinkTest {

    @Test
    void firstUse_hasSlf4jSink() {
        assertNotNull(Debug.get().getSink());
        assertTrue(Debug.get().getSink() instanceof Slf4jDebugSink);
    }

    @Test
    void firstUse_scanFunctionRuns() {
        Value out = new ScanScript().run(String.join("\n",
                "@scan(prev)",
                "function sums(xs) { return [prev + el for el in xs]; }"),
                "sums",
                Collections.singletonList(Value.numbers(0, 1, 2, 3, 4)));

        assertEquals(Value.numbers(0, 1, 3, 6, 10), out);
    }

    @Test
    void firstUse_scriptErrorsKeepTheirMessage() {
        RuntimeException ex = assertThrows(RuntimeException.class,
                () -> new ScanScript().run("let a = 1;\nlet b = c;"));
        assertTrue(ex.getMessage().contains("[line 2] Undefined variable: c"), ex.getMessage());
    }
}

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.scanprev.debug.Debug;
import com.scanprev.debug.DebugLevel;
import com.scanprev.debug.DebugSink;
import com.scanprev.debug.Slf4jDebugSink;
import com.scanprev.script.ScanScript;
import com.scanprev.script.error.NameConflictException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    private static final class Event {
        final DebugLevel level;
        final String tag;
        final String message;
        final Throwable error;

        Event(DebugLevel level, String tag, String message, Throwable error) {
            this.level = level;
            this.tag = tag;
            this.message = message;
            this.error = error;
        }
    }

    private final List<Event> events = new ArrayList<>();
    private final DebugSink capture = (level, tag, message, error) -> events.add(new Event(level, tag, message, error));

    @BeforeEach
    void install() {
        Debug.get().setSink(capture);
    }

    @AfterEach
    void restore() {
        Debug.get().setSink(null);
    }

    private Event find(DebugLevel level, String tag) {
        for (Event e : events) {
            if (e.level == level && e.tag.equals(tag)) return e;
        }
        fail("No " + level + " event tagged " + tag);
        return null;
    }

    @Test
    void nullSink_restoresSlf4jDefault() {
        Debug.get().setSink(null);
        assertTrue(Debug.get().getSink() instanceof Slf4jDebugSink);
    }

    @Test
    void enabling_logsRewrites() {
        new ScanScript().compile(String.join("\n",
                "@scan(prev)",
                "function sums(xs) { return [prev + x for x in xs]; }"));

        Event rewrite = find(DebugLevel.DEBUG, "ScanRewriter");
        assertTrue(rewrite.message.contains("sums"));

        Event summary = find(DebugLevel.DEBUG, "ScanEnabler");
        assertTrue(summary.message.contains("1 builder(s) rewritten"), summary.message);
    }

    @Test
    void undefinedVariable_isReportedAsWarning() {
        assertThrows(RuntimeException.class, () -> new ScanScript().run("let a = missing;"));

        Event warn = find(DebugLevel.WARN, "Interpreter");
        assertTrue(warn.message.contains("var_not_found"));
        assertTrue(warn.message.contains("missing"));
    }

    @Test
    void failures_areLoggedAtErrorAndRethrown() {
        ScanScript es = new ScanScript();
        NameConflictException thrown = assertThrows(NameConflictException.class, () -> es.run(String.join("\n",
                "@scan(x)",
                "function f(xs) { return [x for x in xs]; }")));

        Event error = find(DebugLevel.ERROR, "ScanScript");
        assertSame(thrown, error.error);
    }
}

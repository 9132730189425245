package com.scanprev.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the ScanScript engine.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Routes to SLF4J unless a host installs its own sink; setSink(null) restores that default
 */
public final class Debug {

    // Must precede INSTANCE, whose sinkRef is initialised from it.
    private static final DebugSink DEFAULT = new Slf4jDebugSink();

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(DEFAULT);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? DEFAULT : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}

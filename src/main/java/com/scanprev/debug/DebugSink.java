package com.scanprev.debug;

/** Pluggable debug output target (SLF4J, a test collector, stdout...). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}

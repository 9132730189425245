package com.scanprev.debug;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default sink: one SLF4J logger per tag, under the "scanscript." prefix. */
public final class Slf4jDebugSink implements DebugSink {

    private static final String PREFIX = "scanscript.";

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        Logger log = LoggerFactory.getLogger(PREFIX + (tag == null ? "engine" : tag));
        switch (level) {
            case TRACE: log.trace(message, error); break;
            case DEBUG: log.debug(message, error); break;
            case INFO:  log.info(message, error); break;
            case WARN:  log.warn(message, error); break;
            default:    log.error(message, error); break;
        }
    }
}

package com.scanprev.debug;

public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}

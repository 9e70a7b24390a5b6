package com.lambdacalc.debug;

/** Severity levels understood by {@link DebugSink}. Ordered from most to least verbose. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean atLeast(DebugLevel other) {
        return ordinal() >= other.ordinal();
    }
}

package com.lambdacalc.debug;

/** Pluggable debug output target (stderr, a collecting list in tests, a file, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}

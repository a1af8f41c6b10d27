package com.basic.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for the BasicScript engine and its front ends.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 */
public final class Debug {

    // Must be initialised before INSTANCE, whose constructor reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel minLevel = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Route everything at or above {@code level} to stderr. */
    public static void useSysOut(DebugLevel level) {
        final PrintStream err = System.err;
        INSTANCE.minLevel = (level == null) ? DebugLevel.TRACE : level;
        INSTANCE.setSink((lvl, tag, message, error) -> {
            err.println("[" + lvl + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(err);
        });
    }

    public static void useSysOut() {
        useSysOut(DebugLevel.TRACE);
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public void setMinLevel(DebugLevel level) {
        this.minLevel = (level == null) ? DebugLevel.TRACE : level;
    }

    public boolean isEnabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.ordinal() >= minLevel.ordinal();
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < minLevel.ordinal()) return;
        sinkRef.get().log(level, tag, message, error);
    }
}

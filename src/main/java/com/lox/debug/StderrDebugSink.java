package com.lox.debug;

import java.io.PrintStream;

/** Writes "LEVEL tag: message" lines, dropping anything below the minimum level. */
public final class StderrDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public StderrDebugSink(DebugLevel minLevel) {
        this(System.err, minLevel);
    }

    public StderrDebugSink(PrintStream out, DebugLevel minLevel) {
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.INFO : minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.isAtLeast(minLevel)) return;
        out.println(level + " " + tag + ": " + message);
        if (error != null) error.printStackTrace(out);
    }
}

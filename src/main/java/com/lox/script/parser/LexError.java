package com.lox.script.parser;

/** A non-fatal lexical diagnostic. The scan continues past it. */
public final class LexError {
    private final int line;
    private final String message;

    public LexError(int line, String message) {
        this.line = line;
        this.message = message;
    }

    public int line() { return line; }
    public String message() { return message; }

    @Override
    public String toString() {
        return "[line " + line + "] Error: " + message;
    }
}

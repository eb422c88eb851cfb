package com.lox.script.parser;

/** Fatal evaluation error; carries the token whose evaluation failed. */
public final class RuntimeError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Token token;

    public RuntimeError(Token token, String message) {
        super(message);
        this.token = token;
    }

    public Token token() { return token; }
    public int line() { return token.line; }

    @Override
    public String toString() {
        return "[line " + token.line + "] Error: " + getMessage();
    }
}

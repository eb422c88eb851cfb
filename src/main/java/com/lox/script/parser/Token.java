package com.lox.script.parser;

/**
 * One scanned lexeme. {@code literal} is only set for NUMBER and STRING tokens.
 */
public final class Token {
    public final TokenType type;
    public final String lexeme;
    public final Value literal;
    public final int line;

    public Token(TokenType type, String lexeme, Value literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    @Override
    public String toString() {
        return lexeme.isEmpty() ? type.symbol() : lexeme;
    }
}

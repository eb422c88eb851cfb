package com.lox.script.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    COMMA(","),
    DOT("."),
    MINUS("-"),
    PLUS("+"),
    SEMICOLON(";"),
    SLASH("/"),
    STAR("*"),

    // One or two character tokens.
    BANG("!"),
    BANG_EQUAL("!="),
    EQUAL("="),
    EQUAL_EQUAL("=="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    LESS("<"),
    LESS_EQUAL("<="),

    // Literals.
    IDENTIFIER("identifier"),
    STRING("string"),
    NUMBER("number"),

    // Keywords.
    TRUE("true"),
    FALSE("false"),
    NIL("nil"),
    VAR("var"),
    PRINT("print"),

    EOF("EOF");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}

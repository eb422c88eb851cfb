package com.lox.script.parser;

/** First grammar violation of a parse. The parser does not recover from it. */
public final class ParseError extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Token token;
    private final String reason;

    public ParseError(Token token, String reason) {
        super(render(token, reason));
        this.token = token;
        this.reason = reason;
    }

    public Token token() { return token; }
    public int line() { return token.line; }

    /** The message without the line/location prefix. */
    public String reason() { return reason; }

    private static String render(Token token, String reason) {
        String where = (token.type == TokenType.EOF) ? " at end" : " at '" + token.lexeme + "'";
        return "[line " + token.line + "] Error" + where + ": " + reason;
    }
}

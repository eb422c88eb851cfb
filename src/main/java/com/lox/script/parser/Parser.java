package com.lox.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.lox.debug.Debug;
import com.lox.script.parser.Expr.Assign;
import com.lox.script.parser.Expr.Binary;
import com.lox.script.parser.Expr.Grouping;
import com.lox.script.parser.Expr.Literal;
import com.lox.script.parser.Expr.Unary;
import com.lox.script.parser.Expr.Variable;
import com.lox.script.parser.Statement.ExprStmt;
import com.lox.script.parser.Statement.PrintStmt;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Statement.VarStmt;

/**
 * Recursive-descent parser, one method per precedence level (lowest first).
 *
 * Fail-fast: the first grammar violation is thrown as a {@link ParseError}.
 *
 * Tree height is capped at {@link #MAX_DEPTH}: every nested sub-expression and every
 * left-folded operator counts one level, so neither parsing nor evaluation can
 * exhaust the call stack.
 */
public class Parser {
    private static final String TAG = "lox.parser";

    public static final int MAX_DEPTH = 512;

    private final List<Token> tokens;
    private int current = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(declaration());
        }
        Debug.get().d(TAG, "parsed " + statements.size() + " statement(s)");
        return statements;
    }

    private Stmt declaration() {
        if (match(TokenType.VAR)) return varDeclaration();
        return statement();
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        Expr.ExprInterface initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.PRINT)) return printStatement();
        return exprStatement();
    }

    private Stmt printStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after value.");
        return new PrintStmt(keyword, value);
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExprStmt(expr);
    }

    private Expr.ExprInterface expression() {
        enter(peek());
        try {
            return assignment();
        } finally {
            depth--;
        }
    }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = equality();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            enter(equals);
            Expr.ExprInterface value;
            try {
                value = assignment();
            } finally {
                depth--;
            }
            if (expr instanceof Variable) {
                Token name = ((Variable) expr).name;
                return new Assign(name, value);
            }
            throw error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        int folds = 0;
        try {
            while (match(TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL)) {
                Token op = previous();
                enter(op);
                folds++;
                Expr.ExprInterface right = comparison();
                expr = new Binary(expr, op, right);
            }
        } finally {
            depth -= folds;
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        int folds = 0;
        try {
            while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
                Token op = previous();
                enter(op);
                folds++;
                Expr.ExprInterface right = term();
                expr = new Binary(expr, op, right);
            }
        } finally {
            depth -= folds;
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        int folds = 0;
        try {
            while (match(TokenType.MINUS, TokenType.PLUS)) {
                Token op = previous();
                enter(op);
                folds++;
                Expr.ExprInterface right = factor();
                expr = new Binary(expr, op, right);
            }
        } finally {
            depth -= folds;
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        int folds = 0;
        try {
            while (match(TokenType.SLASH, TokenType.STAR)) {
                Token op = previous();
                enter(op);
                folds++;
                Expr.ExprInterface right = unary();
                expr = new Binary(expr, op, right);
            }
        } finally {
            depth -= folds;
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            enter(op);
            try {
                Expr.ExprInterface right = unary();
                return new Unary(op, right);
            } finally {
                depth--;
            }
        }
        return primary();
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Value.bool(false));
        if (match(TokenType.TRUE)) return new Literal(Value.bool(true));
        if (match(TokenType.NIL)) return new Literal(Value.nil());
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return new Grouping(expr);
        }

        throw error(peek(), "Expect expression.");
    }

    private void enter(Token at) {
        if (++depth > MAX_DEPTH) {
            depth--;
            throw error(at, "Too much nesting.");
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        ParseError err = new ParseError(token, message);
        Debug.get().d(TAG, err.getMessage());
        return err;
    }
}

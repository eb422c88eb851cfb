package com.lox.script;

import java.util.List;

import com.lox.script.parser.LexError;
import com.lox.script.parser.Token;

/** Tokens of one scan plus the lexical diagnostics it produced. */
public class ScanResult {
    private final List<Token> tokens;
    private final List<LexError> errors;

    public ScanResult(List<Token> tokens, List<LexError> errors) {
        this.tokens = tokens;
        this.errors = errors;
    }

    public List<Token> tokens() { return tokens; }
    public List<LexError> errors() { return errors; }

    /** When set, the tokens must not be parsed. */
    public boolean hadError() { return !errors.isEmpty(); }
}

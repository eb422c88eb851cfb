package com.lox.script;

import java.util.Collections;
import java.util.List;

import com.lox.script.parser.LexError;
import com.lox.script.parser.ParseError;
import com.lox.script.parser.RuntimeError;

/**
 * Outcome of one interpretation unit. Exactly one of the error fields is populated
 * when the status is not OK.
 */
public class RunResult {

    public enum Status {
        OK,
        LEX_ERROR,
        PARSE_ERROR,
        RUNTIME_ERROR
    }

    private final Status status;
    private final List<LexError> lexErrors;
    private final ParseError parseError;
    private final RuntimeError runtimeError;

    private RunResult(Status status, List<LexError> lexErrors, ParseError parseError, RuntimeError runtimeError) {
        this.status = status;
        this.lexErrors = lexErrors;
        this.parseError = parseError;
        this.runtimeError = runtimeError;
    }

    static RunResult ok() {
        return new RunResult(Status.OK, Collections.<LexError>emptyList(), null, null);
    }

    static RunResult lexFailure(List<LexError> errors) {
        return new RunResult(Status.LEX_ERROR, errors, null, null);
    }

    static RunResult parseFailure(ParseError error) {
        return new RunResult(Status.PARSE_ERROR, Collections.<LexError>emptyList(), error, null);
    }

    static RunResult runtimeFailure(RuntimeError error) {
        return new RunResult(Status.RUNTIME_ERROR, Collections.<LexError>emptyList(), null, error);
    }

    public Status status() { return status; }
    public boolean isOk() { return status == Status.OK; }
    public List<LexError> lexErrors() { return lexErrors; }
    public ParseError parseError() { return parseError; }
    public RuntimeError runtimeError() { return runtimeError; }
}

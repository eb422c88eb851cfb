package com.lox.script;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import com.lox.debug.Debug;
import com.lox.script.parser.Environment;
import com.lox.script.parser.Interpreter;
import com.lox.script.parser.LexError;
import com.lox.script.parser.Lexer;
import com.lox.script.parser.ParseError;
import com.lox.script.parser.Parser;
import com.lox.script.parser.RuntimeError;
import com.lox.script.parser.Statement.Stmt;
import com.lox.script.parser.Token;
import com.lox.script.parser.Value;

/**
 * Scanner, parser and evaluator behind one engine object.
 *
 * - scan / parse / interpret expose each stage on its own
 * - run(...) chains them and returns every failure as a {@link RunResult}
 * - one engine holds one environment, so consecutive run(...) calls share variables
 *   (the interactive prompt relies on this); reset() starts over
 */
public class LoxScript {
    private static final String TAG = "lox.engine";

    /** Receives each lexical, parse or runtime error as it surfaces. */
    public interface ErrorReporter {
        void lexError(LexError error);
        void parseError(ParseError error);
        void runtimeError(RuntimeError error);
    }

    /** Sees the intermediate results of one run(...) before the next stage starts. */
    public interface StageListener {
        /** Called for every scan, including one that reported errors. */
        default void scanned(ScanResult result) {}

        /** Called only when parsing succeeded, before evaluation. */
        default void parsed(List<Stmt> program) {}
    }

    private PrintStream output = System.out;
    private ErrorReporter errorReporter = null;
    private Interpreter interpreter;

    public LoxScript() {
        reset();
    }

    public void setOutput(PrintStream output) {
        this.output = (output == null) ? System.out : output;
        this.interpreter = new Interpreter(interpreter.environment(), this.output);
    }

    public PrintStream getOutput() { return output; }

    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    /** Drops every variable binding. */
    public void reset() {
        this.interpreter = new Interpreter(new Environment(), output);
    }

    public ScanResult scan(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        return new ScanResult(tokens, lexer.errors());
    }

    /** @throws ParseError on the first grammar violation */
    public List<Stmt> parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    /** @throws RuntimeError on the first failing statement; earlier statements keep their effects */
    public void interpret(List<Stmt> program) {
        interpreter.execute(program);
    }

    public RunResult run(String source) {
        return run(source, null);
    }

    /** Same as {@link #run(String)}, reporting each stage's output to the listener. */
    public RunResult run(String source, StageListener listener) {
        ScanResult scanned = scan(source);
        if (listener != null) listener.scanned(scanned);
        if (scanned.hadError()) {
            if (errorReporter != null) {
                for (LexError e : scanned.errors()) errorReporter.lexError(e);
            }
            return RunResult.lexFailure(scanned.errors());
        }

        List<Stmt> program;
        try {
            program = parse(scanned.tokens());
        } catch (ParseError e) {
            if (errorReporter != null) errorReporter.parseError(e);
            return RunResult.parseFailure(e);
        }
        if (listener != null) listener.parsed(program);

        try {
            interpret(program);
        } catch (RuntimeError e) {
            Debug.get().d(TAG, "run aborted: " + e);
            if (errorReporter != null) errorReporter.runtimeError(e);
            return RunResult.runtimeFailure(e);
        }
        return RunResult.ok();
    }

    /** Snapshot of the current variable bindings. */
    public Map<String, Value> globals() {
        return interpreter.environment().snapshot();
    }
}

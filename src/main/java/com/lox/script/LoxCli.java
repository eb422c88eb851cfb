package com.lox.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.lox.debug.Debug;
import com.lox.debug.DebugLevel;
import com.lox.debug.StderrDebugSink;
import com.lox.script.parser.AstPrinter;
import com.lox.script.parser.LexError;
import com.lox.script.parser.ParseError;
import com.lox.script.parser.RuntimeError;
import com.lox.script.parser.Statement.Stmt;

/**
 * Script runner and interactive prompt.
 *
 *   lox [--debug] [--ast] [--ast-json] [--tokens] [script]
 *
 * Exit codes: 0 ok, 64 usage, 65 lexical/parse error, 70 runtime error.
 */
public final class LoxCli {
    private static final String TAG = "lox.cli";

    public static final int EX_OK = 0;
    public static final int EX_USAGE = 64;
    public static final int EX_DATAERR = 65;
    public static final int EX_SOFTWARE = 70;

    private final PrintStream out;
    private final PrintStream err;
    private final boolean showAst;
    private final boolean showAstJson;
    private final boolean showTokens;
    private final LoxScript engine = new LoxScript();

    private LoxCli(Map<String, String> flags, PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        this.showAst = flags.containsKey("ast");
        this.showAstJson = flags.containsKey("ast-json");
        this.showTokens = flags.containsKey("tokens");

        engine.setOutput(out);
        engine.setErrorReporter(new LoxScript.ErrorReporter() {
            @Override
            public void lexError(LexError error) {
                report(error.line(), error.message());
            }

            @Override
            public void parseError(ParseError error) {
                err.println(error.getMessage());
            }

            @Override
            public void runtimeError(RuntimeError error) {
                report(error.line(), error.getMessage());
            }
        });
    }

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != EX_OK) System.exit(code);
    }

    /** Runs the shell and returns the process exit code. */
    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Map<String, String> flags = new HashMap<String, String>();
        List<String> positional = new ArrayList<String>();
        parseArgs(args, flags, positional);

        if (positional.size() > 1) {
            err.println("Usage: lox [--debug] [--ast] [--ast-json] [--tokens] [script]");
            return EX_USAGE;
        }
        if (flags.containsKey("debug")) {
            Debug.get().setSink(new StderrDebugSink(err, DebugLevel.DEBUG));
        }

        LoxCli cli = new LoxCli(flags, out, err);
        if (positional.size() == 1) {
            return cli.runFile(Path.of(positional.get(0)));
        }
        return cli.runPrompt(in);
    }

    private int runFile(Path path) {
        final String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            Debug.get().e(TAG, "cannot read " + path, e);
            err.println("Failed to read script file '" + path + "': " + e.getMessage());
            return EX_USAGE;
        }

        RunResult result = runUnit(source);
        switch (result.status()) {
            case LEX_ERROR:
            case PARSE_ERROR:
                return EX_DATAERR;
            case RUNTIME_ERROR:
                return EX_SOFTWARE;
            default:
                return EX_OK;
        }
    }

    /** One line per interpretation unit; errors are reported and the prompt continues. */
    private int runPrompt(InputStream in) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        while (true) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                Debug.get().e(TAG, "prompt read failed", e);
                err.println("Error while reading from prompt: " + e.getMessage());
                return EX_SOFTWARE;
            }
            if (line == null) {
                out.println();
                return EX_OK;
            }
            runUnit(line);
        }
    }

    private RunResult runUnit(String source) {
        if (!showAst && !showAstJson && !showTokens) {
            return engine.run(source);
        }
        return engine.run(source, new LoxScript.StageListener() {
            @Override
            public void scanned(ScanResult result) {
                if (showTokens) out.println(AstJson.toJson(AstJson.tokens(result.tokens()), false));
            }

            @Override
            public void parsed(List<Stmt> program) {
                if (showAst) out.println(new AstPrinter().print(program));
                if (showAstJson) out.println(AstJson.toJson(AstJson.program(program), true));
            }
        });
    }

    private void report(int line, String message) {
        err.println("[line " + line + "] Error: " + message);
    }

    private static void parseArgs(String[] args, Map<String, String> flags, List<String> positional) {
        for (String a : args) {
            if (a.startsWith("--") && a.indexOf('=') >= 0) {
                int i = a.indexOf('=');
                flags.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                flags.put(a.substring(2), "true");
            } else {
                positional.add(a);
            }
        }
    }
}

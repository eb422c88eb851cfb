import com.lox.debug.Debug;
import com.lox.script.LoxCli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class LoxCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @AfterEach
    void resetDebugSink() {
        Debug.get().setSink(null);
    }

    private int cli(String stdin, String... args) {
        return LoxCli.run(
                args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"); }
    private String stderr() { return err.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"); }

    private Path script(String source) throws Exception {
        Path p = dir.resolve("main.lox");
        Files.writeString(p, source, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void fileRun_ok() throws Exception {
        Path p = script("var a = 1;\nvar b = 2;\nprint a + b;\n");
        assertEquals(LoxCli.EX_OK, cli("", p.toString()));
        assertEquals("3\n", stdout());
        assertEquals("", stderr());
    }

    @Test
    void fileRun_parseError_exits65() throws Exception {
        Path p = script("print 1");
        assertEquals(LoxCli.EX_DATAERR, cli("", p.toString()));
        assertEquals("[line 1] Error at end: Expect ';' after value.\n", stderr());
    }

    @Test
    void fileRun_lexError_exits65() throws Exception {
        Path p = script("print 1;\nprint \"open");
        assertEquals(LoxCli.EX_DATAERR, cli("", p.toString()));
        assertEquals("[line 2] Error: Unterminated string.\n", stderr());
        assertEquals("", stdout());
    }

    @Test
    void fileRun_runtimeError_exits70() throws Exception {
        Path p = script("print 1;\nprint nope;\nprint 2;");
        assertEquals(LoxCli.EX_SOFTWARE, cli("", p.toString()));
        assertEquals("1\n", stdout());
        assertEquals("[line 2] Error: Undefined variable: nope\n", stderr());
    }

    @Test
    void usageErrors_exit64() {
        assertEquals(LoxCli.EX_USAGE, cli("", "a.lox", "b.lox"));
        assertTrue(stderr().startsWith("Usage:"));

        assertEquals(LoxCli.EX_USAGE, cli("", dir.resolve("missing.lox").toString()));
        assertTrue(stderr().contains("Failed to read script file"));
    }

    @Test
    void prompt_keepsBindings_andSurvivesErrors() {
        int code = cli("var a = 2;\nprint a * 3;\nprint b;\nprint (;\nprint a;\n");
        assertEquals(LoxCli.EX_OK, code);

        String o = stdout();
        assertTrue(o.startsWith("> "));
        assertTrue(o.contains("6\n"));
        assertTrue(o.contains("2\n"));
        assertTrue(o.indexOf("6\n") < o.lastIndexOf("2\n"));

        String e = stderr();
        assertTrue(e.contains("[line 1] Error: Undefined variable: b"));
        assertTrue(e.contains("[line 1] Error at ';': Expect expression."));
    }

    @Test
    void astFlag_printsTreeBeforeRunning() throws Exception {
        Path p = script("print 1 + 2 * 3;");
        assertEquals(LoxCli.EX_OK, cli("", "--ast", p.toString()));
        assertEquals("(print (+ 1 (* 2 3)))\n7\n", stdout());
    }

    @Test
    void dumpMode_scansAndParsesOnlyOnce() throws Exception {
        Path p = script("print 2 * 3;");
        assertEquals(LoxCli.EX_OK, cli("", "--debug", "--ast", p.toString()));
        assertEquals("(print (* 2 3))\n6\n", stdout());

        String e = stderr();
        String parsedLine = "DEBUG lox.parser: parsed 1 statement(s)";
        assertEquals(e.indexOf(parsedLine), e.lastIndexOf(parsedLine), e);
        assertTrue(e.contains(parsedLine), e);
    }

    @Test
    void dumpMode_reportsErrorsOnce() throws Exception {
        Path p = script("print 1;\nprint -\"s\";");
        assertEquals(LoxCli.EX_SOFTWARE, cli("", "--ast", p.toString()));
        assertEquals("(print 1)\n(print (- s))\n1\n", stdout());
        assertEquals("[line 2] Error: Invalid operand: \"s\". Expected a number\n", stderr());

        Path bad = script("print (;");
        assertEquals(LoxCli.EX_DATAERR, cli("", "--tokens", bad.toString()));
        assertEquals(1, stderr().split("Expect expression", -1).length - 1);
    }

    @Test
    void tokensFlag_printsJsonTokenDump() throws Exception {
        Path p = script("print 1;");
        assertEquals(LoxCli.EX_OK, cli("", "--tokens", p.toString()));
        String o = stdout();
        assertTrue(o.startsWith("[{\"type\":\"PRINT\""));
        assertTrue(o.endsWith("1\n"));
    }
}

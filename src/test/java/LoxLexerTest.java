import com.lox.script.parser.LexError;
import com.lox.script.parser.Lexer;
import com.lox.script.parser.Token;
import com.lox.script.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LoxLexerTest {

    private static List<Token> scan(String source) {
        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.tokenize();
        assertFalse(lexer.hasError(), "unexpected lexical error in: " + source);
        return tokens;
    }

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : tokens) out.add(t.type);
        return out;
    }

    @Test
    void punctuationOnly_yieldsOneTokenPerCharacterPlusEof() {
        for (String src : new String[] { "(){},.-+;*", "((()))", "+-*/", ";", "" }) {
            List<Token> tokens = scan(src);
            assertEquals(src.length() + 1, tokens.size(), "for: " + src);
            assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type);
        }
    }

    @Test
    void twoCharacterOperators_areMerged() {
        assertEquals(
                List.of(TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                        TokenType.BANG, TokenType.EQUAL, TokenType.LESS, TokenType.GREATER, TokenType.EOF),
                types(scan("!= == <= >= ! = < >")));
    }

    @Test
    void lookaheadMismatch_reprocessesNextCharacter() {
        assertEquals(List.of(TokenType.BANG_EQUAL, TokenType.EQUAL, TokenType.EOF), types(scan("!==")));
        assertEquals(List.of(TokenType.LESS, TokenType.BANG, TokenType.EOF), types(scan("<!")));
        assertEquals(List.of(TokenType.GREATER, TokenType.MINUS, TokenType.NUMBER, TokenType.EOF), types(scan(">-1")));
    }

    @Test
    void lineComment_runsToNewline_andSlashAloneIsDivision() {
        List<Token> tokens = scan("1 // ignored ( \" tokens\n2 / 3");
        assertEquals(List.of(TokenType.NUMBER, TokenType.NUMBER, TokenType.SLASH, TokenType.NUMBER, TokenType.EOF),
                types(tokens));
        assertEquals(1, tokens.get(0).line);
        assertEquals(2, tokens.get(1).line);
    }

    @Test
    void commentAtEndOfInput() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.EOF), types(scan("7 // trailing")));
    }

    @Test
    void numbers_parseAsDoubles() {
        List<Token> tokens = scan("123 45.67 0.5");
        assertEquals(123.0, tokens.get(0).literal.asNumber(), 0.0);
        assertEquals(45.67, tokens.get(1).literal.asNumber(), 1e-12);
        assertEquals(0.5, tokens.get(2).literal.asNumber(), 0.0);
        assertEquals("45.67", tokens.get(1).lexeme);
    }

    @Test
    void trailingDot_isNotPartOfNumber() {
        List<Token> tokens = scan("1.");
        assertEquals(List.of(TokenType.NUMBER, TokenType.DOT, TokenType.EOF), types(tokens));
        assertEquals("1", tokens.get(0).lexeme);

        assertEquals(List.of(TokenType.DOT, TokenType.NUMBER, TokenType.EOF), types(scan(".5")));
        assertEquals(List.of(TokenType.NUMBER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.EOF), types(scan("1.x")));
    }

    @Test
    void strings_keepEmbeddedNewlines_andCountLines() {
        List<Token> tokens = scan("\"a\nb\" x");
        assertEquals(TokenType.STRING, tokens.get(0).type);
        assertEquals("a\nb", tokens.get(0).literal.asString());
        assertEquals("\"a\nb\"", tokens.get(0).lexeme);
        assertEquals(1, tokens.get(0).line);
        assertEquals(2, tokens.get(1).line);
        assertEquals(2, tokens.get(2).line);
    }

    @Test
    void unterminatedString_setsErrorAndEmitsNoStringToken() {
        Lexer lexer = new Lexer("\"abc");
        List<Token> tokens = lexer.tokenize();

        assertTrue(lexer.hasError());
        assertEquals(List.of(TokenType.EOF), types(tokens));
        assertEquals(1, lexer.errors().size());
        assertEquals("Unterminated string.", lexer.errors().get(0).message());
        assertEquals(1, lexer.errors().get(0).line());
    }

    @Test
    void unterminatedString_isReportedAtTheLineItBegan() {
        Lexer lexer = new Lexer("1\n\"abc\ndef\nghi");
        List<Token> tokens = lexer.tokenize();

        assertEquals(2, lexer.errors().get(0).line());
        assertEquals(List.of(TokenType.NUMBER, TokenType.EOF), types(tokens));
        assertEquals(4, tokens.get(1).line);
    }

    @Test
    void identifiersAndKeywords() {
        List<Token> tokens = scan("true false nil var print foo _bar x1 printer");
        assertEquals(
                List.of(TokenType.TRUE, TokenType.FALSE, TokenType.NIL, TokenType.VAR, TokenType.PRINT,
                        TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                        TokenType.EOF),
                types(tokens));
        assertEquals("_bar", tokens.get(6).lexeme);
        assertNull(tokens.get(5).literal);
    }

    @Test
    void unexpectedCharacters_areReported_andScanningContinues() {
        Lexer lexer = new Lexer("1 @ 2\n# 3");
        List<Token> tokens = lexer.tokenize();

        assertTrue(lexer.hasError());
        assertEquals(List.of(TokenType.NUMBER, TokenType.NUMBER, TokenType.NUMBER, TokenType.EOF), types(tokens));

        List<LexError> errors = lexer.errors();
        assertEquals(2, errors.size());
        assertEquals(1, errors.get(0).line());
        assertEquals(2, errors.get(1).line());
        assertTrue(errors.get(0).message().contains("@"));
        assertEquals("[line 2] Error: Unexpected character '#'.", errors.get(1).toString());
    }

    @Test
    void whitespaceIsDiscarded_andEofCarriesFinalLine() {
        List<Token> tokens = scan(" \t\r\na\n\n");
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.EOF), types(tokens));
        assertEquals(2, tokens.get(0).line);
        assertEquals(4, tokens.get(1).line);
        assertEquals("", tokens.get(1).lexeme);
        assertEquals("EOF", tokens.get(1).toString());
    }

    @Test
    void declarationProgram_tokenCount() {
        List<Token> tokens = scan("var a = 1; var b = 2; print a + b;");
        // three five-token statements plus EOF
        assertEquals(16, tokens.size());
        assertEquals(TokenType.PRINT, tokens.get(10).type);
    }
}

import org.junit.jupiter.api.Test;

import com.scanprev.script.ScanScript;
import com.scanprev.script.parser.Lexer;
import com.scanprev.script.parser.Token;
import com.scanprev.script.parser.TokenType;
import com.scanprev.script.parser.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void doubleStar_isOneToken() {
        assertEquals(Arrays.asList(TokenType.IDENTIFIER, TokenType.DOUBLE_STAR, TokenType.NUMBER,
                TokenType.STAR, TokenType.IDENTIFIER, TokenType.EOF), types("a ** 2 * b"));
        assertEquals(Arrays.asList(TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.DOUBLE_STAR,
                TokenType.IDENTIFIER, TokenType.RIGHT_PAREN, TokenType.EOF), types("f(**args)"));
    }

    @Test
    void twoCharOperators_winOverOneChar() {
        assertEquals(Arrays.asList(TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL, TokenType.EQUAL_EQUAL,
                TokenType.BANG_EQUAL, TokenType.AND_AND, TokenType.OR_OR, TokenType.EQUAL, TokenType.BANG,
                TokenType.EOF), types("<= >= == != && || = !"));
    }

    @Test
    void keywords_areNotIdentifiers() {
        assertTrue(Lexer.isIdentifier("prev"));
        assertTrue(Lexer.isIdentifier("_acc2"));
        assertFalse(Lexer.isIdentifier("in"));
        assertFalse(Lexer.isIdentifier("function"));
        assertFalse(Lexer.isIdentifier("2x"));
        assertFalse(Lexer.isIdentifier(""));
    }

    @Test
    void numbers_withFractionAndExponent() {
        List<Token> tokens = new Lexer("1.5 2e3 4E-1 2e").tokenize();
        assertEquals(1.5, tokens.get(0).literal);
        assertEquals(2000.0, tokens.get(1).literal);
        assertEquals(0.4, tokens.get(2).literal);
        assertEquals(2.0, tokens.get(3).literal);
        assertEquals(TokenType.IDENTIFIER, tokens.get(4).type);
    }

    @Test
    void strings_takeEitherQuoteAndEscapes() {
        Map<String, Value> env = new ScanScript().run(String.join("\n",
                "let a = 'it\\'s';",
                "let b = \"x\\ty\";",
                "let c = len(\"a\\\\b\");"));

        assertEquals("it's", env.get("a").asString());
        assertEquals("x\ty", env.get("b").asString());
        assertEquals(3.0, env.get("c").asNumber(), 1e-9);
    }

    @Test
    void comments_areSkippedAndKeepLineCount() {
        List<Token> tokens = new Lexer("// one\n/* two\nthree */ let x").tokenize();
        assertEquals(TokenType.LET, tokens.get(0).type);
        assertEquals(3, tokens.get(0).line);
    }

    @Test
    void errors_carryTheLine() {
        RuntimeException unterminated = assertThrows(RuntimeException.class,
                () -> new Lexer("let a = 1;\nlet s = \"open").tokenize());
        assertTrue(unterminated.getMessage().startsWith("[line 2] Unterminated string"), unterminated.getMessage());

        RuntimeException stray = assertThrows(RuntimeException.class, () -> new Lexer("a & b").tokenize());
        assertTrue(stray.getMessage().contains("Unexpected character: &"), stray.getMessage());

        RuntimeException comment = assertThrows(RuntimeException.class, () -> new Lexer("/* never closed").tokenize());
        assertTrue(comment.getMessage().contains("Unterminated comment"), comment.getMessage());
    }
}

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.basic.script.parser.IllegalCharError;
import com.basic.script.parser.Lexer;
import com.basic.script.parser.Token;
import com.basic.script.parser.TokenType;

public class BasicLexerTest {

    private static List<Token> lex(String text) {
        return new Lexer("<test>", text).tokenize();
    }

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : tokens) out.add(t.type());
        return out;
    }

    @Test
    void numbersAndOperators_withSpans() {
        List<Token> tokens = lex("1 + 2.5");

        assertEquals(List.of(TokenType.INT, TokenType.PLUS, TokenType.FLOAT, TokenType.EOF), types(tokens));
        assertEquals("1", tokens.get(0).value);
        assertEquals("2.5", tokens.get(2).value);

        assertEquals(0, tokens.get(0).posStart.col());
        assertEquals(1, tokens.get(0).posEnd.col());
        assertEquals(4, tokens.get(2).posStart.col());
        assertEquals(7, tokens.get(2).posEnd.col());
        assertEquals(7, tokens.get(3).posStart.index());
    }

    @Test
    void twoCharacterOperators() {
        List<Token> tokens = lex("-> ** == != <= >= - * = < >");
        assertEquals(List.of(
                TokenType.ARROW, TokenType.POW, TokenType.EE, TokenType.NE, TokenType.LTE, TokenType.GTE,
                TokenType.MINUS, TokenType.MUL, TokenType.EQ, TokenType.LT, TokenType.GT, TokenType.EOF),
                types(tokens));
    }

    @Test
    void keywordsIncludeLogicalOperators() {
        List<Token> tokens = lex("var x = !a && b || c");

        assertTrue(tokens.get(0).matches(TokenType.KEYWORD, "var"));
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertTrue(tokens.get(3).matches(TokenType.KEYWORD, "!"));
        assertTrue(tokens.get(5).matches(TokenType.KEYWORD, "&&"));
        assertTrue(tokens.get(7).matches(TokenType.KEYWORD, "||"));
        assertTrue(Lexer.isKeyword("elif"));
        assertFalse(Lexer.isKeyword("null"));
    }

    @Test
    void stringEscapes() {
        List<Token> tokens = lex("\"a\\nb\\t\\\"c\"");
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("a\nb\t\"c", tokens.get(0).value);
    }

    @Test
    void unterminatedString_runsToEndOfInput() {
        List<Token> tokens = lex("\"abc");
        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("abc", tokens.get(0).value);
        assertEquals(TokenType.EOF, tokens.get(1).type());
    }

    @Test
    void secondDotEndsNumber() {
        List<Token> tokens = lex("1..2");
        assertEquals(List.of(TokenType.FLOAT, TokenType.FLOAT, TokenType.EOF), types(tokens));
        assertEquals("1.", tokens.get(0).value);
        assertEquals(".2", tokens.get(1).value);
    }

    @Test
    void newlineAdvancesRowAndResetsColumn() {
        List<Token> tokens = lex("1\n  2");
        assertEquals(1, tokens.get(1).posStart.row());
        assertEquals(2, tokens.get(1).posStart.col());
    }

    @Test
    void illegalCharacter() {
        IllegalCharError e = assertThrows(IllegalCharError.class, () -> lex("1 $ 2"));
        assertEquals("Illegal Character", e.errorName());
        assertEquals("'$'", e.details());
        assertEquals(2, e.posStart().col());
    }

    @Test
    void singleAmpersandOrPipe_isIllegal() {
        IllegalCharError amp = assertThrows(IllegalCharError.class, () -> lex("a & b"));
        assertEquals("'&' (expected '&&')", amp.details());

        IllegalCharError pipe = assertThrows(IllegalCharError.class, () -> lex("a | b"));
        assertEquals("'|' (expected '||')", pipe.details());
    }

    @Test
    void loneDot_isIllegal() {
        IllegalCharError e = assertThrows(IllegalCharError.class, () -> lex("."));
        assertEquals("'.'", e.details());
    }

    @Test
    void tokenSpans_reconstructNonWhitespaceText() {
        String text = "var f = fun (a, b) -> [a ** 2, \"x\"] >= 1.5 && !b || c != 3\n- 4 / (5)";
        StringBuilder rebuilt = new StringBuilder();
        for (Token t : lex(text)) {
            if (t.type() == TokenType.EOF) break;
            rebuilt.append(text, t.posStart.index(), t.posEnd.index());
        }
        assertEquals(text.replaceAll("\\s+", ""), rebuilt.toString());
    }

    @Test
    void emptyInput_yieldsOnlyEof() {
        assertEquals(List.of(TokenType.EOF), types(lex("")));
    }
}

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.basic.script.BasicScript;
import com.basic.script.parser.Expr;
import com.basic.script.parser.InvalidSyntaxError;
import com.basic.script.parser.TokenType;

public class BasicParserTest {

    private final BasicScript engine = new BasicScript();

    private Expr.ExprInterface parse(String text) {
        return engine.parse("<test>", text);
    }

    private String syntaxError(String text) {
        InvalidSyntaxError e = assertThrows(InvalidSyntaxError.class, () -> parse(text));
        assertEquals("Invalid Syntax", e.errorName());
        return e.details();
    }

    @Test
    void multiplicationBindsTighterThanAddition() {
        Expr.BinOp root = assertInstanceOf(Expr.BinOp.class, parse("1 + 2 * 3"));
        assertEquals(TokenType.PLUS, root.operator.type());
        Expr.BinOp right = assertInstanceOf(Expr.BinOp.class, root.right);
        assertEquals(TokenType.MUL, right.operator.type());
    }

    @Test
    void subtractionIsLeftAssociative() {
        Expr.BinOp root = assertInstanceOf(Expr.BinOp.class, parse("5 - 2 - 1"));
        assertInstanceOf(Expr.BinOp.class, root.left);
        assertInstanceOf(Expr.NumberLiteral.class, root.right);
    }

    @Test
    void logicalOperatorsBindLooserThanComparison() {
        Expr.BinOp root = assertInstanceOf(Expr.BinOp.class, parse("1 < 2 && 3 > 2"));
        assertTrue(root.operator.matches(TokenType.KEYWORD, "&&"));
        assertInstanceOf(Expr.BinOp.class, root.left);
        assertInstanceOf(Expr.BinOp.class, root.right);
    }

    @Test
    void notAppliesToWholeComparison() {
        Expr.UnaryOp root = assertInstanceOf(Expr.UnaryOp.class, parse("!1 == 2"));
        assertInstanceOf(Expr.BinOp.class, root.operand);
    }

    @Test
    void powerAcceptsSignedExponent() {
        Expr.BinOp root = assertInstanceOf(Expr.BinOp.class, parse("2 ** -1"));
        assertEquals(TokenType.POW, root.operator.type());
        assertInstanceOf(Expr.UnaryOp.class, root.right);
    }

    @Test
    void binOpSpanCoversBothOperands() {
        Expr.ExprInterface e = parse("12 + 345");
        assertEquals(0, e.posStart().col());
        assertEquals(8, e.posEnd().col());
    }

    @Test
    void compoundForms() {
        assertInstanceOf(Expr.VarAssign.class, parse("var a = 1"));
        assertInstanceOf(Expr.If.class, parse("if 1 then 2 elif 3 then 4 else 5"));
        assertInstanceOf(Expr.For.class, parse("for i = 0 to 10 step 2 then i"));
        assertInstanceOf(Expr.While.class, parse("while 0 then 1"));
        assertInstanceOf(Expr.FuncDef.class, parse("fun add(a, b) -> a + b"));
        assertInstanceOf(Expr.FuncDef.class, parse("fun () -> 1"));
        assertInstanceOf(Expr.ListLiteral.class, parse("[]"));
        assertInstanceOf(Expr.Call.class, parse("f(1, [2, 3])"));
    }

    @Test
    void trailingToken_expectsOperator() {
        assertTrue(syntaxError("1 2").startsWith("Expected '+', '-', '*', '/'"));
    }

    @Test
    void nothingConsumed_reportsBroadestMessage() {
        assertTrue(syntaxError(")").startsWith("Expected 'var', 'if', 'for', 'while', 'fun', int, float"));
    }

    @Test
    void deeperErrorWins_onceTokensConsumed() {
        assertEquals("Expected int, float, identifier, '+', '-', '(', '[', 'if', 'for', 'while', 'fun'",
                syntaxError("1 +"));
    }

    @Test
    void specificMessages() {
        assertEquals("Expected identifier", syntaxError("var = 1"));
        assertEquals("Expected '='", syntaxError("var a 1"));
        assertEquals("Expected 'then'", syntaxError("if 1 2"));
        assertEquals("Expected 'to'", syntaxError("for i = 0 then 1"));
        assertEquals("Expected ',' or ')'", syntaxError("fun (a -> a"));
        assertEquals("Expected '->'", syntaxError("fun f(a) a"));
        assertEquals("Expected ',' or ')'", syntaxError("f(1"));
        assertEquals("Expected ',' or ']'", syntaxError("[1, 2"));
        assertEquals("Expected ')'", syntaxError("(1 + 2"));
    }

    @Test
    void syntaxErrorPointsAtOffendingToken() {
        InvalidSyntaxError e = assertThrows(InvalidSyntaxError.class, () -> parse("1 2"));
        assertEquals(2, e.posStart().col());
        assertEquals(3, e.posEnd().col());
    }
}

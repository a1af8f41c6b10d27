import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.basic.script.BasicScript;
import com.basic.script.parser.BasicError;
import com.basic.script.parser.ExecutionState;
import com.basic.script.parser.RTError;

public class BasicErrorFormatTest {

    private final BasicScript engine = new BasicScript();

    private BasicError fail(ExecutionState session, String text) {
        return assertThrows(BasicError.class, () -> engine.run(session, "<stdin>", text));
    }

    @Test
    void illegalCharacter_format() {
        BasicError e = fail(engine.newSession(), "1 # 2");
        assertEquals(
                "Illegal Character: ''#''\n" +
                "\tFile: '<stdin>' row(0), col(2)\n" +
                "\n" +
                "1 # 2\n" +
                "  ^\n",
                e.format());
    }

    @Test
    void invalidSyntax_format() {
        BasicError e = fail(engine.newSession(), "12 34");
        String out = e.format();

        assertTrue(out.startsWith("Invalid Syntax: 'Expected '+', '-'"));
        assertTrue(out.contains("\tFile: '<stdin>' row(0), col(3)\n\n"));
        assertTrue(out.endsWith("12 34\n   ^^\n"));
    }

    @Test
    void runtimeError_topLevelTraceback() {
        BasicError e = fail(engine.newSession(), "1/0");
        assertEquals(
                "Traceback (most recent call last):\n" +
                "\tFile: '<stdin>' row(0), col(2), in <program>\n" +
                "Runtime Error: 'Division by zero'\n" +
                "1/0\n" +
                "  ^\n",
                e.format());
    }

    @Test
    void runtimeError_insideFunction_listsEachFrame() {
        ExecutionState session = engine.newSession();
        engine.run(session, "<stdin>", "fun f(x) -> x / 0");
        engine.run(session, "<stdin>", "fun g() -> f(1)");

        RTError e = assertThrows(RTError.class, () -> engine.run(session, "<stdin>", "g()"));
        assertEquals("f", e.frame().name());
        assertEquals(2, e.frame().depth());

        String tb = e.traceback();
        assertEquals(
                "Traceback (most recent call last):\n" +
                "\tFile: '<stdin>' row(0), col(16), in f\n" +
                "\tFile: '<stdin>' row(0), col(11), in g\n" +
                "\tFile: '<stdin>' row(0), col(0), in <program>\n",
                tb);
        assertTrue(e.format().endsWith("fun f(x) -> x / 0\n                ^\n"));
    }

    @Test
    void multiLineSpan_underlinesEveryLine() {
        BasicError e = fail(engine.newSession(), "\"a\"\n- \"b\"");
        assertTrue(e.format().endsWith(
                "\"a\"\n" +
                "^^^\n" +
                "- \"b\"\n" +
                "^^^^^\n"));
    }
}

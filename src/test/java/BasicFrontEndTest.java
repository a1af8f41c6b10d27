import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.basic.script.BasicCli;
import com.basic.script.BasicRepl;
import com.basic.script.BasicScript;
import com.basic.script.parser.ExecutionState;
import com.basic.script.parser.RTError;
import com.basic.script.parser.Value;

public class BasicFrontEndTest {

    private static String replay(BasicRepl repl, String input) throws Exception {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(buf, true, StandardCharsets.UTF_8)) {
            repl.loop(new StringReader(input), out);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Test
    void repl_keepsStateBetweenLines_andSurvivesErrors() throws Exception {
        BasicRepl repl = new BasicRepl(new BasicScript(), "> ", "<stdin>", false);
        String out = replay(repl, "var a = 2\na * 3\n1/0\na + 1\n:quit\nnever\n");

        assertTrue(out.contains("> 6\n"));
        assertTrue(out.contains("Runtime Error: 'Division by zero'"));
        assertTrue(out.contains("> 3\n"));
        assertFalse(out.contains("never"));
        assertEquals(2L, repl.session().lookup("a").asLong());
    }

    @Test
    void repl_printsSelfContainingList() throws Exception {
        BasicRepl repl = new BasicRepl(new BasicScript(), "", "<stdin>", false);
        String out = replay(repl, "var a = []\nappend(a, a)\n:vars\n");
        assertTrue(out.contains("[[...]]\n"), out);
        assertTrue(out.contains("\"[...]\""), out);
    }

    @Test
    void repl_blankLinesIgnored() throws Exception {
        BasicRepl repl = new BasicRepl(new BasicScript(), "> ", "<stdin>", false);
        String out = replay(repl, "\n   \n\"s\"\n");
        assertEquals("> > > \"s\"\n> ", out);
    }

    @Test
    void repl_jsonMode() throws Exception {
        BasicRepl repl = new BasicRepl(new BasicScript(), "", "<stdin>", true);
        String out = replay(repl, "[1, \"a\", null]\n");
        assertEquals("[1,\"a\",null]\n", out);
    }

    @Test
    void repl_varsCommandDumpsGlobals() throws Exception {
        BasicRepl repl = new BasicRepl(new BasicScript(), "", "<stdin>", false);
        String out = replay(repl, "var answer = 42\n:vars\n");
        assertTrue(out.contains("\"answer\""));
        assertTrue(out.contains("42"));
    }

    @Test
    void cli_runsNonBlankLinesInOneSession() {
        BasicScript engine = new BasicScript();
        ExecutionState session = engine.newSession();

        List<Value> results = BasicCli.runLines(engine, session, "script.bas",
                List.of("var x = 1", "", "x + 1"));

        assertEquals(2, results.size());
        assertEquals(2L, results.get(1).asLong());
    }

    @Test
    void cli_stopsAtFirstError() {
        BasicScript engine = new BasicScript();
        ExecutionState session = engine.newSession();

        assertThrows(RTError.class, () -> BasicCli.runLines(engine, session, "script.bas",
                List.of("var x = 1", "y", "var x = 2")));
        assertEquals(1L, session.lookup("x").asLong());
    }
}

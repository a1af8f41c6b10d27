import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.basic.script.BasicScript;
import com.basic.script.parser.ExecutionState;
import com.basic.script.parser.RTError;
import com.basic.script.parser.Value;

public class BasicBuiltinsTest {

    private BasicScript engine;
    private ExecutionState session;

    @BeforeEach
    void setUp() {
        engine = new BasicScript();
        session = engine.newSession();
    }

    private Value run(String text) {
        return engine.run(session, "<test>", text);
    }

    @Test
    void typePredicates() {
        assertTrue(run("isNumber(1)").asBool());
        assertTrue(run("isNumber(1.5)").asBool());
        assertFalse(run("isNumber(\"1\")").asBool());
        assertTrue(run("isString(\"a\")").asBool());
        assertTrue(run("isList([])").asBool());
        assertFalse(run("isList(\"[]\")").asBool());
        assertTrue(run("isFunction(len)").asBool());
        assertTrue(run("isFunction(fun () -> 1)").asBool());
        assertFalse(run("isFunction(1)").asBool());
    }

    @Test
    void typeOfAndLen() {
        assertEquals("number", run("typeOf(1.5)").asString());
        assertEquals("boolean", run("typeOf(true)").asString());
        assertEquals("null", run("typeOf(null)").asString());
        assertEquals("function", run("typeOf(typeOf)").asString());
        assertEquals(3L, run("len(\"abc\")").asLong());
        assertEquals(2L, run("len([1, [2, 3]])").asLong());
    }

    @Test
    void append_mutatesEverySharedReference() {
        run("var a = [1]");
        run("var b = a");
        Value returned = run("append(a, 2)");

        assertEquals("[1, 2]", returned.toString());
        assertEquals("[1, 2]", session.lookup("b").toString());
    }

    @Test
    void pop_removesAndReturnsElement() {
        run("var l = [1, 2, 3]");
        assertEquals(1L, run("pop(l, 0)").asLong());
        assertEquals("[2, 3]", session.lookup("l").toString());

        RTError e = assertThrows(RTError.class, () -> run("pop(l, 9)"));
        assertEquals(RTError.Kind.ILLEGAL_OPERATION, e.kind());
        assertEquals("Element at this index could not be removed from list because index is out of bounds",
                e.details());
    }

    @Test
    void extend_appendsAllElements() {
        run("var a = [1]");
        run("extend(a, [2, 3])");
        assertEquals("[1, 2, 3]", session.lookup("a").toString());

        run("extend(a, a)");
        assertEquals(6L, run("len(a)").asLong());
    }

    @Test
    void wrongArgumentType_isIllegalOperationAtCallSite() {
        RTError e = assertThrows(RTError.class, () -> run("append(1, 2)"));
        assertEquals(RTError.Kind.ILLEGAL_OPERATION, e.kind());
        assertEquals("append() expects a list, got number", e.details());
        assertEquals(0, e.posStart().col());
        assertEquals("append", e.frame().name());
    }

    @Test
    void builtinArity() {
        RTError e = assertThrows(RTError.class, () -> run("len()"));
        assertEquals(RTError.Kind.ARITY_MISMATCH, e.kind());
        assertEquals("1 too few args passed into 'len' (expected 1, got 0)", e.details());
    }

    @Test
    void hostRegisteredFunction_visibleInNewSessions() {
        engine.registerFunction("double", List.of("n"), args -> Value.integer(args.get(0).asLong() * 2));
        ExecutionState fresh = engine.newSession();

        assertEquals(14L, engine.run(fresh, "<test>", "double(7)").asLong());
        assertEquals("<built-in function double>", engine.run(fresh, "<test>", "double").toString());
        assertTrue(engine.functions().containsKey("double"));
    }

    @Test
    void nullFromNative_becomesNullValue() {
        engine.registerFunction("nothing", List.of(), args -> null);
        ExecutionState fresh = engine.newSession();
        assertEquals(Value.Type.NULL, engine.run(fresh, "<test>", "nothing()").getType());
    }
}

package com.basic.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import com.basic.debug.Debug;
import com.basic.debug.DebugLevel;
import com.basic.script.parser.BasicError;
import com.basic.script.parser.ExecutionState;
import com.basic.script.parser.Value;
import com.basic.script.util.ValueJson;

/**
 * Interactive line-at-a-time front end.
 *
 * Each line is one top-level expression run against a single session, so variables and
 * functions persist between lines. Errors are printed and the loop continues.
 *
 * Flags:
 *   --prompt="basic> "   --source=&lt;stdin&gt;   --json   --debug
 *
 * Commands:
 *   :vars   dump global bindings as JSON
 *   :quit   exit
 */
public final class BasicRepl {
    private static final String TAG = "basic.repl";

    private final BasicScript engine;
    private final ExecutionState session;
    private final String prompt;
    private final String sourceName;
    private final boolean json;

    public BasicRepl(BasicScript engine, String prompt, String sourceName, boolean json) {
        this.engine = engine;
        this.session = engine.newSession();
        this.prompt = prompt;
        this.sourceName = sourceName;
        this.json = json;
    }

    public static void main(String[] args) throws IOException {
        Map<String, String> flags = parseArgs(args);

        if (flags.containsKey("debug")) {
            Debug.useSysOut(DebugLevel.TRACE);
        }

        BasicRepl repl = new BasicRepl(
                new BasicScript(),
                flags.getOrDefault("prompt", "basic> "),
                flags.getOrDefault("source", "<stdin>"),
                flags.containsKey("json"));

        repl.loop(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
    }

    public void loop(Reader input, PrintStream out) throws IOException {
        BufferedReader br = new BufferedReader(input);
        while (true) {
            out.print(prompt);
            out.flush();

            String line = br.readLine();
            if (line == null) break;
            if (!handle(line, out)) break;
        }
    }

    /** Processes one input line. Returns false when the session should end. */
    public boolean handle(String line, PrintStream out) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return true;

        if (trimmed.equals(":quit")) return false;
        if (trimmed.equals(":vars")) {
            out.println(ValueJson.write(ValueJson.toJson(session.snapshot()), true));
            return true;
        }

        try {
            Value result = engine.run(session, sourceName, line);
            out.println(render(result));
        } catch (BasicError e) {
            Debug.get().w(TAG, e.errorName() + ": " + e.details());
            out.println(e.format());
        }
        return true;
    }

    public ExecutionState session() {
        return session;
    }

    private String render(Value result) {
        return json ? ValueJson.write(ValueJson.toJson(result), false) : String.valueOf(result);
    }

    /**
     * Minimal arg parser:
     *   --key=value  -> key:value
     *   --flag       -> flag:true
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }
}

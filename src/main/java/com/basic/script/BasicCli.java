package com.basic.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.basic.script.parser.BasicError;
import com.basic.script.parser.ExecutionState;
import com.basic.script.parser.Value;

/**
 * Runs a script file: every non-blank line is one top-level expression, evaluated in
 * order against a single session. Stops at the first error.
 */
public final class BasicCli {

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: BasicCli <script-file>");
            System.exit(2);
        }

        final Path scriptPath = Path.of(args[0]);
        final List<String> lines;
        try {
            lines = Files.readAllLines(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(System.err);
            System.exit(3);
            return;
        }

        BasicScript engine = new BasicScript();
        ExecutionState session = engine.newSession();
        String sourceName = scriptPath.getFileName().toString();

        try {
            for (Value v : runLines(engine, session, sourceName, lines)) {
                System.out.println(v);
            }
        } catch (BasicError e) {
            System.err.println(e.format());
            System.exit(1);
        }
    }

    /** Evaluates each non-blank line; results are returned in order. */
    public static List<Value> runLines(BasicScript engine, ExecutionState session, String sourceName, List<String> lines) {
        List<Value> out = new ArrayList<>();
        for (String line : lines) {
            if (line.trim().isEmpty()) continue;
            out.add(engine.run(session, sourceName, line));
        }
        return out;
    }

    private BasicCli() {}
}

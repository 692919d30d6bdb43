package com.vela.script.repl;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vela.script.VelaScript;
import com.vela.script.json.AstJson;
import com.vela.script.json.ValueJson;
import com.vela.script.parser.Ast.Program;
import com.vela.script.parser.Environment;
import com.vela.script.parser.ScriptException;
import com.vela.script.parser.Value;

/**
 * Line-at-a-time read loop.
 *
 * Every line is parsed and evaluated against one global environment that lives as
 * long as the loop, so declarations carry over between lines. A failing line is
 * reported and the loop keeps going. A blank line, "exit", "quit" or end of input
 * ends the session.
 */
public final class VelaRepl {

    private static final Logger log = LoggerFactory.getLogger(VelaRepl.class);

    private final VelaScript engine;
    private final ReplSettings settings;
    private final BufferedReader in;
    private final PrintStream out;
    private final Environment global;

    public VelaRepl(VelaScript engine, ReplSettings settings, BufferedReader in, PrintStream out) {
        this.engine = engine;
        this.settings = settings;
        this.in = in;
        this.out = out;
        this.global = engine.newGlobalEnvironment();
    }

    // -----------------------------
    // Main
    // -----------------------------
    public static void main(String[] args) throws IOException {
        ReplSettings settings = ReplSettings.load();
        log.info("Starting Vela REPL ({})", settings);

        VelaScript engine = settings.createEngine(System.out);
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        System.out.println("Vela REPL. Type ':help' for commands, a blank line or 'exit' to quit.");
        new VelaRepl(engine, settings, stdin, System.out).loop();
    }

    /** The environment every line is evaluated in. */
    public Environment global() {
        return global;
    }

    // -----------------------------
    // REPL Loop
    // -----------------------------
    public void loop() throws IOException {
        while (true) {
            out.print(settings.prompt);
            out.flush();

            String line = in.readLine();
            if (line == null) break; // EOF
            line = line.trim();
            if (line.isEmpty() || "exit".equals(line) || "quit".equals(line)) break;

            try {
                if (":help".equals(line)) {
                    printHelp();
                } else if (":env".equals(line)) {
                    out.println(ValueJson.pretty(ValueJson.toJson(global.variables())));
                } else if (line.startsWith(":ast")) {
                    String source = line.substring(":ast".length()).trim();
                    out.println(ValueJson.pretty(AstJson.toJson(engine.parse(source))));
                } else if (line.startsWith(":")) {
                    out.println("Unknown command: " + line + " (type ':help')");
                } else {
                    evalLine(line);
                }
            } catch (ScriptException e) {
                out.println("ERROR: " + e.getMessage());
            }
        }
        log.debug("REPL session ended");
    }

    private void evalLine(String line) {
        Program program = engine.parse(line);
        if (settings.echoAst) out.println(program);
        Value result = engine.eval(program, global);
        out.println(result);
    }

    private void printHelp() {
        String nl = System.lineSeparator();
        out.println(
                "Commands:" + nl +
                "  <source>        Parse and evaluate one line, print the result." + nl +
                "  :ast <source>   Print the syntax tree of <source> as JSON." + nl +
                "  :env            Print the global variables as JSON." + nl +
                "  :help           Show this help." + nl +
                "  exit / quit     Leave (so does a blank line or end of input)."
        );
    }
}

package com.vela.script;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.vela.script.parser.Ast;
import com.vela.script.parser.Ast.CallExpr;
import com.vela.script.parser.Ast.FnDeclaration;
import com.vela.script.parser.Ast.Identifier;
import com.vela.script.parser.Ast.Program;
import com.vela.script.parser.BuiltinRegistry;
import com.vela.script.parser.Environment;
import com.vela.script.parser.EvalException;
import com.vela.script.parser.Interpreter;
import com.vela.script.parser.Parser;
import com.vela.script.parser.ScriptException;
import com.vela.script.parser.Value;

/**
 * Core Vela engine.
 *
 * - Statements: let / const declarations, fn declarations, expressions, comments
 * - Expressions: + - * / % on 64-bit integers, assignment, calls, object literals
 * - Types: number, bool, object, function, native function, null
 * - Functions return the value of their last statement; there is no control flow
 * - Native functions come from a {@link BuiltinRegistry} (print and a stub time()
 *   by default) and from {@link #registerFunction}
 */
public class VelaScript {
    private static final Logger log = LoggerFactory.getLogger(VelaScript.class);

    /** Functional interface for native functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args, Environment env);
    }

    /** Hook that sees every failure before it is thrown to the host. */
    public interface ErrorReporter {
        void report(String phase, ScriptException error);
    }

    private final BuiltinRegistry builtins;
    private int maxCallDepth = Interpreter.DEFAULT_MAX_CALL_DEPTH;
    private int maxNestingDepth = Parser.DEFAULT_MAX_NESTING_DEPTH;
    private ErrorReporter errorReporter;

    public VelaScript() {
        this(System.out);
    }

    public VelaScript(PrintStream out) {
        this(BuiltinRegistry.standard(out));
    }

    public VelaScript(BuiltinRegistry builtins) {
        this.builtins = builtins;
    }

    public void setMaxCallDepth(int depth) { this.maxCallDepth = depth; }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setMaxNestingDepth(int depth) { this.maxNestingDepth = depth; }

    public void setErrorReporter(ErrorReporter reporter) { this.errorReporter = reporter; }

    /** Only affects environments created after this call. */
    public void registerFunction(String name, BuiltinFunction fn) { builtins.register(name, fn); }

    public BuiltinRegistry builtins() { return builtins; }

    /** Fresh root scope seeded with the constants and the registered builtins. */
    public Environment newGlobalEnvironment() {
        return Environment.global(builtins);
    }

    public Program parse(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        try {
            return new Parser(maxNestingDepth).produceAst(source);
        } catch (ScriptException e) {
            fail("parse", e);
            throw e;
        }
    }

    public Value eval(Program program, Environment env) {
        try {
            return new Interpreter(maxCallDepth).evaluate(program, env);
        } catch (ScriptException e) {
            fail("eval", e);
            throw e;
        }
    }

    /** Parses and evaluates {@code source} against {@code env}, returning the last statement's value. */
    public Value eval(String source, Environment env) {
        return eval(parse(source), env);
    }

    /** Evaluates {@code source} in a fresh global scope. */
    public Value run(String source) {
        return eval(source, newGlobalEnvironment());
    }

    /**
     * Calls the function bound to {@code name} in {@code env} with already evaluated
     * arguments, the way a script call would.
     */
    public Value invoke(Environment env, String name, List<Value> args) {
        Value fn = env.lookup(name);
        if (fn.type != Value.Type.FUNC && fn.type != Value.Type.NATIVE) {
            EvalException e = new EvalException(EvalException.Kind.VALUE_NOT_A_FUNCTION,
                    name + " is bound to " + fn.type + ", which is not a function");
            fail("invoke", e);
            throw e;
        }

        // Bind the arguments in a scratch scope so the call goes through the evaluator.
        Environment scratch = env.childScope();
        List<Ast.Node> argNodes = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            String slot = "$arg" + i;
            scratch.declare(slot, args.get(i), true);
            argNodes.add(new Identifier(slot));
        }
        CallExpr call = new CallExpr(new Identifier(name), argNodes);
        return eval(new Program(List.of(call)), scratch);
    }

    /**
     * Side-effect-free check: does {@code source} declare a top-level function
     * named {@code fnName}?
     */
    public boolean hasUserFunction(String source, String fnName) {
        if (source == null || fnName == null || fnName.trim().isEmpty()) return false;
        for (Ast.Node node : parse(source).body) {
            if (node instanceof FnDeclaration && fnName.equals(((FnDeclaration) node).name)) return true;
        }
        return false;
    }

    private void fail(String phase, ScriptException e) {
        log.debug("{} failed: {}", phase, e.getMessage());
        if (errorReporter != null) errorReporter.report(phase, e);
    }
}

package com.vela.script.parser;

import java.util.List;

/**
 * A function declared in script code.
 *
 * The closure is the environment that was active at declaration time, held by
 * reference: later changes to that scope are visible when the function runs.
 */
public class UserFunction {
    public final String name;
    public final List<String> parameters;
    final List<Ast.Node> body;
    final Environment closure;

    UserFunction(String name, List<String> parameters, List<Ast.Node> body, Environment closure) {
        this.name = name;
        this.parameters = parameters;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public String toString() {
        return "fn " + name + "(" + String.join(", ", parameters) + ")";
    }
}

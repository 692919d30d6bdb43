package com.vela.script.parser;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One lexical scope plus a link to its enclosing scope.
 *
 * A name may be declared once per scope; declaring it again in a child scope
 * shadows the outer binding. Constants cannot be reassigned from any scope that
 * resolves to them.
 */
public class Environment {

    public final Environment parent;

    private final Map<String, Value> variables = new LinkedHashMap<>();
    private final Set<String> constants = new HashSet<>();

    public Environment(Environment parent) {
        this.parent = parent;
    }

    /**
     * Creates the root scope: {@code true}, {@code false}, {@code null} and every
     * function in {@code builtins}, all as constants.
     */
    public static Environment global(BuiltinRegistry builtins) {
        Environment global = new Environment(null);
        global.declare("true", Value.bool(true), true);
        global.declare("false", Value.bool(false), true);
        global.declare("null", Value.nil(), true);

        builtins.functions().forEach((name, fn) ->
                global.declare(name, Value.nativeFn(new NativeFunction(name, fn)), true));
        return global;
    }

    /** New empty scope whose parent is this one. */
    public Environment childScope() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------

    public Value declare(String name, Value value, boolean constant) {
        if (variables.containsKey(name)) {
            throw EnvironmentException.redeclare(name);
        }
        if (constant) constants.add(name);
        variables.put(name, value);
        return value;
    }

    public Value assign(String name, Value value) {
        Environment env = resolve(name);
        if (env.constants.contains(name)) {
            throw EnvironmentException.reassign(name);
        }
        env.variables.put(name, value);
        return value;
    }

    public Value lookup(String name) {
        return resolve(name).variables.get(name);
    }

    /** The nearest scope, starting at this one, that declares {@code name}. */
    public Environment resolve(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.variables.containsKey(name)) return env;
        }
        throw EnvironmentException.notFound(name);
    }

    public boolean exists(String name) {
        for (Environment env = this; env != null; env = env.parent) {
            if (env.variables.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsInCurrentScope(String name) {
        return variables.containsKey(name);
    }

    public boolean isConstant(String name) {
        return resolve(name).constants.contains(name);
    }

    /** Read-only view of this scope's own bindings, in declaration order. */
    public Map<String, Value> variables() {
        return Collections.unmodifiableMap(variables);
    }
}

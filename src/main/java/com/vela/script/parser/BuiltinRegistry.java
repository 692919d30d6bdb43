package com.vela.script.parser;

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.vela.script.VelaScript.BuiltinFunction;

/**
 * Ordered table of native functions seeded into a global {@link Environment}.
 *
 * Registering a name twice replaces the earlier function, which is how hosts swap
 * out the placeholder {@code time} clock.
 */
public final class BuiltinRegistry {

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    private BuiltinRegistry() {}

    public static BuiltinRegistry empty() {
        return new BuiltinRegistry();
    }

    /**
     * {@code print} writes each argument on its own line to {@code out};
     * {@code time} is a stub that always returns 0.
     */
    public static BuiltinRegistry standard(PrintStream out) {
        BuiltinRegistry registry = new BuiltinRegistry();
        registry.register("print", (args, env) -> {
            for (Value arg : args) out.println(arg);
            return Value.nil();
        });
        registry.register("time", (args, env) -> Value.number(0));
        return registry;
    }

    public BuiltinRegistry register(String name, BuiltinFunction fn) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("Builtin name must not be empty");
        if (fn == null) throw new IllegalArgumentException("Builtin '" + name + "' has no implementation");
        functions.put(name, fn);
        return this;
    }

    public boolean has(String name) {
        return functions.containsKey(name);
    }

    public Map<String, BuiltinFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }
}

package com.vela.script.parser;

import com.vela.script.VelaScript.BuiltinFunction;

/** A host-provided function bound to the name it was registered under. */
public final class NativeFunction {
    public final String name;
    final BuiltinFunction function;

    NativeFunction(String name, BuiltinFunction function) {
        this.name = name;
        this.function = function;
    }

    @Override
    public String toString() {
        return "native fn " + name;
    }
}

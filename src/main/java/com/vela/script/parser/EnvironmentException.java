package com.vela.script.parser;

public class EnvironmentException extends ScriptException {

    public enum Kind { REDECLARE_VARIABLE, REASSIGN_CONSTANT, VARIABLE_NOT_FOUND }

    public final Kind kind;
    public final String name;

    private EnvironmentException(Kind kind, String name, String message) {
        super(message);
        this.kind = kind;
        this.name = name;
    }

    static EnvironmentException redeclare(String name) {
        return new EnvironmentException(Kind.REDECLARE_VARIABLE, name, "Cannot redeclare variable " + name);
    }

    static EnvironmentException reassign(String name) {
        return new EnvironmentException(Kind.REASSIGN_CONSTANT, name, "Cannot reassign to constant " + name);
    }

    static EnvironmentException notFound(String name) {
        return new EnvironmentException(Kind.VARIABLE_NOT_FOUND, name,
                "Cannot resolve " + name + " since it doesn't exist");
    }
}

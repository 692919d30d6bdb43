package com.vela.script.parser;

public class EvalException extends ScriptException {

    public enum Kind {
        INVALID_ASSIGNMENT,
        INVALID_OPERATOR,
        VALUE_NOT_A_FUNCTION,
        ARITY_MISMATCH,
        DIVISION_BY_ZERO,
        NUMERIC_OVERFLOW,
        INVALID_NUMBER,
        CALL_DEPTH_EXCEEDED,
        /** A native function received an argument of the wrong type. */
        INVALID_ARGUMENT,
        UNEXPECTED_STATEMENT
    }

    public final Kind kind;

    public EvalException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EvalException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}

package com.vela.script.parser;

/**
 * Common supertype of every failure the engine reports to its host.
 *
 * Each layer throws its own subtype carrying a {@code Kind} enum, so hosts can
 * branch on the failure without matching message text.
 */
public abstract class ScriptException extends RuntimeException {

    protected ScriptException(String message) {
        super(message);
    }

    protected ScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}

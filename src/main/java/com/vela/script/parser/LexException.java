package com.vela.script.parser;

/** Thrown by {@link Lexer} at the first character it cannot classify. */
public class LexException extends ScriptException {
    public final int character;
    public final int line;
    public final int column;

    LexException(int character, int line, int column) {
        super("[line " + line + ":" + column + "] Unexpected character '"
                + new String(Character.toChars(character)) + "'");
        this.character = character;
        this.line = line;
        this.column = column;
    }
}

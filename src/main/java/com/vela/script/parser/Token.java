package com.vela.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final int line;
    public final int column;

    Token(TokenType type, String lexeme, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
    }

    public TokenType type() { return type; }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}

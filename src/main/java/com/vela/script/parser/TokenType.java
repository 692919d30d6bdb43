package com.vela.script.parser;

public enum TokenType {
    // Literals
    IDENTIFIER, NUMBER,

    // + - * / %
    BINARY_OPERATOR,

    // Line and block comments, delimiters stripped
    COMMENT,

    // Punctuation
    LEFT_PAREN, RIGHT_PAREN,
    LEFT_BRACE, RIGHT_BRACE,
    LEFT_BRACKET, RIGHT_BRACKET,
    COLON, SEMICOLON, COMMA, EQUALS, DOT,

    // Keywords
    LET, CONST, FN,

    // Reserved, never accepted by the parser
    STRUCT, ENUM, RETURN, IF, ELSE,

    EOF
}

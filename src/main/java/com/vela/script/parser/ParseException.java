package com.vela.script.parser;

public class ParseException extends ScriptException {

    public enum Kind {
        /** The next token had the wrong type. */
        EXPECTED_TOKEN,
        /** Tokens ran out where more input was needed. */
        UNEXPECTED_END,
        UNSUPPORTED_TOKEN,
        DOT_WITHOUT_IDENTIFIER,
        CONST_VALUE_REQUIRED,
        PARAMETER_NOT_IDENTIFIER,
        NESTING_TOO_DEEP
    }

    public final Kind kind;
    /** The offending token, never null. */
    public final Token token;
    /** Only set for {@link Kind#EXPECTED_TOKEN}. */
    public final TokenType expected;

    ParseException(Kind kind, Token token, TokenType expected, String message) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.expected = expected;
    }

    static ParseException expected(TokenType expected, Token actual, String context) {
        return new ParseException(Kind.EXPECTED_TOKEN, actual, expected,
                "[line " + actual.line + "] Expected " + expected + " but got " + actual.type + ": " + context);
    }

    static ParseException unexpectedEnd(Token eof, String context) {
        return new ParseException(Kind.UNEXPECTED_END, eof, null,
                "[line " + eof.line + "] Unexpected end of input: " + context);
    }

    static ParseException of(Kind kind, Token token, String message) {
        return new ParseException(kind, token, null, message);
    }
}

package com.vela.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Lexer {
    private final int[] source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("let", TokenType.LET);
        map.put("const", TokenType.CONST);
        map.put("fn", TokenType.FN);
        map.put("struct", TokenType.STRUCT);
        map.put("enum", TokenType.ENUM);
        map.put("return", TokenType.RETURN);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source.codePoints().toArray();
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", line, column));
        return tokens;
    }

    private void scanToken() {
        int c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '=': addToken(TokenType.EQUALS); break;
            case '.': addToken(TokenType.DOT); break;
            case '+': case '-': case '*': case '%':
                addToken(TokenType.BINARY_OPERATOR);
                break;
            case '/':
                if (match('/')) lineComment();
                else if (match('*')) blockComment();
                else addToken(TokenType.BINARY_OPERATOR);
                break;
            default:
                if (Character.isWhitespace(c)) break;
                if (Character.isDigit(c)) number();
                else if (Character.isLetter(c)) identifier();
                else throw new LexException(c, startLine, startColumn);
        }
    }

    private void lineComment() {
        while (!isAtEnd() && peek() != '\n') advance();
        addToken(TokenType.COMMENT, text(start + 2, current));
    }

    // Unterminated block comments run to end of input.
    private void blockComment() {
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                String body = text(start + 2, current);
                advance();
                advance();
                addToken(TokenType.COMMENT, body);
                return;
            }
            advance();
        }
        addToken(TokenType.COMMENT, text(start + 2, current));
    }

    private void number() {
        while (!isAtEnd() && Character.isDigit(peek())) advance();
        addToken(TokenType.NUMBER);
    }

    private void identifier() {
        while (!isAtEnd() && (Character.isLetter(peek()) || peek() == '_')) advance();
        String text = text(start, current);
        addToken(keywords.getOrDefault(text, TokenType.IDENTIFIER), text);
    }

    private boolean isAtEnd() { return current >= source.length; }

    private int advance() {
        int c = source[current++];
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(int expected) {
        if (isAtEnd() || source[current] != expected) return false;
        advance();
        return true;
    }

    private int peek() { return isAtEnd() ? '\0' : source[current]; }
    private int peekNext() { return (current + 1 >= source.length) ? '\0' : source[current + 1]; }

    private String text(int from, int to) {
        return new String(source, from, to - from);
    }

    private void addToken(TokenType type) { addToken(type, text(start, current)); }

    private void addToken(TokenType type, String lexeme) {
        tokens.add(new Token(type, lexeme, startLine, startColumn));
    }
}

package com.vela.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.vela.script.parser.Ast.AssignmentExpr;
import com.vela.script.parser.Ast.BinaryExpr;
import com.vela.script.parser.Ast.CallExpr;
import com.vela.script.parser.Ast.Comment;
import com.vela.script.parser.Ast.FnDeclaration;
import com.vela.script.parser.Ast.Identifier;
import com.vela.script.parser.Ast.MemberExpr;
import com.vela.script.parser.Ast.Node;
import com.vela.script.parser.Ast.NumericLiteral;
import com.vela.script.parser.Ast.ObjectLiteral;
import com.vela.script.parser.Ast.Program;
import com.vela.script.parser.Ast.Property;
import com.vela.script.parser.Ast.VarDeclaration;

/**
 * Recursive descent parser. Precedence, lowest first:
 *
 * <pre>
 *   statement   : comment | let/const declaration | fn declaration | expression
 *   assignment  : object_or_additive ( '=' assignment )?
 *   additive    : multiplicative ( ('+' | '-') multiplicative )*
 *   multiplicative : call_member ( ('*' | '/' | '%') call_member )*
 *   call_member : member ( '(' args ')' )*
 *   member      : primary ( '.' identifier | '[' expression ']' )*
 *   primary     : identifier | number | '(' expression ')'
 * </pre>
 *
 * Comment tokens become {@link Comment} nodes at statement positions and are
 * skipped everywhere else.
 *
 * Tree height is bounded by {@code maxNestingDepth}: every nested expression, nested
 * function body and every link of an operator, call or member chain counts one level,
 * so the recursive passes over the tree stay within the Java stack.
 */
public class Parser {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final int maxNestingDepth;
    private List<Token> tokens = List.of();
    private int current = 0;
    private int depth = 0;

    public Parser() { this(DEFAULT_MAX_NESTING_DEPTH); }

    public Parser(int maxNestingDepth) { this.maxNestingDepth = maxNestingDepth; }

    /** Tokenizes and parses {@code source}. The first error aborts the whole call. */
    public Program produceAst(String source) {
        tokens = Lexer.tokenize(source);
        current = 0;
        depth = 0;

        List<Node> body = new ArrayList<>();
        while (rawPeek().type != TokenType.EOF) {
            body.add(statement());
        }
        return new Program(body);
    }

    // -------------------------
    // Statements
    // -------------------------

    private Node statement() {
        Token raw = rawPeek();
        if (raw.type == TokenType.COMMENT) {
            current++;
            return new Comment(raw.lexeme);
        }

        if (match(TokenType.LET, TokenType.CONST)) {
            Node declaration = varDeclaration(previous());
            terminate();
            return declaration;
        }

        if (match(TokenType.FN)) {
            Node function = fnDeclaration();
            match(TokenType.SEMICOLON);
            return function;
        }

        Node expr = expression();
        terminate();
        return expr;
    }

    // ';' may be left out before '}' and at end of input.
    private void terminate() {
        if (match(TokenType.SEMICOLON)) return;
        if (check(TokenType.RIGHT_BRACE) || isAtEnd()) return;
        throw ParseException.expected(TokenType.SEMICOLON, peek(), "Expected semicolon after statement");
    }

    private Node varDeclaration(Token keyword) {
        boolean constant = keyword.type == TokenType.CONST;
        String identifier = consume(TokenType.IDENTIFIER,
                "Expected identifier name after let or const keyword").lexeme;

        if (check(TokenType.SEMICOLON)) {
            if (constant) {
                throw ParseException.of(ParseException.Kind.CONST_VALUE_REQUIRED, peek(),
                        "A value is required for const assignment");
            }
            return new VarDeclaration(false, identifier, null);
        }

        consume(TokenType.EQUALS, "Expected equals token after identifier");
        return new VarDeclaration(constant, identifier, expression());
    }

    private Node fnDeclaration() {
        enter();
        try {
            return fnDeclarationBody();
        } finally {
            depth--;
        }
    }

    private Node fnDeclarationBody() {
        String name = consume(TokenType.IDENTIFIER, "Expected function name following fn keyword").lexeme;

        List<String> parameters = new ArrayList<>();
        for (Node arg : arguments()) {
            if (!(arg instanceof Identifier)) {
                throw ParseException.of(ParseException.Kind.PARAMETER_NOT_IDENTIFIER, previous(),
                        "Expected parameter of " + name + " to be an identifier, got " + arg);
            }
            parameters.add(((Identifier) arg).name);
        }

        consume(TokenType.LEFT_BRACE, "Expected function body following declaration");
        List<Node> body = new ArrayList<>();
        while (rawPeek().type != TokenType.RIGHT_BRACE && rawPeek().type != TokenType.EOF) {
            body.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "Closing brace expected after function body");

        return new FnDeclaration(name, parameters, body, false);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Node expression() {
        enter();
        try {
            return assignment();
        } finally {
            depth--;
        }
    }

    private Node assignment() {
        Node left = objectOrAdditive();
        if (match(TokenType.EQUALS)) {
            Node value = expression();
            return new AssignmentExpr(left, value);
        }
        return left;
    }

    private Node objectOrAdditive() {
        if (check(TokenType.LEFT_BRACE)) return objectLiteral();
        return additive();
    }

    /** { foo: foo, bar, baz: null, } */
    private Node objectLiteral() {
        consume(TokenType.LEFT_BRACE, "Expected '{' to open object literal");
        List<Property> properties = new ArrayList<>();

        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            String key = consume(TokenType.IDENTIFIER, "Object literal identifier expected").lexeme;

            if (match(TokenType.COMMA)) {
                properties.add(new Property(key, null));
                continue;
            }
            if (check(TokenType.RIGHT_BRACE)) {
                properties.add(new Property(key, null));
                continue;
            }

            consume(TokenType.COLON, "Missing colon after identifier in object expression");
            properties.add(new Property(key, expression()));

            if (!check(TokenType.RIGHT_BRACE)) {
                consume(TokenType.COMMA, "Expected comma or closing brace after property");
            }
        }

        consume(TokenType.RIGHT_BRACE, "Object literal is missing a closing brace");
        return new ObjectLiteral(properties);
    }

    private Node additive() {
        Node left = multiplicative();
        int links = 0;
        try {
            while (checkOperator("+", "-")) {
                links++;
                enter();
                String operator = advance().lexeme;
                Node right = multiplicative();
                left = new BinaryExpr(left, right, operator);
            }
            return left;
        } finally {
            depth -= links;
        }
    }

    private Node multiplicative() {
        Node left = callMember();
        int links = 0;
        try {
            while (checkOperator("*", "/", "%")) {
                links++;
                enter();
                String operator = advance().lexeme;
                Node right = callMember();
                left = new BinaryExpr(left, right, operator);
            }
            return left;
        } finally {
            depth -= links;
        }
    }

    /** foo(a)(b) */
    private Node callMember() {
        Node expr = member();
        int links = 0;
        try {
            while (check(TokenType.LEFT_PAREN)) {
                links++;
                enter();
                expr = new CallExpr(expr, arguments());
            }
            return expr;
        } finally {
            depth -= links;
        }
    }

    private List<Node> arguments() {
        consume(TokenType.LEFT_PAREN, "Expected open parenthesis");
        List<Node> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Missing closing parenthesis in argument list");
        return args;
    }

    private Node member() {
        Node object = primary();
        int links = 0;
        try {
            while (true) {
                if (match(TokenType.DOT)) {
                    if (!check(TokenType.IDENTIFIER)) {
                        throw ParseException.of(ParseException.Kind.DOT_WITHOUT_IDENTIFIER, peek(),
                                "[line " + peek().line + "] Dot operator requires an identifier on its right-hand side");
                    }
                    links++;
                    enter();
                    object = new MemberExpr(object, primary(), false);
                } else if (match(TokenType.LEFT_BRACKET)) {
                    links++;
                    enter();
                    Node property = expression();
                    consume(TokenType.RIGHT_BRACKET, "Missing closing bracket in computed member expression");
                    object = new MemberExpr(object, property, true);
                } else {
                    break;
                }
            }
            return object;
        } finally {
            depth -= links;
        }
    }

    private Node primary() {
        Token t = peek();
        if (t.type == TokenType.EOF) {
            throw ParseException.unexpectedEnd(t, "Expected an expression");
        }
        advance();

        switch (t.type) {
            case IDENTIFIER:
                return new Identifier(t.lexeme);
            case NUMBER:
                return new NumericLiteral(t.lexeme);
            case LEFT_PAREN: {
                Node value = expression();
                consume(TokenType.RIGHT_PAREN, "No right paren inside expression");
                return value;
            }
            default:
                throw ParseException.of(ParseException.Kind.UNSUPPORTED_TOKEN, t,
                        "[line " + t.line + "] Unsupported token " + t.type + " '" + t.lexeme + "'");
        }
    }

    // Counts one level; the caller gives it back when the construct is done.
    private void enter() {
        if (++depth > maxNestingDepth) {
            throw ParseException.of(ParseException.Kind.NESTING_TOO_DEEP, peek(),
                    "[line " + peek().line + "] Nesting exceeds " + maxNestingDepth + " levels");
        }
    }

    // -------------------------
    // Token cursor
    // -------------------------

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean checkOperator(String... operators) {
        if (!check(TokenType.BINARY_OPERATOR)) return false;
        String lexeme = peek().lexeme;
        for (String op : operators) {
            if (op.equals(lexeme)) return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        if (isAtEnd()) throw ParseException.unexpectedEnd(peek(), message);
        throw ParseException.expected(type, peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        int i = skipComments(current);
        Token t = tokens.get(i);
        if (t.type != TokenType.EOF) current = i + 1;
        return t;
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }

    private Token peek() { return tokens.get(skipComments(current)); }

    // The stream always ends in EOF, so this cannot run past the end.
    private int skipComments(int i) {
        while (tokens.get(i).type == TokenType.COMMENT) i++;
        return i;
    }

    private Token rawPeek() { return tokens.get(current); }

    private Token previous() { return tokens.get(current - 1); }
}

package com.vela.script.parser;

import java.util.List;

/**
 * Syntax tree produced by {@link Parser}.
 *
 * Statements and expressions share one node hierarchy: every node can appear as a
 * statement and evaluates to a value. Child lists are unmodifiable and nodes are
 * never shared between parents.
 */
public final class Ast {

    private Ast() {}

    public interface Node {
        <R> R accept(Visitor<R> visitor);
    }

    public interface Visitor<R> {
        R visitProgram(Program node);
        R visitNumericLiteral(NumericLiteral node);
        R visitIdentifier(Identifier node);
        R visitComment(Comment node);
        R visitObjectLiteral(ObjectLiteral node);
        R visitVarDeclaration(VarDeclaration node);
        R visitFnDeclaration(FnDeclaration node);
        R visitAssignmentExpr(AssignmentExpr node);
        R visitMemberExpr(MemberExpr node);
        R visitCallExpr(CallExpr node);
        R visitBinaryExpr(BinaryExpr node);
    }

    // -------------------------
    // Top level
    // -------------------------

    public static final class Program implements Node {
        public final List<Node> body;

        public Program(List<Node> body) {
            this.body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgram(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    // -------------------------
    // Leaves
    // -------------------------

    /** Digits exactly as written; converted to a number only when evaluated. */
    public static final class NumericLiteral implements Node {
        public final String text;

        public NumericLiteral(String text) {
            this.text = text;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumericLiteral(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    public static final class Identifier implements Node {
        public final String name;

        public Identifier(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    public static final class Comment implements Node {
        public final String text;

        public Comment(String text) {
            this.text = text;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComment(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    // -------------------------
    // Objects
    // -------------------------

    public static final class ObjectLiteral implements Node {
        public final List<Property> properties; // source order

        public ObjectLiteral(List<Property> properties) {
            this.properties = List.copyOf(properties);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitObjectLiteral(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    /** An object literal entry. A null value marks shorthand ({@code { key }}). */
    public static final class Property {
        public final String key;
        public final Node value;

        public Property(String key, Node value) {
            this.key = key;
            this.value = value;
        }

        public boolean isShorthand() { return value == null; }
    }

    // -------------------------
    // Declarations
    // -------------------------

    public static final class VarDeclaration implements Node {
        public final boolean constant;
        public final String identifier;
        public final Node value; // null when declared without initializer

        public VarDeclaration(boolean constant, String identifier, Node value) {
            this.constant = constant;
            this.identifier = identifier;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarDeclaration(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    public static final class FnDeclaration implements Node {
        public final String name;
        public final List<String> parameters;
        public final List<Node> body;
        public final boolean isConst;

        public FnDeclaration(String name, List<String> parameters, List<Node> body, boolean isConst) {
            this.name = name;
            this.parameters = List.copyOf(parameters);
            this.body = List.copyOf(body);
            this.isConst = isConst;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFnDeclaration(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    // -------------------------
    // Expressions
    // -------------------------

    public static final class AssignmentExpr implements Node {
        public final Node assignee;
        public final Node value;

        public AssignmentExpr(Node assignee, Node value) {
            this.assignee = assignee;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignmentExpr(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    public static final class MemberExpr implements Node {
        public final Node object;
        public final Node property;
        public final boolean computed;

        public MemberExpr(Node object, Node property, boolean computed) {
            this.object = object;
            this.property = property;
            this.computed = computed;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMemberExpr(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    public static final class CallExpr implements Node {
        public final Node caller;
        public final List<Node> args;

        public CallExpr(Node caller, List<Node> args) {
            this.caller = caller;
            this.args = List.copyOf(args);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }

    public static final class BinaryExpr implements Node {
        public final Node left;
        public final Node right;
        public final String operator;

        public BinaryExpr(Node left, Node right, String operator) {
            this.left = left;
            this.right = right;
            this.operator = operator;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public String toString() { return AstPrinter.print(this); }
    }
}

package com.vela.script.parser;

import java.util.List;
import java.util.StringJoiner;

/**
 * Compact one-line rendering of a syntax tree, e.g.
 * {@code BinaryExpr(+, NumericLiteral(45), Identifier(foo))}.
 */
public final class AstPrinter implements Ast.Visitor<String> {

    private static final AstPrinter INSTANCE = new AstPrinter();

    private AstPrinter() {}

    public static String print(Ast.Node node) {
        return node == null ? "null" : node.accept(INSTANCE);
    }

    private String list(List<Ast.Node> nodes) {
        StringJoiner j = new StringJoiner(", ", "[", "]");
        for (Ast.Node n : nodes) j.add(print(n));
        return j.toString();
    }

    @Override
    public String visitProgram(Ast.Program node) {
        return "Program" + list(node.body);
    }

    @Override
    public String visitNumericLiteral(Ast.NumericLiteral node) {
        return "NumericLiteral(" + node.text + ")";
    }

    @Override
    public String visitIdentifier(Ast.Identifier node) {
        return "Identifier(" + node.name + ")";
    }

    @Override
    public String visitComment(Ast.Comment node) {
        return "Comment(" + node.text + ")";
    }

    @Override
    public String visitObjectLiteral(Ast.ObjectLiteral node) {
        StringJoiner j = new StringJoiner(", ", "ObjectLiteral(", ")");
        for (Ast.Property p : node.properties) {
            j.add(p.isShorthand() ? p.key : p.key + ": " + print(p.value));
        }
        return j.toString();
    }

    @Override
    public String visitVarDeclaration(Ast.VarDeclaration node) {
        String head = (node.constant ? "const " : "let ") + node.identifier;
        return "VarDeclaration(" + (node.value == null ? head : head + " = " + print(node.value)) + ")";
    }

    @Override
    public String visitFnDeclaration(Ast.FnDeclaration node) {
        return "FnDeclaration(" + node.name + ", " + node.parameters + ", " + list(node.body) + ")";
    }

    @Override
    public String visitAssignmentExpr(Ast.AssignmentExpr node) {
        return "AssignmentExpr(" + print(node.assignee) + ", " + print(node.value) + ")";
    }

    @Override
    public String visitMemberExpr(Ast.MemberExpr node) {
        return "MemberExpr(" + print(node.object) + ", " + print(node.property)
                + (node.computed ? ", computed)" : ")");
    }

    @Override
    public String visitCallExpr(Ast.CallExpr node) {
        return "CallExpr(" + print(node.caller) + ", " + list(node.args) + ")";
    }

    @Override
    public String visitBinaryExpr(Ast.BinaryExpr node) {
        return "BinaryExpr(" + node.operator + ", " + print(node.left) + ", " + print(node.right) + ")";
    }
}

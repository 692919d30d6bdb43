package com.vela.script.json;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vela.script.parser.Ast;

/** Renders a syntax tree as nested JSON objects, one per node, tagged by "type". */
public final class AstJson implements Ast.Visitor<JsonNode> {

    private static final AstJson INSTANCE = new AstJson();
    private static final JsonNodeFactory nf = JsonNodeFactory.instance;

    private AstJson() {}

    public static JsonNode toJson(Ast.Node node) {
        return node == null ? nf.nullNode() : node.accept(INSTANCE);
    }

    private static ObjectNode node(String type) {
        ObjectNode out = nf.objectNode();
        out.put("type", type);
        return out;
    }

    private static ArrayNode list(List<Ast.Node> nodes) {
        ArrayNode out = nf.arrayNode();
        for (Ast.Node n : nodes) out.add(toJson(n));
        return out;
    }

    @Override
    public JsonNode visitProgram(Ast.Program n) {
        ObjectNode out = node("Program");
        out.set("body", list(n.body));
        return out;
    }

    @Override
    public JsonNode visitNumericLiteral(Ast.NumericLiteral n) {
        return node("NumericLiteral").put("value", n.text);
    }

    @Override
    public JsonNode visitIdentifier(Ast.Identifier n) {
        return node("Identifier").put("name", n.name);
    }

    @Override
    public JsonNode visitComment(Ast.Comment n) {
        return node("Comment").put("text", n.text);
    }

    @Override
    public JsonNode visitObjectLiteral(Ast.ObjectLiteral n) {
        ObjectNode out = node("ObjectLiteral");
        ArrayNode props = out.putArray("properties");
        for (Ast.Property p : n.properties) {
            ObjectNode prop = props.addObject();
            prop.put("key", p.key);
            prop.set("value", toJson(p.value));
        }
        return out;
    }

    @Override
    public JsonNode visitVarDeclaration(Ast.VarDeclaration n) {
        ObjectNode out = node("VarDeclaration");
        out.put("constant", n.constant);
        out.put("identifier", n.identifier);
        out.set("value", toJson(n.value));
        return out;
    }

    @Override
    public JsonNode visitFnDeclaration(Ast.FnDeclaration n) {
        ObjectNode out = node("FnDeclaration");
        out.put("name", n.name);
        n.parameters.forEach(out.putArray("parameters")::add);
        out.set("body", list(n.body));
        out.put("isConst", n.isConst);
        return out;
    }

    @Override
    public JsonNode visitAssignmentExpr(Ast.AssignmentExpr n) {
        ObjectNode out = node("AssignmentExpr");
        out.set("assignee", toJson(n.assignee));
        out.set("value", toJson(n.value));
        return out;
    }

    @Override
    public JsonNode visitMemberExpr(Ast.MemberExpr n) {
        ObjectNode out = node("MemberExpr");
        out.set("object", toJson(n.object));
        out.set("property", toJson(n.property));
        out.put("computed", n.computed);
        return out;
    }

    @Override
    public JsonNode visitCallExpr(Ast.CallExpr n) {
        ObjectNode out = node("CallExpr");
        out.set("caller", toJson(n.caller));
        out.set("args", list(n.args));
        return out;
    }

    @Override
    public JsonNode visitBinaryExpr(Ast.BinaryExpr n) {
        ObjectNode out = node("BinaryExpr");
        out.put("operator", n.operator);
        out.set("left", toJson(n.left));
        out.set("right", toJson(n.right));
        return out;
    }
}

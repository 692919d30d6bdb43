package com.vela.script.json;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vela.script.parser.Value;

/**
 * JSON view of runtime values.
 *
 * null, bool and number map to their JSON counterparts and objects to JSON objects
 * (source order kept). Functions have no JSON form and render as a descriptor
 * object: {"fn": "add", "params": ["x", "y"]} or {"native": "print"}.
 */
public final class ValueJson {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nf = JsonNodeFactory.instance;

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        switch (v.type) {
            case NULL:
                return nf.nullNode();
            case BOOL:
                return nf.booleanNode(v.asBool());
            case NUMBER:
                return nf.numberNode(v.asNumber());
            case OBJECT: {
                ObjectNode out = nf.objectNode();
                for (Map.Entry<String, Value> e : v.asObject().entrySet()) {
                    out.set(e.getKey(), toJson(e.getValue()));
                }
                return out;
            }
            case FUNC: {
                ObjectNode out = nf.objectNode();
                out.put("fn", v.asFunc().name);
                v.asFunc().parameters.forEach(out.putArray("params")::add);
                return out;
            }
            case NATIVE: {
                ObjectNode out = nf.objectNode();
                out.put("native", v.asNative().name);
                return out;
            }
            default:
                throw new IllegalArgumentException("ValueJson: unsupported type " + v.type);
        }
    }

    /** Bindings of one scope as a JSON object. */
    public static ObjectNode toJson(Map<String, Value> bindings) {
        ObjectNode out = nf.objectNode();
        for (Map.Entry<String, Value> e : bindings.entrySet()) out.set(e.getKey(), toJson(e.getValue()));
        return out;
    }

    public static String pretty(JsonNode n) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String compact(JsonNode n) {
        try {
            return om.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render JSON: " + e.getOriginalMessage(), e);
        }
    }
}

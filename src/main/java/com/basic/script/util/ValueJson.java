package com.basic.script.util;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.basic.script.parser.Value;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Converts runtime values to Jackson trees for JSON output. */
public final class ValueJson {

    private static final ObjectMapper om = new ObjectMapper();

    private ValueJson() {}

    public static JsonNode toJson(Value v) {
        return toJson(v, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /** A list nested inside itself is written as the text "[...]" where it recurs. */
    private static JsonNode toJson(Value v, Set<List<Value>> open) {
        if (v == null) return om.nullNode();

        switch (v.getType()) {
            case NUMBER:
                return v.isInteger() ? om.getNodeFactory().numberNode(v.asLong())
                                     : om.getNodeFactory().numberNode(v.asNumber());
            case BOOL:
                return om.getNodeFactory().booleanNode(v.asBool());
            case STRING:
                return om.getNodeFactory().textNode(v.asString());
            case LIST: {
                List<Value> elements = v.asList();
                if (!open.add(elements)) return om.getNodeFactory().textNode("[...]");
                ArrayNode arr = om.createArrayNode();
                for (Value item : elements) arr.add(toJson(item, open));
                open.remove(elements);
                return arr;
            }
            case FUNC:
            case BUILTIN: {
                ObjectNode fn = om.createObjectNode();
                fn.put("function", v.functionName());
                ArrayNode params = fn.putArray("params");
                for (String p : (v.getType() == Value.Type.FUNC ? v.asFunc().params() : v.asBuiltin().params())) {
                    params.add(p);
                }
                if (v.getType() == Value.Type.BUILTIN) fn.put("builtin", true);
                return fn;
            }
            default:
                return om.nullNode();
        }
    }

    /** Object keyed by variable name, in binding order. */
    public static ObjectNode toJson(Map<String, Value> vars) {
        ObjectNode out = om.createObjectNode();
        for (Map.Entry<String, Value> e : vars.entrySet()) {
            out.set(e.getKey(), toJson(e.getValue()));
        }
        return out;
    }

    public static String write(JsonNode node, boolean pretty) {
        try {
            return pretty ? om.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                          : om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON encoding failed", e);
        }
    }
}

package com.retailops.tools.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable JSON form of tool arguments, used both for preview matching and ledger keys.
 * <ul>
 *   <li>object keys sorted recursively;</li>
 *   <li>numbers written in their shortest exact form, so {@code 2}, {@code 2.0} and {@code 2.00} agree;</li>
 *   <li>null-valued keys dropped.</li>
 * </ul>
 */
public final class JsonCanonicalizer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private JsonCanonicalizer() {}

    public static JsonNode normalize(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullNode.getInstance();
        }
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> field = it.next();
                if (field.getValue() == null || field.getValue().isNull()) continue;
                sorted.put(field.getKey(), normalize(field.getValue()));
            }
            ObjectNode out = NODES.objectNode();
            sorted.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = NODES.arrayNode();
            node.forEach(item -> out.add(normalize(item)));
            return out;
        }
        if (node.isNumber()) {
            BigDecimal n = node.decimalValue().stripTrailingZeros();
            // 整数值统一成无小数形式
            return n.scale() <= 0 ? NODES.numberNode(n.toBigIntegerExact()) : NODES.numberNode(n);
        }
        return node;
    }

    public static String canonicalize(ObjectMapper mapper, Map<String, Object> args) {
        JsonNode tree = mapper.valueToTree(args == null ? Map.of() : args);
        try {
            return mapper.writeValueAsString(normalize(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot canonicalize tool arguments", e);
        }
    }
}

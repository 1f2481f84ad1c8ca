package com.retailops.tools.support;

import com.retailops.errors.ErrorKind;
import com.retailops.errors.GatewayException;
import com.retailops.tools.ToolDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;

/**
 * Checks arguments against the tool's JSON-schema style map and coerces numeric strings,
 * so {@code "qty": "1"} and {@code "qty": 1} canonicalize to the same action.
 *
 * <p>Supported keywords: {@code required}, {@code type} (string, integer, number, boolean),
 * {@code minimum}, {@code maximum}, {@code minLength}, {@code enum}, {@code default}.
 * Unknown properties are rejected.</p>
 */
@Component
@Slf4j
public class ArgumentValidator {

    @SuppressWarnings("unchecked")
    public Map<String, Object> validate(ToolDefinition definition, Map<String, Object> args) {
        Map<String, Object> schema = definition.inputSchema();
        Map<String, Object> properties = schema.get("properties") instanceof Map<?, ?> p
                ? (Map<String, Object>) p : Map.of();
        List<String> required = schema.get("required") instanceof List<?> r
                ? r.stream().map(String::valueOf).toList() : List.of();

        List<String> problems = new ArrayList<>();
        Map<String, Object> out = new LinkedHashMap<>();

        for (String key : args.keySet()) {
            if (!properties.containsKey(key)) {
                problems.add("unexpected argument '" + key + "'");
            }
        }

        for (Map.Entry<String, Object> prop : properties.entrySet()) {
            String key = prop.getKey();
            Map<String, Object> rule = prop.getValue() instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
            Object value = args.get(key);
            if (value == null) {
                if (required.contains(key)) {
                    problems.add("missing required argument '" + key + "'");
                } else if (rule.containsKey("default")) {
                    out.put(key, rule.get("default"));
                }
                continue;
            }
            Object coerced = coerce(key, value, rule, problems);
            if (coerced != null) {
                out.put(key, coerced);
            }
        }

        if (!problems.isEmpty()) {
            log.debug("[ARGS-INVALID] tool={} problems={}", definition.name(), problems);
            throw new GatewayException(ErrorKind.INVALID_ARGUMENTS,
                    definition.name() + ": " + String.join("; ", problems) + ".");
        }
        return out;
    }

    private Object coerce(String key, Object value, Map<String, Object> rule, List<String> problems) {
        String type = String.valueOf(rule.getOrDefault("type", "string"));
        Object result;
        switch (type) {
            case "integer" -> {
                BigDecimal n = asNumber(value);
                if (n == null || n.stripTrailingZeros().scale() > 0
                        || n.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0
                        || n.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) < 0) {
                    problems.add("'" + key + "' must be an integer");
                    return null;
                }
                result = n.intValue();
                checkRange(key, n, rule, problems);
            }
            case "number" -> {
                BigDecimal n = asNumber(value);
                if (n == null) {
                    problems.add("'" + key + "' must be a number");
                    return null;
                }
                result = n.doubleValue();
                checkRange(key, n, rule, problems);
            }
            case "boolean" -> {
                if (value instanceof Boolean b) {
                    result = b;
                } else if ("true".equalsIgnoreCase(String.valueOf(value)) || "false".equalsIgnoreCase(String.valueOf(value))) {
                    result = Boolean.parseBoolean(String.valueOf(value));
                } else {
                    problems.add("'" + key + "' must be a boolean");
                    return null;
                }
            }
            default -> {
                if (value instanceof Map || value instanceof Collection) {
                    problems.add("'" + key + "' must be a string");
                    return null;
                }
                String s = String.valueOf(value).trim();
                if (rule.get("minLength") instanceof Number min && s.length() < min.intValue()) {
                    problems.add("'" + key + "' must not be empty");
                }
                result = s;
            }
        }
        if (rule.get("enum") instanceof List<?> allowed && !allowed.contains(result)) {
            problems.add("'" + key + "' must be one of " + allowed);
        }
        return result;
    }

    private static void checkRange(String key, BigDecimal n, Map<String, Object> rule, List<String> problems) {
        if (rule.get("minimum") instanceof Number min && n.compareTo(new BigDecimal(min.toString())) < 0) {
            problems.add("'" + key + "' must be >= " + min + " (got " + n.toPlainString() + ")");
        }
        if (rule.get("maximum") instanceof Number max && n.compareTo(new BigDecimal(max.toString())) > 0) {
            problems.add("'" + key + "' must be <= " + max + " (got " + n.toPlainString() + ")");
        }
        if (rule.get("exclusiveMinimum") instanceof Number min && n.compareTo(new BigDecimal(min.toString())) <= 0) {
            problems.add("'" + key + "' must be > " + min);
        }
    }

    private static BigDecimal asNumber(Object value) {
        if (value instanceof Boolean) return null;
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

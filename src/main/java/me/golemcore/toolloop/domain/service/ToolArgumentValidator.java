package me.golemcore.toolloop.domain.service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Checks tool call arguments against the JSON Schema subset that tool
 * definitions use: {@code properties}, {@code required}, {@code type},
 * {@code enum}, {@code items} and {@code additionalProperties: false}.
 *
 * <p>
 * Unknown keywords are ignored, so a schema richer than this subset never
 * rejects a call on its own.
 */
public final class ToolArgumentValidator {

    private static final String KEY_TYPE = "type";
    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_REQUIRED = "required";
    private static final String KEY_ENUM = "enum";
    private static final String KEY_ITEMS = "items";
    private static final String KEY_ADDITIONAL_PROPERTIES = "additionalProperties";

    private ToolArgumentValidator() {
    }

    /**
     * Returns every violation found, or an empty list if the arguments satisfy
     * the schema. A null schema accepts anything; null arguments are treated as
     * an empty object.
     */
    public static List<String> validate(Map<String, Object> inputSchema, Map<String, Object> arguments) {
        List<String> violations = new ArrayList<>();
        if (inputSchema == null || inputSchema.isEmpty()) {
            return violations;
        }
        validateObject("", inputSchema, arguments != null ? arguments : Map.of(), violations);
        return violations;
    }

    private static void validateObject(String path, Map<?, ?> schema, Map<?, ?> value, List<String> violations) {
        Map<?, ?> properties = schema.get(KEY_PROPERTIES) instanceof Map<?, ?> props ? props : Map.of();

        if (schema.get(KEY_REQUIRED) instanceof Collection<?> required) {
            for (Object name : required) {
                if (value.get(name) == null) {
                    violations.add("missing required argument '" + path + name + "'");
                }
            }
        }

        for (Map.Entry<?, ?> entry : value.entrySet()) {
            String name = String.valueOf(entry.getKey());
            Object propertySchema = properties.get(name);
            if (propertySchema instanceof Map<?, ?> propSchema) {
                if (entry.getValue() != null) {
                    validateValue(path + name, propSchema, entry.getValue(), violations);
                }
            } else if (Boolean.FALSE.equals(schema.get(KEY_ADDITIONAL_PROPERTIES))) {
                violations.add("unexpected argument '" + path + name + "'");
            }
        }
    }

    private static void validateValue(String path, Map<?, ?> schema, Object value, List<String> violations) {
        if (schema.get(KEY_ENUM) instanceof Collection<?> allowed && !allowed.isEmpty()
                && allowed.stream().noneMatch(candidate -> String.valueOf(candidate).equals(String.valueOf(value)))) {
            violations.add("argument '" + path + "' must be one of " + allowed + " but was '" + value + "'");
            return;
        }

        Object type = schema.get(KEY_TYPE);
        if (!(type instanceof String expected)) {
            return;
        }
        if (!matchesType(expected, value)) {
            violations.add("argument '" + path + "' must be of type " + expected + " but was "
                    + describeType(value));
            return;
        }

        if ("object".equals(expected) && value instanceof Map<?, ?> nested) {
            validateObject(path + ".", schema, nested, violations);
        } else if ("array".equals(expected) && schema.get(KEY_ITEMS) instanceof Map<?, ?> itemSchema) {
            int index = 0;
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    validateValue(path + "[" + index + "]", itemSchema, item, violations);
                }
                index++;
            }
        }
    }

    private static boolean matchesType(String expected, Object value) {
        return switch (expected) {
        case "string" -> value instanceof String;
        case "integer" -> isInteger(value);
        case "number" -> value instanceof Number;
        case "boolean" -> value instanceof Boolean;
        case "array" -> value instanceof Collection<?>;
        case "object" -> value instanceof Map<?, ?>;
        default -> true;
        };
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return !Double.isInfinite(number) && number == Math.rint(number);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private static String describeType(Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return "number";
        }
        if (value instanceof Collection<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }
}

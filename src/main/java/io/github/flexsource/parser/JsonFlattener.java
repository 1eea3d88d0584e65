package io.github.flexsource.parser;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts JSON trees into Java values and flattens nested documents into column/value maps.
 *
 * <p>
 * Flattening joins object keys with {@code .}. A list of objects contributes one {@code *} segment:
 * {@code {"persons": [{"name": "a"}, {"name": "b"}]}} becomes
 * {@code {"persons.*.name": ["a", "b"]}}. Values collected below nested lists are gathered into a
 * single flat list. Lists of scalars are kept as list values.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JsonFlattener {

    private static final String SEPARATOR = ".";

    private static final String LIST_SEGMENT = "*";

    private JsonFlattener() {
        // Utility class; do not instantiate.
    }

    /**
     * Converts a JSON object into a map of Java values, nested objects as maps and arrays as lists.
     *
     * @param node JSON object
     * @return ordered map of field name to value
     */
    public static Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            result.put(field.getKey(), toJava(field.getValue()));
        }
        return result;
    }

    /**
     * Flattens a JSON object, including lists of objects.
     *
     * @param node JSON object
     * @return ordered map of flattened key to value
     */
    public static Map<String, Object> flatten(JsonNode node) {
        Map<String, Object> result = new LinkedHashMap<>();
        flatten(null, node, result, true);
        return result;
    }

    /**
     * Flattens the nested objects of a JSON object; arrays are kept as list values.
     *
     * @param node JSON object
     * @return ordered map of flattened key to value
     */
    public static Map<String, Object> flattenObjects(JsonNode node) {
        Map<String, Object> result = new LinkedHashMap<>();
        flatten(null, node, result, false);
        return result;
    }

    /**
     * Converts a JSON value into its Java counterpart: {@link String}, {@link Long},
     * {@link Double}, {@link Boolean}, {@link Map}, {@link List} or {@code null}.
     *
     * @param node JSON value
     * @return the Java value
     */
    public static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return toMap(node);
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>(node.size());
            node.forEach(element -> values.add(toJava(element)));
            return values;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    private static void flatten(String prefix, JsonNode node, Map<String, Object> out,
            boolean expandLists) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            if (!fields.hasNext() && prefix != null) {
                out.put(prefix, new LinkedHashMap<>());
            }
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flatten(join(prefix, field.getKey()), field.getValue(), out, expandLists);
            }
        } else if (node.isArray() && expandLists && containsContainers(node)) {
            String listPrefix = join(prefix, LIST_SEGMENT);
            for (JsonNode element : node) {
                Map<String, Object> nested = new LinkedHashMap<>();
                if (element.isContainerNode()) {
                    flatten(listPrefix, element, nested, true);
                } else {
                    nested.put(listPrefix, toJava(element));
                }
                nested.forEach((key, value) -> collect(out, key, value));
            }
        } else {
            out.put(prefix, toJava(node));
        }
    }

    private static void collect(Map<String, Object> out, String key, Object value) {
        Object current = out.get(key);
        ListValues values;
        if (current instanceof ListValues) {
            values = (ListValues) current;
        } else {
            values = new ListValues();
            out.put(key, values);
        }
        if (value instanceof ListValues) {
            values.addAll((ListValues) value);
        } else {
            values.add(value);
        }
    }

    private static boolean containsContainers(JsonNode array) {
        for (JsonNode element : array) {
            if (element.isContainerNode()) {
                return true;
            }
        }
        return false;
    }

    private static String join(String prefix, String key) {
        return prefix == null ? key : prefix + SEPARATOR + key;
    }

    // Values gathered below a list segment, merged when lists are nested
    private static final class ListValues extends ArrayList<Object> {

        private static final long serialVersionUID = 1L;
    }
}

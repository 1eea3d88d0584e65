package io.github.flexsource.parser;

import java.nio.charset.Charset;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Typed view over the free-form parameter map a {@link FormatReader} is invoked with.
 *
 * <p>
 * Parameters typically come from YAML, so scalar values are accepted either with their natural type
 * or as text (for example {@code true} or {@code "true"}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ReaderParameters {

    private final Map<String, Object> values;

    /**
     * Wraps a parameter map.
     *
     * @param values parameters, may be {@code null}
     */
    public ReaderParameters(Map<String, ?> values) {
        this.values = values == null ? Collections.emptyMap() : new LinkedHashMap<>(values);
    }

    /**
     * Determines whether a parameter is set to a non-null value.
     *
     * @param key parameter name
     * @return {@code true} if present
     */
    public boolean contains(String key) {
        return values.get(key) != null;
    }

    /**
     * Returns a raw parameter value.
     *
     * @param key parameter name
     * @return the value, or {@code null}
     */
    public Object get(String key) {
        return values.get(key);
    }

    /**
     * Returns a parameter as text.
     *
     * @param key parameter name
     * @param defaultValue value returned when the parameter is absent
     * @return the parameter value
     */
    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    /**
     * Returns a boolean parameter.
     *
     * @param key parameter name
     * @param defaultValue value returned when the parameter is absent
     * @return the parameter value
     * @throws IllegalArgumentException if the value is neither a boolean nor boolean text
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException(
                "Parameter '" + key + "' must be a boolean but was: " + value);
    }

    /**
     * Returns an integer parameter.
     *
     * @param key parameter name
     * @param defaultValue value returned when the parameter is absent
     * @return the parameter value
     * @throws IllegalArgumentException if the value is not an integer
     */
    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Parameter '" + key + "' must be an integer but was: " + value, e);
        }
    }

    /**
     * Returns a parameter that may be given as one value or a list of values.
     *
     * @param key parameter name
     * @return the values as text, empty when the parameter is absent
     */
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(String::valueOf)
                    .collect(Collectors.toList());
        }
        return Collections.singletonList(String.valueOf(value));
    }

    /**
     * Returns a nested map parameter.
     *
     * @param key parameter name
     * @return the map, empty when the parameter is absent
     * @throws IllegalArgumentException if the value is not a map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object value = values.get(key);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(
                    "Parameter '" + key + "' must be a mapping but was: " + value);
        }
        return (Map<String, Object>) value;
    }

    /**
     * Returns a character set parameter.
     *
     * @param key parameter name
     * @param defaultValue value returned when the parameter is absent or blank
     * @return the character set
     */
    public Charset getCharset(String key, Charset defaultValue) {
        String name = getString(key, null);
        return StringUtils.isBlank(name) ? defaultValue : Charset.forName(name.trim());
    }
}

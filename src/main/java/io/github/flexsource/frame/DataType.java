package io.github.flexsource.frame;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Enumeration of the value types a {@link Column} can hold.
 *
 * <p>
 * A typed column only accepts {@code null} or instances of its Java type. {@link #OBJECT} accepts
 * any value and is used for columns of mixed or nested content.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum DataType {

    // Text values.
    STRING(String.class),

    // Integral numbers.
    LONG(Long.class),

    // Floating point numbers.
    DOUBLE(Double.class),

    // Boolean flags.
    BOOLEAN(Boolean.class),

    // Anything, including nested maps and lists.
    OBJECT(Object.class);

    // Java type of the values in a column of this type
    private final Class<?> javaType;

    /**
     * Determines whether the given value may be stored in a column of this type.
     *
     * @param value candidate value, may be {@code null}
     * @return {@code true} if the value is {@code null} or an instance of {@link #getJavaType()}
     */
    public boolean accepts(Object value) {
        return value == null || javaType.isInstance(value);
    }
}

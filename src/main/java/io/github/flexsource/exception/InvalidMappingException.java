package io.github.flexsource.exception;

import lombok.Getter;

/**
 * Thrown when a logical field of a mapping references something other than a column name or a
 * list of column names.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class InvalidMappingException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    // Logical field with the invalid reference
    private final String field;

    /**
     * Creates the exception.
     *
     * @param field logical field name
     * @param reference offending column reference
     */
    public InvalidMappingException(String field, Object reference) {
        super(String.format(
                "Mapping of field '%s' must be a column name or a list of column names: %s", field,
                reference));
        this.field = field;
    }
}

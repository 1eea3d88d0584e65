package io.github.flexsource.exception;

/**
 * Thrown when a legacy nested {@code label} mapping names no column.
 *
 * @author Yasuharu.Okawauchi
 */
public class LegacyLabelResolutionException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public LegacyLabelResolutionException(String message) {
        super(message);
    }
}

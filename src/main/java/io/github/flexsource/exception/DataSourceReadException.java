package io.github.flexsource.exception;

/**
 * Thrown when a reader fails to open or inspect its source.
 *
 * @author Yasuharu.Okawauchi
 */
public class DataSourceReadException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public DataSourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}

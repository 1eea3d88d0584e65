package io.github.flexsource.exception;

/**
 * Base class of the errors raised while building or querying a data source.
 *
 * @author Yasuharu.Okawauchi
 */
public class DataSourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public DataSourceException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

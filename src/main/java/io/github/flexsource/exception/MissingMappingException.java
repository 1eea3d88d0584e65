package io.github.flexsource.exception;

/**
 * Thrown when a mapped view is requested from a data source that has no mapping.
 *
 * @author Yasuharu.Okawauchi
 */
public class MissingMappingException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public MissingMappingException() {
        super("For a mapped dataset you need to specify a mapping!");
    }
}

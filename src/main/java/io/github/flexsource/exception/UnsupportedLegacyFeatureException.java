package io.github.flexsource.exception;

/**
 * Thrown when a configuration uses a retired legacy feature.
 *
 * @author Yasuharu.Okawauchi
 */
public class UnsupportedLegacyFeatureException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    public UnsupportedLegacyFeatureException(String message) {
        super(message);
    }
}

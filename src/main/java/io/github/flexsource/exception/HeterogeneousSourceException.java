package io.github.flexsource.exception;

import java.util.Set;
import lombok.Getter;

/**
 * Thrown when the paths of one source resolve to more than one format.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class HeterogeneousSourceException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    // Distinct formats found in the source
    private final Set<String> formats;

    /**
     * Creates the exception.
     *
     * @param formats distinct formats found in the source
     */
    public HeterogeneousSourceException(Set<String> formats) {
        super("source must be homogeneous: " + formats);
        this.formats = Set.copyOf(formats);
    }
}

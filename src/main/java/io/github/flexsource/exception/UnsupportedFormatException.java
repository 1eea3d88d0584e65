package io.github.flexsource.exception;

import java.util.Collection;
import java.util.List;
import lombok.Getter;

/**
 * Thrown when no reader is registered for a format key.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class UnsupportedFormatException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    // Format key that could not be resolved
    private final String format;

    // Format keys known at lookup time
    private final List<String> supportedFormats;

    /**
     * Creates the exception.
     *
     * @param format requested format key
     * @param supportedFormats known format keys
     */
    public UnsupportedFormatException(String format, Collection<String> supportedFormats) {
        super(String.format("Format %s not supported. Supported formats are: %s", format,
                String.join(", ", supportedFormats)));
        this.format = format;
        this.supportedFormats = List.copyOf(supportedFormats);
    }
}

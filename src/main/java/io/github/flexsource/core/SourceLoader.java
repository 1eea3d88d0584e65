package io.github.flexsource.core;

import io.github.flexsource.exception.DataSourceReadException;
import io.github.flexsource.frame.TabularDataset;
import io.github.flexsource.parser.ReaderCatalog;
import io.github.flexsource.parser.ReaderEntry;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads the raw dataset of a data source through the reader registered for its format.
 *
 * <p>
 * Reader parameters are merged with strict precedence, later overriding earlier:
 * </p>
 * <ol>
 * <li>the default parameters registered with the reader</li>
 * <li>legacy free-form parameters (deprecated)</li>
 * <li>the explicit attributes of the data source</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class SourceLoader {

    // Readers visible to this loader
    private final ReaderCatalog catalog;

    /**
     * Reads the source with the reader registered for {@code formatKey}.
     *
     * @param source source paths or backend identifiers, empty for configuration-only backends
     * @param formatKey format key
     * @param attributes explicit reader parameters, may be {@code null}
     * @param legacyParameters deprecated free-form parameters, may be {@code null}
     * @return the raw dataset
     * @throws io.github.flexsource.exception.UnsupportedFormatException if the format is unknown
     * @throws DataSourceReadException if the reader fails with an I/O error
     */
    public TabularDataset load(List<String> source, String formatKey,
            Map<String, Object> attributes, Map<String, Object> legacyParameters) {
        ReaderEntry entry = catalog.lookup(formatKey);
        Map<String, Object> parameters =
                mergeParameters(entry.getDefaultParameters(), legacyParameters, attributes);
        List<String> arguments = source == null ? Collections.emptyList() : source;

        log.debug("Reading source {} as {} with parameters {}", arguments, formatKey, parameters);
        try {
            return entry.getReader().read(arguments, parameters);
        } catch (IOException e) {
            throw new DataSourceReadException(
                    "Failed to read " + (arguments.isEmpty() ? formatKey : arguments) + ": "
                            + e.getMessage(),
                    e);
        }
    }

    static Map<String, Object> mergeParameters(Map<String, Object> defaults,
            Map<String, Object> legacyParameters, Map<String, Object> attributes) {
        Map<String, Object> merged = new LinkedHashMap<>(defaults);
        if (legacyParameters != null && !legacyParameters.isEmpty()) {
            log.warn("Passing reader parameters as keyword arguments is deprecated, "
                    + "use 'attributes' instead: {}", legacyParameters.keySet());
            merged.putAll(legacyParameters);
        }
        if (attributes != null) {
            merged.putAll(attributes);
        }
        return merged;
    }
}

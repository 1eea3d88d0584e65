package io.github.flexsource.parser;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.Value;

/**
 * A registered reader together with the parameters it is invoked with by default.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ReaderEntry {

    // Reader implementation
    FormatReader reader;

    // Default parameters, overridden by caller-supplied ones
    Map<String, Object> defaultParameters;

    /**
     * Creates an entry.
     *
     * @param reader reader implementation
     * @param defaultParameters default parameters, may be {@code null}
     */
    public ReaderEntry(FormatReader reader, Map<String, Object> defaultParameters) {
        this.reader = reader;
        this.defaultParameters = defaultParameters == null ? ImmutableMap.of()
                : ImmutableMap.copyOf(defaultParameters);
    }
}

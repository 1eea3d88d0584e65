package io.github.flexsource.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Construction parameters of a {@link io.github.flexsource.core.DataSource}.
 *
 * <p>
 * Typical YAML form:
 * </p>
 *
 * <pre>
 * source: reviews/*.csv
 * attributes:
 *   sep: ";"
 * mapping:
 *   text: review
 *   label: sentiment
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataSourceDefinition {

    /**
     * Source paths or backend identifiers. Empty for backends configured only through attributes.
     */
    @Builder.Default
    private List<String> source = new ArrayList<>();

    /**
     * Explicit format key; derived from the source when {@code null}.
     */
    private String format;

    /**
     * Reader parameters.
     */
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    /**
     * Raw mapping of logical fields to source columns, {@code null} when the source is not mapped.
     */
    private Map<String, Object> mapping;

    /**
     * Deprecated free-form reader parameters.
     */
    @Builder.Default
    private Map<String, Object> kwargs = new LinkedHashMap<>();
}

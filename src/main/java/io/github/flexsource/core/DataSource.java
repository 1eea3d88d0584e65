package io.github.flexsource.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.flexsource.config.DataSourceConfigLoader;
import io.github.flexsource.config.DataSourceDefinition;
import io.github.flexsource.frame.Table;
import io.github.flexsource.frame.TabularDataset;
import io.github.flexsource.parser.FormatReader;
import io.github.flexsource.parser.FormatResolver;
import io.github.flexsource.parser.ReaderRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Unified access to a tabular data source.
 *
 * <p>
 * Construction resolves the format (explicit, or derived from the source paths), reads the source
 * with the matching reader of the registry, and sanitizes the result (see
 * {@link DataFrameSanitizer}). The dataset stays lazy: rows are only read when a view is
 * materialized. Two views are available:
 * </p>
 * <ul>
 * <li>the sanitized dataset, {@link #toDataFrame()}</li>
 * <li>the dataset projected onto the logical fields of the mapping,
 * {@link #toMappedDataFrame()}</li>
 * </ul>
 * <p>
 * Either view can be turned into records with {@link #toRecords()} and
 * {@link #toMappedRecords()}.
 * </p>
 *
 * <p>
 * A data source uses a snapshot of the registry taken at construction; formats registered later
 * through {@link #addSupportedFormat(String, FormatReader, Map)} are only visible to data sources
 * constructed afterwards.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class DataSource {

    // Source paths or backend identifiers
    private final List<String> source;

    // Normalized format key
    private final String format;

    // Reader parameters
    private final Map<String, Object> attributes;

    // Normalized mapping, or null
    private final Map<String, Object> mapping;

    @Getter(AccessLevel.NONE)
    private final MappingSpecification mappingSpecification;

    @Getter(AccessLevel.NONE)
    private final TabularDataset dataset;

    /**
     * Creates a data source using the process-wide reader registry.
     *
     * @param definition construction parameters
     */
    public DataSource(DataSourceDefinition definition) {
        this(definition, ReaderRegistry.getDefault());
    }

    /**
     * Creates a data source.
     *
     * @param definition construction parameters
     * @param registry reader registry
     * @throws IllegalArgumentException if neither a source nor a format is given
     * @throws io.github.flexsource.exception.DataSourceException if the format cannot be resolved
     *         or read, or the mapping uses an unsupported legacy shape
     */
    public DataSource(DataSourceDefinition definition, ReaderRegistry registry) {
        this.source = definition.getSource() == null ? ImmutableList.of()
                : ImmutableList.copyOf(definition.getSource());
        if (source.isEmpty() && StringUtils.isBlank(definition.getFormat())) {
            throw new IllegalArgumentException("Either a source or a format must be specified");
        }
        this.format = StringUtils.isBlank(definition.getFormat()) ? FormatResolver.resolve(source)
                : definition.getFormat().trim().toLowerCase(Locale.ROOT);
        this.attributes = definition.getAttributes() == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(definition.getAttributes()));

        if (definition.getMapping() == null || definition.getMapping().isEmpty()) {
            this.mapping = null;
            this.mappingSpecification = null;
        } else {
            Map<String, Object> normalized =
                    LegacyMappingNormalizer.normalize(definition.getMapping());
            this.mappingSpecification = MappingSpecification.of(normalized);
            this.mapping = Collections.unmodifiableMap(normalized);
        }

        TabularDataset raw = new SourceLoader(registry.snapshot()).load(source, format,
                attributes, definition.getKwargs());
        this.dataset = DataFrameSanitizer.sanitize(raw);
        log.info("Data source created: format={}, source={}, columns={}", format, source,
                dataset.getColumnNames());
    }

    /**
     * Creates a data source from a YAML definition.
     *
     * @param yamlFile YAML file
     * @return the data source
     * @throws IOException if the file cannot be read
     * @see DataSourceConfigLoader#load(Path)
     */
    public static DataSource fromYaml(Path yamlFile) throws IOException {
        return new DataSource(DataSourceConfigLoader.load(yamlFile));
    }

    /**
     * Registers a reader with the process-wide registry.
     *
     * @param formatKey format key
     * @param reader reader implementation
     * @param defaultParameters default reader parameters, may be {@code null}
     */
    public static void addSupportedFormat(String formatKey, FormatReader reader,
            Map<String, Object> defaultParameters) {
        ReaderRegistry.getDefault().register(formatKey, reader, defaultParameters);
    }

    /**
     * Returns the sanitized dataset.
     *
     * @return the dataset
     */
    public TabularDataset toDataFrame() {
        return dataset;
    }

    /**
     * Returns the dataset projected onto the logical fields of the mapping.
     *
     * @return the mapped dataset
     * @throws io.github.flexsource.exception.MissingMappingException if there is no mapping
     * @throws io.github.flexsource.exception.UnknownColumnException if mapped columns are missing
     */
    public TabularDataset toMappedDataFrame() {
        return SchemaMapper.map(dataset, mappingSpecification);
    }

    /**
     * Returns the records of the sanitized dataset.
     *
     * @return lazy stream of records
     */
    public Stream<Map<String, Object>> toRecords() {
        return toRecords(getDefaultResource());
    }

    /**
     * Returns the records of the sanitized dataset with the given fallback provenance.
     *
     * @param defaultResource provenance of rows without a resource or path column
     * @return lazy stream of records
     */
    public Stream<Map<String, Object>> toRecords(String defaultResource) {
        return RecordEmitter.emit(dataset, defaultResource);
    }

    /**
     * Returns the records of the mapped dataset.
     *
     * @return lazy stream of records
     */
    public Stream<Map<String, Object>> toMappedRecords() {
        return RecordEmitter.emit(toMappedDataFrame(), getDefaultResource());
    }

    /**
     * Returns the first rows of the sanitized dataset.
     *
     * @param n number of rows
     * @return the rows
     */
    public Table head(int n) {
        return dataset.head(n);
    }

    /**
     * Writes this data source as YAML.
     *
     * @param yamlFile target file
     * @param makeSourcePathAbsolute whether relative source paths are written as absolute paths
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path toYaml(Path yamlFile, boolean makeSourcePathAbsolute) throws IOException {
        return DataSourceConfigLoader.save(toDefinition(), yamlFile, makeSourcePathAbsolute);
    }

    /**
     * Returns the definition this data source can be recreated from.
     *
     * @return the definition
     */
    public DataSourceDefinition toDefinition() {
        return DataSourceDefinition.builder().source(new ArrayList<>(source)).format(format)
                .attributes(new LinkedHashMap<>(attributes))
                .mapping(mapping == null ? null : new LinkedHashMap<>(mapping)).build();
    }

    /**
     * Returns the provenance of rows that carry none: the source paths joined with {@code ,}, or
     * the format key for sources without paths.
     *
     * @return the default provenance
     */
    public String getDefaultResource() {
        return source.isEmpty() ? format : String.join(",", source);
    }

    @Override
    public String toString() {
        return "DataSource[format=" + format + ", source=" + source + ", mapping="
                + (mapping == null ? ImmutableMap.of() : mapping) + "]";
    }
}

package io.github.flexsource.parser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of the built-in data formats.
 *
 * <p>
 * Each format defines the format keys (file extensions or backend names) it is registered under,
 * and the parameters its reader is invoked with by default. For example, {@link #EXCEL} supports
 * both {@code xls} and {@code xlsx}.
 * </p>
 *
 * <p>
 * Format keys are handled here in a centralized way, so that the registry does not need to hardcode
 * string comparisons.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Comma-Separated Values, every column read as text.
    CSV(ImmutableMap.of(FileFormatReader.NA_FILTER, false, FileFormatReader.DTYPE, "str"), "csv"),

    // Excel workbooks, every column read as text.
    EXCEL(ImmutableMap.of(FileFormatReader.NA_FILTER, false, FileFormatReader.DTYPE, "str"), "xls",
            "xlsx"),

    // JSON documents and JSON lines.
    JSON(ImmutableMap.of(), "json", "jsonl", "json-l"),

    // Apache Parquet columnar files.
    PARQUET(ImmutableMap.of(), "parquet"),

    // Elasticsearch index; no file-system source.
    ELASTICSEARCH(ImmutableMap.of(), ElasticsearchFormatReader.SOURCE_TYPE);

    // Format keys (all lowercase)
    private final List<String> keys;

    // Parameters the reader is invoked with unless overridden
    private final Map<String, Object> defaultParameters;

    DataFormat(Map<String, Object> defaultParameters, String... keys) {
        this.defaultParameters = defaultParameters;
        this.keys = ImmutableList.copyOf(Arrays.stream(keys).map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList()));
    }

    /**
     * Creates the reader for this format.
     *
     * @return a new {@link FormatReader}
     */
    public FormatReader createReader() {
        switch (this) {
            case CSV:
                return new CsvFormatReader();
            case EXCEL:
                return new ExcelFormatReader();
            case JSON:
                return new JsonFormatReader();
            case PARQUET:
                return new ParquetFormatReader();
            case ELASTICSEARCH:
                return new ElasticsearchFormatReader();
            default:
                throw new IllegalArgumentException("Unsupported format: " + this);
        }
    }
}

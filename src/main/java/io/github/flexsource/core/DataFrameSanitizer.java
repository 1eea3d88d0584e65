package io.github.flexsource.core;

import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.TabularDataset;
import io.github.flexsource.parser.ReservedColumns;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes freshly loaded datasets.
 *
 * <p>
 * The steps are applied in order:
 * </p>
 * <ol>
 * <li>rows whose cells are all missing are dropped</li>
 * <li>column names are trimmed; duplicates are kept</li>
 * <li>missing values become empty strings, except in columns whose type cannot hold a string,
 * which are left as they are with a warning</li>
 * <li>a column named {@value ReservedColumns#ID} becomes the row identity</li>
 * </ol>
 *
 * <p>
 * Sanitizing an already sanitized dataset changes nothing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DataFrameSanitizer {

    /** Placeholder for missing values. */
    public static final String MISSING_VALUE = "";

    /**
     * Sanitizes a dataset.
     *
     * @param dataset raw dataset
     * @return the sanitized dataset
     */
    public static TabularDataset sanitize(TabularDataset dataset) {
        TabularDataset result = dataset.dropEmptyRows();

        List<String> names = result.getColumnNames().stream().map(DataFrameSanitizer::columnName)
                .collect(Collectors.toList());
        result = result.withColumnNames(names);

        List<Column> columns = result.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            try {
                result = result.fillMissing(i, MISSING_VALUE);
            } catch (IllegalArgumentException e) {
                log.warn("Cannot fill missing values of column '{}' ({}), leaving them as is: {}",
                        columns.get(i).getName(), columns.get(i).getType(), e.getMessage());
            }
        }

        if (result.hasColumn(ReservedColumns.ID)) {
            result = result.setIndex(ReservedColumns.ID);
        }
        return result;
    }

    static String columnName(Object name) {
        return StringUtils.trimToEmpty(String.valueOf(name));
    }
}

package io.github.flexsource.exception;

import java.util.List;
import lombok.Getter;

/**
 * Thrown when a mapping references columns that the dataset does not have.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class UnknownColumnException extends DataSourceException {

    private static final long serialVersionUID = 1L;

    // Referenced columns that do not exist
    private final List<String> missingColumns;

    // Columns of the dataset
    private final List<String> availableColumns;

    /**
     * Creates the exception.
     *
     * @param missingColumns referenced columns that do not exist
     * @param availableColumns columns of the dataset
     */
    public UnknownColumnException(List<String> missingColumns, List<String> availableColumns) {
        super(String.format("Did not find %s in the data source columns %s!", missingColumns,
                availableColumns));
        this.missingColumns = List.copyOf(missingColumns);
        this.availableColumns = List.copyOf(availableColumns);
    }
}

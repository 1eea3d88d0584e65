package io.github.flexsource.frame;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Materialized, in-memory result of a {@link TabularDataset} computation.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class Table {

    // Columns in order
    private final List<Column> columns;

    // Name of the index, or null for positional identities
    private final String indexName;

    // Computed rows in order
    private final List<DataRow> rows;

    Table(List<Column> columns, String indexName, List<DataRow> rows) {
        this.columns = ImmutableList.copyOf(columns);
        this.indexName = indexName;
        this.rows = rows;
    }

    /**
     * Returns the column names in order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    /**
     * Returns the number of rows.
     *
     * @return row count
     */
    public int getRowCount() {
        return rows.size();
    }

    /**
     * Returns the identity of the given row.
     *
     * @param row zero-based row number
     * @return the index value
     */
    public Object getIndex(int row) {
        return rows.get(row).getIndex();
    }

    /**
     * Returns the value of a cell. When the column name is duplicated, the first occurrence is
     * used.
     *
     * @param row zero-based row number
     * @param column column name
     * @return the cell value, may be {@code null}
     * @throws IllegalArgumentException if the column does not exist
     */
    public Object getValue(int row, String column) {
        int position = getColumnNames().indexOf(column);
        if (position < 0) {
            throw new IllegalArgumentException(
                    "No such column: " + column + ". Columns are " + getColumnNames());
        }
        return rows.get(row).get(position);
    }
}

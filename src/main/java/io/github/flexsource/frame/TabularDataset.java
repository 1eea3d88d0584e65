package io.github.flexsource.frame;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lazily evaluated, partitioned table with named, typed columns and a row identity.
 *
 * <p>
 * A dataset is a computation graph, not data: every transformation returns a new dataset whose
 * partitions wrap the partitions of its parent, and nothing is read until the rows are
 * materialized through {@link #rows()}, {@link #compute()}, {@link #head(int)} or
 * {@link #count()}. Each materialization recomputes the graph from the sources.
 * </p>
 *
 * <p>
 * Column names are not required to be unique. Lookups by name resolve to the first occurrence.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TabularDataset {

    // Columns in order
    private final List<Column> columns;

    // Name of the column promoted to the row identity, or null for positional identities
    private final String indexName;

    // Independently computable slices of the rows
    private final List<Partition> partitions;

    /**
     * Creates a dataset from its partitions.
     *
     * @param columns columns in order
     * @param indexName name of the index column, or {@code null}
     * @param partitions partitions in order
     */
    public TabularDataset(List<Column> columns, String indexName, List<Partition> partitions) {
        this.columns = ImmutableList.copyOf(columns);
        this.indexName = indexName;
        this.partitions = ImmutableList.copyOf(partitions);
    }

    /**
     * Creates a single-partition dataset over in-memory rows. Rows are identified by their
     * position.
     *
     * @param columns columns in order
     * @param rows cell values per row
     * @return the dataset
     */
    public static TabularDataset of(List<Column> columns, List<? extends List<?>> rows) {
        List<DataRow> dataRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Preconditions.checkArgument(rows.get(i).size() == columns.size(),
                    "Row %s has %s values but there are %s columns", i, rows.get(i).size(),
                    columns.size());
            dataRows.add(new DataRow((long) i, rows.get(i)));
        }
        return new TabularDataset(columns, null, List.<Partition>of(dataRows::stream));
    }

    public List<Column> getColumns() {
        return columns;
    }

    /**
     * Returns the column names in order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        return columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    public String getIndexName() {
        return indexName;
    }

    public int getNumPartitions() {
        return partitions.size();
    }

    /**
     * Determines whether a column with the given name exists.
     *
     * @param name column name
     * @return {@code true} if present
     */
    public boolean hasColumn(String name) {
        return columnPosition(name) >= 0;
    }

    /**
     * Returns the position of the first column with the given name.
     *
     * @param name column name
     * @return zero-based position, or {@code -1} if absent
     */
    public int columnPosition(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (Objects.equals(columns.get(i).getName(), name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Removes the rows whose cells are all missing.
     *
     * @return the filtered dataset
     */
    public TabularDataset dropEmptyRows() {
        return transform(columns, indexName, rows -> rows.filter(row -> !row.isEmpty()));
    }

    /**
     * Renames all columns at once, keeping their types.
     *
     * @param names new names, one per column
     * @return the renamed dataset
     * @throws IllegalArgumentException if the number of names does not match the columns
     */
    public TabularDataset withColumnNames(List<String> names) {
        Preconditions.checkArgument(names.size() == columns.size(),
                "Expected %s column names but got %s", columns.size(), names.size());
        List<Column> renamed = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            renamed.add(columns.get(i).rename(names.get(i)));
        }
        return new TabularDataset(renamed, indexName, partitions);
    }

    /**
     * Replaces the missing values of one column.
     *
     * @param position zero-based column position
     * @param value replacement value
     * @return the filled dataset
     * @throws IllegalArgumentException if the column type does not accept {@code value}
     */
    public TabularDataset fillMissing(int position, Object value) {
        Column column = columns.get(position);
        if (!column.getType().accepts(value)) {
            throw new IllegalArgumentException(String.format(
                    "Column '%s' of type %s cannot hold a value of type %s", column.getName(),
                    column.getType(), value.getClass().getSimpleName()));
        }
        return transform(columns, indexName, rows -> rows
                .map(row -> row.get(position) == null ? row.with(position, value) : row));
    }

    /**
     * Promotes a column to the row identity. The column is removed from the regular columns.
     *
     * @param name column name
     * @return the re-indexed dataset
     * @throws IllegalArgumentException if the column does not exist
     */
    public TabularDataset setIndex(String name) {
        int position = columnPosition(name);
        Preconditions.checkArgument(position >= 0, "No such column: %s", name);
        List<Column> remaining = new ArrayList<>(columns);
        remaining.remove(position);
        return transform(remaining, name, rows -> rows.map(row -> row.promote(position)));
    }

    /**
     * Derives a dataset with new columns computed row by row. Row identities are kept.
     *
     * @param newColumns columns of the derived dataset
     * @param rowFunction computes the new cell values from a row of this dataset
     * @return the derived dataset
     */
    public TabularDataset derive(List<Column> newColumns,
            Function<DataRow, List<Object>> rowFunction) {
        int width = newColumns.size();
        return transform(newColumns, indexName, rows -> rows.map(row -> {
            List<Object> values = rowFunction.apply(row);
            if (values.size() != width) {
                throw new IllegalStateException(String.format(
                        "Derived row %s has %s values but there are %s columns", row.getIndex(),
                        values.size(), width));
            }
            return new DataRow(row.getIndex(), values);
        }));
    }

    /**
     * Returns the rows of all partitions, in order. The stream is lazy and sequential; it should be
     * closed when not fully consumed.
     *
     * @return the rows
     */
    public Stream<DataRow> rows() {
        return partitions.stream().flatMap(Partition::open);
    }

    /**
     * Materializes the whole dataset. Partitions are computed in parallel.
     *
     * @return the in-memory table
     */
    public Table compute() {
        List<List<DataRow>> computed = partitions.parallelStream()
                .map(TabularDataset::collect).collect(Collectors.toList());
        List<DataRow> all = new ArrayList<>();
        computed.forEach(all::addAll);
        return new Table(columns, indexName, all);
    }

    /**
     * Materializes the first {@code n} rows.
     *
     * @param n number of rows
     * @return the in-memory table
     */
    public Table head(int n) {
        Preconditions.checkArgument(n >= 0, "n must not be negative: %s", n);
        try (Stream<DataRow> rows = rows()) {
            return new Table(columns, indexName, rows.limit(n).collect(Collectors.toList()));
        }
    }

    /**
     * Counts the rows. Partitions are counted in parallel.
     *
     * @return the number of rows
     */
    public long count() {
        return partitions.parallelStream().mapToLong(partition -> {
            try (Stream<DataRow> rows = partition.open()) {
                return rows.count();
            }
        }).sum();
    }

    private static List<DataRow> collect(Partition partition) {
        try (Stream<DataRow> rows = partition.open()) {
            return rows.collect(Collectors.toList());
        }
    }

    private TabularDataset transform(List<Column> newColumns, String newIndexName,
            UnaryOperator<Stream<DataRow>> operation) {
        List<Partition> derived = partitions.stream()
                .map(partition -> (Partition) () -> operation.apply(partition.open()))
                .collect(Collectors.toList());
        return new TabularDataset(newColumns, newIndexName, derived);
    }

    @Override
    public String toString() {
        return "TabularDataset[columns=" + getColumnNames() + ", index=" + indexName
                + ", partitions=" + partitions.size() + "]";
    }
}

package io.github.flexsource.frame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row of a {@link TabularDataset}: its identity (index value) and its cell values in column
 * order.
 *
 * <p>
 * Instances are immutable. Cell values may be {@code null}, which denotes a missing value.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DataRow {

    // Row identity, taken from the dataset index
    private final Object index;

    // Cell values, one per column
    private final List<Object> values;

    /**
     * Creates a row.
     *
     * @param index row identity
     * @param values cell values in column order
     */
    public DataRow(Object index, List<?> values) {
        this.index = index;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Returns the value at the given column position.
     *
     * @param position zero-based column position
     * @return the cell value, may be {@code null}
     */
    public Object get(int position) {
        return values.get(position);
    }

    /**
     * Returns the number of cells of this row.
     *
     * @return the number of cells
     */
    public int size() {
        return values.size();
    }

    /**
     * Determines whether every cell of this row is missing.
     *
     * @return {@code true} when all values are {@code null}
     */
    public boolean isEmpty() {
        return values.stream().allMatch(Objects::isNull);
    }

    /**
     * Returns a copy of this row with the value at {@code position} replaced.
     *
     * @param position zero-based column position
     * @param value new value
     * @return the new row
     */
    public DataRow with(int position, Object value) {
        List<Object> copy = new ArrayList<>(values);
        copy.set(position, value);
        return new DataRow(index, copy);
    }

    /**
     * Returns a copy of this row using the value at {@code position} as its identity; the cell is
     * removed from the values.
     *
     * @param position zero-based column position
     * @return the re-indexed row
     */
    public DataRow promote(int position) {
        List<Object> copy = new ArrayList<>(values);
        Object newIndex = copy.remove(position);
        return new DataRow(newIndex, copy);
    }
}

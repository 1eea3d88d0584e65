package io.github.flexsource.frame;

import lombok.Value;

/**
 * Named, typed column of a {@link TabularDataset}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class Column {

    // Column name as exposed by the dataset
    String name;

    // Type of the values held by the column
    DataType type;

    /**
     * Creates a {@link DataType#STRING} column.
     *
     * @param name column name
     * @return the column
     */
    public static Column string(String name) {
        return new Column(name, DataType.STRING);
    }

    /**
     * Creates a {@link DataType#OBJECT} column.
     *
     * @param name column name
     * @return the column
     */
    public static Column object(String name) {
        return new Column(name, DataType.OBJECT);
    }

    /**
     * Returns a copy of this column with another name and the same type.
     *
     * @param newName new column name
     * @return the renamed column
     */
    public Column rename(String newName) {
        return new Column(newName, type);
    }
}

package io.github.flexsource.parser;

import io.github.flexsource.frame.TabularDataset;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Reader for one source format, producing a lazily evaluated {@link TabularDataset}.
 *
 * <p>
 * Implementations inspect the source eagerly only as far as needed to know its columns; rows are
 * read when the dataset is materialized. Backends that have no file-system source (for example a
 * remote search index) receive an empty source list and are configured purely through the
 * parameters.
 * </p>
 */
@FunctionalInterface
public interface FormatReader {

    /**
     * Reads the given source.
     *
     * @param source paths or backend identifiers, empty when the data source has no source
     * @param parameters merged reader parameters
     * @return the raw dataset
     * @throws IOException if the source cannot be opened or inspected
     */
    TabularDataset read(List<String> source, Map<String, Object> parameters) throws IOException;
}

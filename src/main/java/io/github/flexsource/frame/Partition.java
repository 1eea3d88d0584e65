package io.github.flexsource.frame;

import java.util.stream.Stream;

/**
 * One independently computable slice of a {@link TabularDataset}, typically one source file.
 *
 * <p>
 * Calling {@link #open()} starts a new computation every time. Implementations that hold external
 * resources must release them through {@link Stream#onClose(Runnable)}; I/O failures are reported
 * as {@link java.io.UncheckedIOException}.
 * </p>
 */
@FunctionalInterface
public interface Partition {

    /**
     * Computes the rows of this partition.
     *
     * @return a lazily populated stream of rows
     */
    Stream<DataRow> open();
}

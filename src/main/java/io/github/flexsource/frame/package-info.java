/**
 * Minimal lazy tabular engine.
 *
 * <p>
 * {@link io.github.flexsource.frame.TabularDataset} models a partitioned table as a graph of
 * per-partition transformations that is only executed on materialization. Readers produce
 * datasets, the core derives sanitized and mapped views from them.
 * </p>
 */
package io.github.flexsource.frame;

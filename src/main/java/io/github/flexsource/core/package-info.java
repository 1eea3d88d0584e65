/**
 * The data source pipeline.
 *
 * <p>
 * {@link io.github.flexsource.core.DataSource} ties the steps together: the
 * {@link io.github.flexsource.core.SourceLoader} reads the raw dataset, the
 * {@link io.github.flexsource.core.DataFrameSanitizer} normalizes it, the
 * {@link io.github.flexsource.core.SchemaMapper} projects it onto the logical fields of a
 * {@link io.github.flexsource.core.MappingSpecification}, and the
 * {@link io.github.flexsource.core.RecordEmitter} turns either view into records.
 * </p>
 */
package io.github.flexsource.core;

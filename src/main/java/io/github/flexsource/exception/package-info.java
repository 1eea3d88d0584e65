/**
 * Error taxonomy of the data source pipeline.
 *
 * <p>
 * All exceptions are unchecked and extend
 * {@link io.github.flexsource.exception.DataSourceException}. They are raised by the operation that
 * detects the problem and are never retried internally.
 * </p>
 */
package io.github.flexsource.exception;

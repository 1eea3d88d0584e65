/**
 * Format readers and their registry.
 *
 * <p>
 * {@link io.github.flexsource.parser.ReaderRegistry} maps format keys to
 * {@link io.github.flexsource.parser.FormatReader}s and their default parameters.
 * {@link io.github.flexsource.parser.FormatResolver} derives the key from the source paths when no
 * format is given. The built-in readers are listed in
 * {@link io.github.flexsource.parser.DataFormat}.
 * </p>
 */
package io.github.flexsource.parser;

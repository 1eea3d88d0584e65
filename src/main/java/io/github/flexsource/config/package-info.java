/**
 * Data source definitions, their YAML form, and the settings of the command-line front end.
 */
package io.github.flexsource.config;

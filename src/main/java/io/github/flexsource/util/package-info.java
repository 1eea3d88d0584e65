/**
 * Helpers of the command-line front end.
 */
package io.github.flexsource.util;

package io.github.flexsource.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry mapping format keys to {@link FormatReader} implementations and their default
 * parameters.
 *
 * <h2>How to use</h2>
 * <ol>
 * <li>{@link #getDefault()} returns the process-wide registry, pre-populated with the built-in
 * {@link DataFormat}s. Data sources use it unless another registry is supplied.</li>
 * <li>Call {@link #register(String, FormatReader, Map)} to add a format or replace the reader of an
 * existing one. Replacing logs a warning; the last registration wins.</li>
 * <li>Data sources take a {@link #snapshot()} at construction time. Registrations only affect data
 * sources constructed afterwards.</li>
 * </ol>
 *
 * <h2>Thread-safety</h2>
 *
 * <p>
 * Registration and snapshotting are synchronized on the registry instance.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ReaderRegistry {

    private static final ReaderRegistry DEFAULT = withBuiltInFormats();

    // Format key (lower case) to reader entry, in registration order
    private final Map<String, ReaderEntry> entries = new LinkedHashMap<>();

    /**
     * Returns the process-wide registry.
     *
     * @return the shared registry
     */
    public static ReaderRegistry getDefault() {
        return DEFAULT;
    }

    /**
     * Creates a registry without any format.
     *
     * @return a new, empty registry
     */
    public static ReaderRegistry empty() {
        return new ReaderRegistry();
    }

    /**
     * Creates a registry holding one entry per key of every built-in {@link DataFormat}.
     *
     * @return a new registry
     */
    public static ReaderRegistry withBuiltInFormats() {
        ReaderRegistry registry = new ReaderRegistry();
        for (DataFormat format : DataFormat.values()) {
            FormatReader reader = format.createReader();
            for (String key : format.getKeys()) {
                registry.entries.put(key, new ReaderEntry(reader, format.getDefaultParameters()));
            }
        }
        return registry;
    }

    /**
     * Registers a reader for a format key.
     *
     * @param formatKey format key, matched case-insensitively
     * @param reader reader implementation
     * @param defaultParameters default reader parameters, may be {@code null}
     * @throws NullPointerException if {@code formatKey} or {@code reader} is {@code null}
     */
    public synchronized void register(String formatKey, FormatReader reader,
            Map<String, Object> defaultParameters) {
        Objects.requireNonNull(formatKey, "formatKey");
        Objects.requireNonNull(reader, "reader");

        String key = ReaderCatalog.normalize(formatKey);
        if (entries.containsKey(key)) {
            log.warn("Already defined format {}", key);
        }
        entries.put(key, new ReaderEntry(reader, defaultParameters));
        log.debug("register: format={}, reader={}", key, reader.getClass().getName());
    }

    /**
     * Returns an immutable snapshot of the current entries.
     *
     * @return the snapshot
     */
    public synchronized ReaderCatalog snapshot() {
        return new ReaderCatalog(entries);
    }

    /**
     * Finds the reader entry for a format key in the current entries.
     *
     * @param formatKey format key, matched case-insensitively after trimming
     * @return the entry
     * @throws io.github.flexsource.exception.UnsupportedFormatException if the key is unknown
     */
    public ReaderEntry lookup(String formatKey) {
        return snapshot().lookup(formatKey);
    }

    /**
     * Returns the registered format keys.
     *
     * @return format keys in registration order
     */
    public Set<String> getFormatKeys() {
        return snapshot().getFormatKeys();
    }
}

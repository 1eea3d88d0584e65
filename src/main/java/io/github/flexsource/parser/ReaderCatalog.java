package io.github.flexsource.parser;

import com.google.common.collect.ImmutableMap;
import io.github.flexsource.exception.UnsupportedFormatException;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a {@link ReaderRegistry}.
 *
 * <p>
 * A data source resolves its reader against a snapshot taken at construction time, so concurrent
 * registrations never affect a construction in progress.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ReaderCatalog {

    // Format key (lower case) to reader entry
    private final ImmutableMap<String, ReaderEntry> entries;

    ReaderCatalog(Map<String, ReaderEntry> entries) {
        this.entries = ImmutableMap.copyOf(entries);
    }

    /**
     * Finds the reader entry for a format key. The key is matched case-insensitively after
     * trimming.
     *
     * @param formatKey format key
     * @return the entry
     * @throws UnsupportedFormatException if no reader is registered for the key
     */
    public ReaderEntry lookup(String formatKey) {
        ReaderEntry entry = formatKey == null ? null : entries.get(normalize(formatKey));
        if (entry == null) {
            throw new UnsupportedFormatException(formatKey, entries.keySet());
        }
        return entry;
    }

    /**
     * Returns the registered format keys in registration order.
     *
     * @return format keys
     */
    public Set<String> getFormatKeys() {
        return entries.keySet();
    }

    static String normalize(String formatKey) {
        return formatKey.trim().toLowerCase(Locale.ROOT);
    }
}

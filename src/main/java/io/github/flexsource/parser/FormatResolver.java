package io.github.flexsource.parser;

import com.google.common.base.Preconditions;
import io.github.flexsource.exception.HeterogeneousSourceException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Infers the format key of a source from its paths.
 *
 * <p>
 * The key of a path is its extension without the dot or, when it has none, its base name (so a
 * symbolic backend name such as {@code elasticsearch} is its own key). All paths of a source must
 * agree on one key.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FormatResolver {

    private FormatResolver() {
        // Utility class; do not instantiate.
    }

    /**
     * Resolves the format key shared by all paths of a source.
     *
     * @param source one or more paths
     * @return the lower-cased format key
     * @throws IllegalArgumentException if the source is empty
     * @throws HeterogeneousSourceException if the paths resolve to more than one key
     */
    public static String resolve(List<String> source) {
        Preconditions.checkArgument(source != null && !source.isEmpty(),
                "source must not be empty");
        Set<String> formats = new LinkedHashSet<>();
        for (String path : source) {
            formats.add(formatOf(path));
        }
        if (formats.size() != 1) {
            throw new HeterogeneousSourceException(formats);
        }
        return formats.iterator().next();
    }

    /**
     * Returns the format key of a single path.
     *
     * @param path file path, URL or backend name
     * @return the lower-cased format key
     */
    public static String formatOf(String path) {
        String extension = FilenameUtils.getExtension(path);
        String key = StringUtils.isNotEmpty(extension) ? extension : FilenameUtils.getName(path);
        return StringUtils.trimToEmpty(key).toLowerCase(Locale.ROOT);
    }
}

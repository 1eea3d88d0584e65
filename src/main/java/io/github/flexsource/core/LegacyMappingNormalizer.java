package io.github.flexsource.core;

import com.google.common.collect.ImmutableList;
import io.github.flexsource.exception.LegacyLabelResolutionException;
import io.github.flexsource.exception.UnsupportedLegacyFeatureException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Rewrites legacy mapping shapes into the canonical form accepted by
 * {@link MappingSpecification#of(Map)}.
 *
 * <ul>
 * <li>a {@code target} field is renamed to {@code label}, unless a {@code label} field exists</li>
 * <li>a {@code label} given as a nested map is replaced by the column named under its first
 * non-blank key among {@code name}, {@code label}, {@code gold_label} and {@code field}</li>
 * </ul>
 *
 * <p>
 * Both rewrites log a deprecation warning. The input map is never modified.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class LegacyMappingNormalizer {

    static final String TARGET = "target";

    static final String LABEL = "label";

    static final String METADATA_FILE = "metadata_file";

    static final List<String> LABEL_KEYS = ImmutableList.of("name", LABEL, "gold_label", "field");

    /**
     * Normalizes a mapping.
     *
     * @param mapping raw mapping
     * @return a new, normalized mapping with the same field order
     * @throws UnsupportedLegacyFeatureException if the nested label uses {@code metadata_file}
     * @throws LegacyLabelResolutionException if the nested label has none of the recognized keys
     */
    public static Map<String, Object> normalize(Map<String, ?> mapping) {
        boolean renameTarget = mapping.containsKey(TARGET) && !mapping.containsKey(LABEL);
        if (renameTarget) {
            log.warn("Mapping field '{}' is deprecated, use '{}' instead", TARGET, LABEL);
        }

        Map<String, Object> normalized = new LinkedHashMap<>();
        mapping.forEach((name, reference) -> {
            String field = renameTarget && TARGET.equals(name) ? LABEL : name;
            Object value = reference;
            if (LABEL.equals(field) && reference instanceof Map) {
                value = resolveLabel((Map<?, ?>) reference);
            }
            normalized.put(field, value);
        });
        return normalized;
    }

    private static String resolveLabel(Map<?, ?> label) {
        if (label.containsKey(METADATA_FILE)) {
            throw new UnsupportedLegacyFeatureException(String.format(
                    "The '%s' option of the label mapping is no longer supported. "
                            + "Map the label column directly instead.",
                    METADATA_FILE));
        }
        for (String key : LABEL_KEYS) {
            Object column = label.get(key);
            if (column != null && StringUtils.isNotBlank(column.toString())) {
                log.warn("Nested label mappings are deprecated, use 'label: {}' instead", column);
                return column.toString();
            }
        }
        throw new LegacyLabelResolutionException(String.format(
                "Cannot resolve the label column from %s, expected one of the keys %s", label,
                LABEL_KEYS));
    }
}

package io.github.flexsource.config;

import io.github.flexsource.exception.DataSourceException;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads and writes data source definitions as YAML.
 *
 * <p>
 * On load, file-system paths under the keys {@code path} and {@code source}, at any depth, are
 * resolved against the directory of the YAML file when they are relative. A value counts as a
 * relative path when it has no URL scheme, is not absolute, and either has a file extension or
 * names an existing file. Backend identifiers such as {@code elasticsearch} are left untouched,
 * and so are the column references under {@code mapping} and {@code forward}.
 * </p>
 *
 * <p>
 * Top-level keys:
 * </p>
 * <ul>
 * <li>{@code source}: a path or a list of paths</li>
 * <li>{@code format}, {@code attributes}, {@code mapping}</li>
 * <li>{@code forward}: deprecated name of {@code mapping}</li>
 * <li>anything else: legacy reader parameters</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DataSourceConfigLoader {

    static final String SOURCE = "source";

    static final String PATH = "path";

    static final String FORMAT = "format";

    static final String ATTRIBUTES = "attributes";

    static final String MAPPING = "mapping";

    static final String FORWARD = "forward";

    private static final Set<String> PATH_KEYS = Set.of(PATH, SOURCE);

    // Column references, never file-system paths
    private static final Set<String> MAPPING_KEYS = Set.of(MAPPING, FORWARD);

    /**
     * Loads a definition from a YAML file.
     *
     * @param yamlFile YAML file
     * @return the definition, mapping not yet normalized
     * @throws IOException if the file cannot be read
     * @throws DataSourceException if the document is not a mapping
     */
    public static DataSourceDefinition load(Path yamlFile) throws IOException {
        Object document;
        try (Reader reader = Files.newBufferedReader(yamlFile, StandardCharsets.UTF_8)) {
            document = new Yaml().load(reader);
        }
        if (!(document instanceof Map)) {
            throw new DataSourceException(
                    "Data source configuration must be a YAML mapping: " + yamlFile);
        }
        Path baseDir = yamlFile.toAbsolutePath().getParent();
        Map<String, Object> config = new LinkedHashMap<>();
        asStringMap(document).forEach((key, value) -> config.put(key,
                MAPPING_KEYS.contains(key) ? value
                        : resolvePaths(baseDir, value, PATH_KEYS.contains(key))));

        DataSourceDefinition definition = new DataSourceDefinition();
        definition.setSource(toSourceList(config.remove(SOURCE)));
        Object format = config.remove(FORMAT);
        definition.setFormat(format == null ? null : format.toString());
        Object attributes = config.remove(ATTRIBUTES);
        if (attributes != null) {
            definition.setAttributes(asStringMap(attributes));
        }

        Object mapping = config.remove(MAPPING);
        Object forward = config.remove(FORWARD);
        if (isEmpty(mapping) && forward != null) {
            log.warn("The key '{}' is deprecated! Please use the '{}' key in the future.", FORWARD,
                    MAPPING);
            mapping = forward;
        }
        if (!isEmpty(mapping)) {
            definition.setMapping(asStringMap(mapping));
        }
        definition.setKwargs(config);

        log.debug("Loaded data source configuration {}: {}", yamlFile, definition);
        return definition;
    }

    /**
     * Writes the source, attributes and mapping of a definition as YAML. A single source is
     * written as a scalar.
     *
     * @param definition definition to write
     * @param yamlFile target file
     * @param makeSourcePathAbsolute whether relative source paths are written as absolute paths
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public static Path save(DataSourceDefinition definition, Path yamlFile,
            boolean makeSourcePathAbsolute) throws IOException {
        List<String> source = new ArrayList<>();
        for (String entry : definition.getSource()) {
            source.add(makeSourcePathAbsolute && isRelativeFileSystemPath(entry, null)
                    ? Paths.get(entry).toAbsolutePath().normalize().toString()
                    : entry);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put(SOURCE, source.size() == 1 ? source.get(0) : source);
        document.put(ATTRIBUTES, definition.getAttributes());
        document.put(MAPPING, definition.getMapping());

        DumperOptions opts = new DumperOptions();
        opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        opts.setPrettyFlow(true);
        try (Writer writer = Files.newBufferedWriter(yamlFile, StandardCharsets.UTF_8)) {
            new Yaml(opts).dump(document, writer);
        }
        log.info("Data source configuration written: {}", yamlFile);
        return yamlFile;
    }

    /**
     * Determines whether a value is a relative file-system path.
     *
     * @param value candidate path
     * @param baseDir directory relative paths are checked against, may be {@code null}
     * @return {@code true} for relative paths
     */
    static boolean isRelativeFileSystemPath(String value, Path baseDir) {
        if (StringUtils.isBlank(value) || value.contains("://")) {
            return false;
        }
        Path path;
        try {
            path = Paths.get(value);
        } catch (InvalidPathException e) {
            log.debug("Not a file-system path: {}", value);
            return false;
        }
        if (path.isAbsolute()) {
            return false;
        }
        if (StringUtils.isNotEmpty(FilenameUtils.getExtension(value))) {
            return true;
        }
        return Files.exists(baseDir == null ? path : baseDir.resolve(path));
    }

    private static Object resolvePaths(Path baseDir, Object value, boolean pathValue) {
        if (value instanceof Map) {
            Map<String, Object> resolved = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, nested) -> {
                String name = String.valueOf(key);
                resolved.put(name, resolvePaths(baseDir, nested, PATH_KEYS.contains(name)));
            });
            return resolved;
        }
        if (value instanceof Collection) {
            List<Object> resolved = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                resolved.add(resolvePaths(baseDir, element, pathValue));
            }
            return resolved;
        }
        if (pathValue && value instanceof String
                && isRelativeFileSystemPath((String) value, baseDir)) {
            return baseDir.resolve((String) value).normalize().toString();
        }
        return value;
    }

    private static List<String> toSourceList(Object source) {
        List<String> list = new ArrayList<>();
        if (source instanceof Collection) {
            ((Collection<?>) source).forEach(entry -> list.add(String.valueOf(entry)));
        } else if (source != null) {
            list.add(source.toString());
        }
        return list;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asStringMap(Object value) {
        if (!(value instanceof Map)) {
            throw new DataSourceException("Expected a YAML mapping but got: " + value);
        }
        Map<String, Object> map = new LinkedHashMap<>();
        ((Map<Object, Object>) value)
                .forEach((key, nested) -> map.put(String.valueOf(key), nested));
        return map;
    }

    private static boolean isEmpty(Object mapping) {
        return mapping == null || (mapping instanceof Map && ((Map<?, ?>) mapping).isEmpty());
    }
}

package io.github.flexsource.parser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.DataRow;
import io.github.flexsource.frame.DataType;
import io.github.flexsource.frame.Partition;
import io.github.flexsource.frame.TabularDataset;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Base class of the readers whose source is one or more local files.
 *
 * <p>
 * Every file becomes one partition. The files of a source are combined by column name: the dataset
 * columns are the union of the file columns in order of first appearance, and a file lacking a
 * column yields missing values for it. A column whose type differs between files becomes
 * {@link DataType#OBJECT}.
 * </p>
 *
 * <p>
 * When the source is empty the paths are taken from the {@code path} parameter. Glob patterns
 * such as {@code reviews/*.csv} are expanded to the matching files, one partition each. When
 * {@code include_path_column} is enabled, a {@value ReservedColumns#PATH} column holding the file
 * path is appended unless the file already has one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class FileFormatReader implements FormatReader {

    /** Parameter giving the file path(s) when the source is empty. */
    public static final String PATH_PARAMETER = "path";

    /** Parameter enabling the {@value ReservedColumns#PATH} column. */
    public static final String INCLUDE_PATH_COLUMN = "include_path_column";

    /** Parameter turning NA markers into missing values. */
    public static final String NA_FILTER = "na_filter";

    /** Parameter forcing column types; {@code str} reads every column as text. */
    public static final String DTYPE = "dtype";

    // Text recognized as a missing value when na_filter is enabled
    protected static final Set<String> NA_VALUES = ImmutableSet.of("", "#N/A", "#N/A N/A", "#NA",
            "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN", "<NA>", "N/A", "NA",
            "NULL", "NaN", "None", "n/a", "nan", "null");

    /**
     * {@inheritDoc}
     */
    @Override
    public TabularDataset read(List<String> source, Map<String, Object> parameters)
            throws IOException {
        ReaderParameters params = new ReaderParameters(parameters);
        List<String> paths = source.isEmpty() ? params.getStringList(PATH_PARAMETER) : source;
        if (paths.isEmpty()) {
            throw new IllegalArgumentException(getClass().getSimpleName()
                    + " requires a source or a '" + PATH_PARAMETER + "' parameter");
        }
        boolean includePath = params.getBoolean(INCLUDE_PATH_COLUMN, includePathColumnByDefault());
        List<String> expanded = expandGlobs(paths);

        List<FilePartition> files = new ArrayList<>(expanded.size());
        for (String path : expanded) {
            FilePartition file = inspect(Paths.get(path), params);
            if (includePath && !file.getColumnNames().contains(ReservedColumns.PATH)) {
                file = file.withConstantColumn(Column.string(ReservedColumns.PATH), path);
            }
            log.debug("Inspected file: path={}, columns={}", path, file.getColumnNames());
            files.add(file);
        }
        return union(files);
    }

    /**
     * Replaces glob patterns ({@code *}, {@code ?}, {@code [..]}, {@code {..}}) by the regular files
     * they match, sorted by path. Other paths are kept as they are.
     *
     * @param paths paths and patterns in order
     * @return the file paths
     * @throws NoSuchFileException if a pattern matches no file
     * @throws IOException if a directory cannot be listed
     */
    static List<String> expandGlobs(List<String> paths) throws IOException {
        List<String> expanded = new ArrayList<>();
        for (String path : paths) {
            if (!isGlob(path)) {
                expanded.add(path);
                continue;
            }
            List<String> matches = matchGlob(Paths.get(path));
            if (matches.isEmpty()) {
                throw new NoSuchFileException(path, null, "No file matches the pattern");
            }
            log.debug("Expanded pattern {} to {}", path, matches);
            expanded.addAll(matches);
        }
        return expanded;
    }

    private static boolean isGlob(String path) {
        return StringUtils.containsAny(path, '*', '?', '[', '{');
    }

    private static List<String> matchGlob(Path pattern) throws IOException {
        // Walk from the deepest directory that contains no wildcard
        Path base = pattern.isAbsolute() ? pattern.getRoot() : Paths.get("");
        int literalNames = 0;
        for (Path name : pattern) {
            if (isGlob(name.toString())) {
                break;
            }
            base = base.resolve(name);
            literalNames++;
        }
        if (!Files.isDirectory(base)) {
            return new ArrayList<>();
        }
        int depth = pattern.toString().contains("**") ? Integer.MAX_VALUE
                : pattern.getNameCount() - literalNames;
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> candidates = Files.walk(base, depth)) {
            return candidates.filter(Files::isRegularFile).filter(matcher::matches)
                    .map(Path::toString).sorted().collect(Collectors.toList());
        }
    }

    /**
     * Reads the columns of one file and prepares the lazy computation of its rows. Row identities
     * are the zero-based row numbers within the file.
     *
     * @param file the file
     * @param params reader parameters
     * @return the file columns and rows
     * @throws IOException if the file cannot be opened or inspected
     */
    protected abstract FilePartition inspect(Path file, ReaderParameters params)
            throws IOException;

    /**
     * Whether the {@value ReservedColumns#PATH} column is added when
     * {@value #INCLUDE_PATH_COLUMN} is not given.
     *
     * @return the default of {@value #INCLUDE_PATH_COLUMN}
     */
    protected boolean includePathColumnByDefault() {
        return true;
    }

    /**
     * Applies NA filtering to a text cell.
     *
     * @param value raw text
     * @param naFilter whether NA markers denote missing values
     * @return {@code null} for NA markers when filtering, the text otherwise
     */
    protected static String filterNa(String value, boolean naFilter) {
        if (value == null) {
            return null;
        }
        return naFilter && NA_VALUES.contains(value) ? null : value;
    }

    /**
     * Makes header names unique: repeated names get a {@code .1}, {@code .2}, ... suffix.
     *
     * @param names header names in order
     * @return unique names in the same order
     */
    protected static List<String> deduplicate(List<String> names) {
        Set<String> used = new HashSet<>();
        Map<String, Integer> counters = new HashMap<>();
        List<String> unique = new ArrayList<>(names.size());
        for (String name : names) {
            String candidate = name;
            if (used.contains(candidate)) {
                int counter = counters.getOrDefault(name, 0);
                do {
                    counter++;
                    candidate = name + "." + counter;
                } while (used.contains(candidate));
                counters.put(name, counter);
            }
            used.add(candidate);
            unique.add(candidate);
        }
        return unique;
    }

    static TabularDataset union(List<FilePartition> files) {
        Map<String, DataType> merged = new LinkedHashMap<>();
        for (FilePartition file : files) {
            for (Column column : file.getColumns()) {
                merged.merge(column.getName(), column.getType(),
                        (left, right) -> left == right ? left : DataType.OBJECT);
            }
        }
        List<Column> columns = merged.entrySet().stream()
                .map(e -> new Column(e.getKey(), e.getValue())).collect(Collectors.toList());
        List<String> names = new ArrayList<>(merged.keySet());

        List<Partition> partitions = new ArrayList<>(files.size());
        for (FilePartition file : files) {
            List<String> fileNames = file.getColumnNames();
            if (fileNames.equals(names)) {
                partitions.add(file.getRows());
                continue;
            }
            int[] positions = names.stream().mapToInt(fileNames::indexOf).toArray();
            Partition rows = file.getRows();
            partitions.add(() -> rows.open().map(row -> align(row, positions)));
        }
        return new TabularDataset(columns, null, partitions);
    }

    private static DataRow align(DataRow row, int[] positions) {
        List<Object> values = new ArrayList<>(positions.length);
        for (int position : positions) {
            values.add(position < 0 ? null : row.get(position));
        }
        return new DataRow(row.getIndex(), values);
    }

    /**
     * Columns and lazily computed rows of one file.
     */
    @Value
    public static class FilePartition {

        // Columns of the file, names unique
        List<Column> columns;

        // Rows of the file
        Partition rows;

        /**
         * Creates the partition.
         *
         * @param columns columns of the file
         * @param rows rows of the file
         */
        public FilePartition(List<Column> columns, Partition rows) {
            this.columns = ImmutableList.copyOf(columns);
            this.rows = rows;
        }

        /**
         * Returns the column names in order.
         *
         * @return column names
         */
        public List<String> getColumnNames() {
            return columns.stream().map(Column::getName).collect(Collectors.toList());
        }

        FilePartition withConstantColumn(Column column, Object value) {
            List<Column> extended = new ArrayList<>(columns);
            extended.add(column);
            Partition source = rows;
            return new FilePartition(extended, () -> source.open().map(row -> {
                List<Object> values = new ArrayList<>(row.getValues());
                values.add(value);
                return new DataRow(row.getIndex(), values);
            }));
        }
    }
}

package io.github.flexsource.core;

import io.github.flexsource.core.MappingSpecification.FieldMapping;
import io.github.flexsource.exception.MissingMappingException;
import io.github.flexsource.exception.UnknownColumnException;
import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.TabularDataset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Projects a sanitized dataset onto the logical fields of a {@link MappingSpecification}.
 *
 * <p>
 * The mapped dataset has exactly one column per logical field, in declaration order, and keeps the
 * row identities of its input. A field mapped to one column holds that column's value and type. A
 * field mapped to several columns holds, per row, a map from source column name to cell value in
 * declared order; a list with a single column yields the cell value itself.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SchemaMapper {

    /**
     * Maps a dataset.
     *
     * @param dataset sanitized dataset, left untouched
     * @param mapping mapping specification, may be {@code null}
     * @return the mapped dataset
     * @throws MissingMappingException if {@code mapping} is {@code null}
     * @throws UnknownColumnException if referenced columns are missing from the dataset
     */
    public static TabularDataset map(TabularDataset dataset, MappingSpecification mapping) {
        if (mapping == null) {
            throw new MissingMappingException();
        }
        Set<String> missing = new LinkedHashSet<>();
        for (String column : mapping.getReferencedColumns()) {
            if (!dataset.hasColumn(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new UnknownColumnException(new ArrayList<>(missing), dataset.getColumnNames());
        }

        List<FieldMapping> fields = mapping.getFields();
        List<Column> columns = new ArrayList<>(fields.size());
        List<int[]> positions = new ArrayList<>(fields.size());
        for (FieldMapping field : fields) {
            int[] selected = field.getColumns().stream().mapToInt(dataset::columnPosition)
                    .toArray();
            positions.add(selected);
            if (selected.length == 1) {
                columns.add(dataset.getColumns().get(selected[0]).rename(field.getName()));
            } else {
                columns.add(Column.object(field.getName()));
            }
        }
        log.debug("Mapping columns {} to fields {}", dataset.getColumnNames(), mapping.toMap());

        return dataset.derive(columns, row -> {
            List<Object> values = new ArrayList<>(fields.size());
            for (int f = 0; f < fields.size(); f++) {
                int[] selected = positions.get(f);
                if (selected.length == 1) {
                    values.add(row.get(selected[0]));
                } else {
                    List<String> names = fields.get(f).getColumns();
                    Map<String, Object> record = new LinkedHashMap<>();
                    for (int c = 0; c < selected.length; c++) {
                        record.put(names.get(c), row.get(selected[c]));
                    }
                    values.add(record);
                }
            }
            return values;
        });
    }
}

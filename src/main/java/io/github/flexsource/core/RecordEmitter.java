package io.github.flexsource.core;

import io.github.flexsource.frame.TabularDataset;
import io.github.flexsource.parser.ReservedColumns;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Turns the rows of a dataset into records.
 *
 * <p>
 * A record starts with the row identity under {@value ReservedColumns#ID}, followed by one entry
 * per column in order, with {@code .} in column names replaced by {@code _}. The provenance field
 * {@value ReservedColumns#RESOURCE} is added last unless a column already provides it: it takes
 * the value of the {@value ReservedColumns#PATH} column when there is one, else the default
 * resource.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RecordEmitter {

    /**
     * Emits the records of a dataset. The stream is lazy and recomputes the dataset on every call;
     * close it when it is not fully consumed.
     *
     * @param dataset dataset to emit
     * @param defaultResource provenance used when the rows carry none, may be {@code null}
     * @return the records
     */
    public static Stream<Map<String, Object>> emit(TabularDataset dataset, String defaultResource) {
        List<String> keys = dataset.getColumnNames().stream()
                .map(name -> StringUtils.trimToEmpty(name).replace('.', '_'))
                .collect(Collectors.toList());
        int pathPosition = keys.indexOf(ReservedColumns.PATH);

        return dataset.rows().map(row -> {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put(ReservedColumns.ID, row.getIndex());
            for (int i = 0; i < keys.size(); i++) {
                record.put(keys.get(i), row.get(i));
            }
            if (!record.containsKey(ReservedColumns.RESOURCE)) {
                record.put(ReservedColumns.RESOURCE,
                        pathPosition >= 0 ? row.get(pathPosition) : defaultResource);
            }
            return record;
        });
    }
}

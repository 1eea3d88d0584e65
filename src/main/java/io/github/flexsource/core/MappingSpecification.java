package io.github.flexsource.core;

import com.google.common.collect.ImmutableList;
import io.github.flexsource.exception.InvalidMappingException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

/**
 * Projection of source columns onto logical fields.
 *
 * <p>
 * Each logical field references either one source column (1:1) or an ordered list of source
 * columns (1:N). Fields keep their declaration order.
 * </p>
 *
 * <pre>
 * mapping:
 *   text: review
 *   label: sentiment
 *   persons: [persons.0.name, persons.0.lastName]
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class MappingSpecification {

    // Logical fields in declaration order
    private final List<FieldMapping> fields;

    private MappingSpecification(List<FieldMapping> fields) {
        this.fields = ImmutableList.copyOf(fields);
    }

    /**
     * Builds a specification from its map form. Values are column references or collections of
     * column references; a scalar reference such as the position {@code 0} of a headerless source
     * is turned into its text form. Legacy shapes must have been normalized beforehand.
     *
     * @param mapping logical field name to column reference
     * @return the specification
     * @throws InvalidMappingException if a column reference is missing or a map
     */
    public static MappingSpecification of(Map<String, ?> mapping) {
        List<FieldMapping> fields = new ArrayList<>(mapping.size());
        mapping.forEach((name, reference) -> {
            if (reference == null || reference instanceof Map) {
                throw new InvalidMappingException(name, reference);
            }
            if (reference instanceof Collection) {
                List<String> columns = new ArrayList<>();
                for (Object column : (Collection<?>) reference) {
                    columns.add(String.valueOf(column));
                }
                fields.add(new FieldMapping(name, columns, true));
            } else {
                fields.add(new FieldMapping(name, ImmutableList.of(String.valueOf(reference)),
                        false));
            }
        });
        return new MappingSpecification(fields);
    }

    /**
     * Returns the map form of this specification.
     *
     * @return logical field name to column name or list of column names
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (FieldMapping field : fields) {
            map.put(field.getName(),
                    field.isMultiColumn() ? new ArrayList<>(field.getColumns())
                            : field.getColumns().get(0));
        }
        return map;
    }

    /**
     * Returns the source columns referenced by all fields, in declaration order.
     *
     * @return referenced columns, possibly with repetitions
     */
    public List<String> getReferencedColumns() {
        List<String> columns = new ArrayList<>();
        fields.forEach(field -> columns.addAll(field.getColumns()));
        return columns;
    }

    /**
     * One logical field and the source columns it is built from.
     */
    @Value
    public static class FieldMapping {

        // Logical field name
        String name;

        // Source columns in declared order
        List<String> columns;

        // Whether the field was declared with a list of columns
        boolean multiColumn;

        FieldMapping(String name, List<String> columns, boolean multiColumn) {
            this.name = name;
            this.columns = ImmutableList.copyOf(columns);
            this.multiColumn = multiColumn;
        }
    }
}

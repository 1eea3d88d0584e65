package io.github.flexsource.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.flexsource.exception.MissingMappingException;
import io.github.flexsource.exception.UnknownColumnException;
import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.DataType;
import io.github.flexsource.frame.Table;
import io.github.flexsource.frame.TabularDataset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SchemaMapperTest {

    private static TabularDataset dataset() {
        return TabularDataset.of(
                Arrays.asList(Column.string("persons.0.name"), Column.string("persons.0.lastName"),
                        new Column("age", DataType.LONG), Column.string("comment")),
                Arrays.asList(Arrays.asList("Alice", "Smith", 30L, "hi"),
                        Arrays.asList("Bob", "Jones", 40L, "")));
    }

    private static MappingSpecification mapping(Object... entries) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < entries.length; i += 2) {
            map.put((String) entries[i], entries[i + 1]);
        }
        return MappingSpecification.of(map);
    }

    @Test
    void map_正常ケース_一対一の対応を指定する_元の列の値と型がそのまま使われること() {
        TabularDataset mapped =
                SchemaMapper.map(dataset(), mapping("text", "comment", "years", "age"));

        assertEquals(Arrays.asList("text", "years"), mapped.getColumnNames());
        assertEquals(DataType.LONG, mapped.getColumns().get(1).getType());
        Table table = mapped.compute();
        assertEquals("hi", table.getValue(0, "text"));
        assertEquals(40L, table.getValue(1, "years"));
        assertEquals(1L, table.getIndex(1));
    }

    @Test
    void map_正常ケース_複数列の対応を指定する_宣言順のキーを持つレコードになること() {
        TabularDataset mapped = SchemaMapper.map(dataset(),
                mapping("persons", Arrays.asList("persons.0.name", "persons.0.lastName")));

        assertEquals(DataType.OBJECT, mapped.getColumns().get(0).getType());
        Object cell = mapped.compute().getValue(0, "persons");
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("persons.0.name", "Alice");
        expected.put("persons.0.lastName", "Smith");
        assertEquals(expected, cell);
        assertEquals(Arrays.asList("persons.0.name", "persons.0.lastName"),
                new ArrayList<>(((Map<?, ?>) cell).keySet()));
    }

    @Test
    void map_正常ケース_要素が一つのリストを指定する_スカラー値になること() {
        TabularDataset mapped = SchemaMapper.map(dataset(),
                mapping("name", Collections.singletonList("persons.0.name")));

        assertEquals("Bob", mapped.compute().getValue(1, "name"));
    }

    @Test
    void map_正常ケース_写像後も元のデータセットは変わらないこと() {
        TabularDataset source = dataset();
        SchemaMapper.map(source, mapping("text", "comment"));

        assertEquals(4, source.getColumnNames().size());
        assertEquals("Smith", source.compute().getValue(0, "persons.0.lastName"));
    }

    @Test
    void map_異常ケース_マッピングがない_MissingMappingExceptionが送出されること() {
        assertThrows(MissingMappingException.class, () -> SchemaMapper.map(dataset(), null));
    }

    @Test
    void map_異常ケース_存在しない列を参照する_UnknownColumnExceptionで全ての欠落列が示されること() {
        MappingSpecification mapping =
                mapping("text", "missing1", "other", Arrays.asList("age", "missing2"));
        UnknownColumnException ex = assertThrows(UnknownColumnException.class,
                () -> SchemaMapper.map(dataset(), mapping));

        assertEquals(Arrays.asList("missing1", "missing2"), ex.getMissingColumns());
        assertEquals(dataset().getColumnNames(), ex.getAvailableColumns());
        assertTrue(ex.getMessage().contains("missing1"));
    }
}

package io.github.flexsource.frame;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class TabularDatasetTest {

    private static TabularDataset sample() {
        return TabularDataset.of(
                Arrays.asList(Column.string("id"), Column.string("name"),
                        new Column("age", DataType.LONG)),
                Arrays.asList(Arrays.asList("a", "Alice", 30L), Arrays.asList(null, null, null),
                        Arrays.asList("b", null, null)));
    }

    @Test
    void of_正常ケース_インメモリ行を指定する_位置がインデックスになること() {
        Table table = sample().compute();
        assertEquals(3, table.getRowCount());
        assertEquals(0L, table.getIndex(0));
        assertEquals(2L, table.getIndex(2));
        assertEquals("Alice", table.getValue(0, "name"));
        assertEquals(Arrays.asList("id", "name", "age"), table.getColumnNames());
    }

    @Test
    void of_異常ケース_列数と値の数が異なる_IllegalArgumentExceptionが送出されること() {
        List<Column> columns = Arrays.asList(Column.string("a"), Column.string("b"));
        List<List<Object>> rows = Arrays.asList(Arrays.asList((Object) "only"));
        assertThrows(IllegalArgumentException.class, () -> TabularDataset.of(columns, rows));
    }

    @Test
    void dropEmptyRows_正常ケース_全セル欠損の行を含む_その行だけが除去されること() {
        Table table = sample().dropEmptyRows().compute();
        assertEquals(2, table.getRowCount());
        assertEquals(Arrays.asList(0L, 2L),
                table.getRows().stream().map(DataRow::getIndex).collect(Collectors.toList()));
    }

    @Test
    void fillMissing_正常ケース_文字列列を補完する_欠損値だけが置き換わること() {
        Table table = sample().fillMissing(1, "").compute();
        assertEquals("Alice", table.getValue(0, "name"));
        assertEquals("", table.getValue(2, "name"));
    }

    @Test
    void fillMissing_異常ケース_型が受け付けない値を指定する_IllegalArgumentExceptionが送出されること() {
        TabularDataset dataset = sample();
        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> dataset.fillMissing(2, ""));
        assertTrue(ex.getMessage().contains("age"));
    }

    @Test
    void setIndex_正常ケース_列をインデックスに昇格する_列から除かれ行の識別子になること() {
        TabularDataset dataset = sample().dropEmptyRows().setIndex("id");
        assertEquals("id", dataset.getIndexName());
        assertEquals(Arrays.asList("name", "age"), dataset.getColumnNames());
        Table table = dataset.compute();
        assertEquals("a", table.getIndex(0));
        assertEquals("b", table.getIndex(1));
        assertEquals(30L, table.getValue(0, "age"));
    }

    @Test
    void setIndex_異常ケース_存在しない列を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> sample().setIndex("missing"));
    }

    @Test
    void withColumnNames_正常ケース_列名を置き換える_型が維持されること() {
        TabularDataset renamed = sample().withColumnNames(Arrays.asList("x", "y", "z"));
        assertEquals(Arrays.asList("x", "y", "z"), renamed.getColumnNames());
        assertEquals(DataType.LONG, renamed.getColumns().get(2).getType());
    }

    @Test
    void derive_正常ケース_行ごとに新しい値を計算する_インデックスが維持されること() {
        TabularDataset derived = sample().derive(Arrays.asList(Column.object("pair")),
                row -> Arrays.asList((Object) Arrays.asList(row.get(0), row.get(1))));
        Table table = derived.compute();
        assertEquals(Arrays.asList("a", "Alice"), table.getValue(0, "pair"));
        assertEquals(1L, table.getIndex(1));
    }

    @Test
    void derive_異常ケース_値の数が列数と異なる_IllegalStateExceptionが送出されること() {
        TabularDataset derived = sample().derive(Arrays.asList(Column.object("a")),
                row -> new ArrayList<>());
        assertThrows(IllegalStateException.class, derived::compute);
    }

    @Test
    void rows_正常ケース_変換を定義する_実体化するまでパーティションが開かれないこと() {
        AtomicInteger opened = new AtomicInteger();
        Partition partition = () -> {
            opened.incrementAndGet();
            return Stream.of(new DataRow(0L, Arrays.asList("x")));
        };
        TabularDataset dataset =
                new TabularDataset(Arrays.asList(Column.string("v")), null, List.of(partition));
        TabularDataset transformed = dataset.dropEmptyRows().fillMissing(0, "");
        assertEquals(0, opened.get());

        assertEquals(1L, transformed.count());
        assertEquals(1, transformed.head(5).getRowCount());
        assertEquals(2, opened.get());
    }

    @Test
    void compute_正常ケース_複数パーティションを指定する_パーティション順に連結されること() {
        Partition first = () -> Stream.of(new DataRow(0L, Arrays.asList("a")),
                new DataRow(1L, Arrays.asList("b")));
        Partition second = () -> Stream.of(new DataRow(0L, Arrays.asList("c")));
        TabularDataset dataset = new TabularDataset(Arrays.asList(Column.string("v")), null,
                Arrays.asList(first, second));

        Table table = dataset.compute();
        assertEquals(2, dataset.getNumPartitions());
        assertEquals(Arrays.asList("a", "b", "c"), table.getRows().stream()
                .map(row -> row.get(0)).collect(Collectors.toList()));
        assertEquals(0L, table.getIndex(2));
    }

    @Test
    void head_正常ケース_行数より多く指定する_全行が返ること() {
        assertEquals(3, sample().head(10).getRowCount());
        assertEquals(1, sample().head(1).getRowCount());
    }

    @Test
    void head_異常ケース_負数を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> sample().head(-1));
    }

    @Test
    void columnPosition_正常ケース_重複列名がある_最初の位置が返ること() {
        TabularDataset dataset = TabularDataset.of(
                Arrays.asList(Column.string("a"), Column.string("a")),
                Arrays.asList(Arrays.asList("1", "2")));
        assertEquals(0, dataset.columnPosition("a"));
        assertEquals(-1, dataset.columnPosition("b"));
        assertTrue(dataset.hasColumn("a"));
        assertFalse(dataset.hasColumn("b"));
    }

    @Test
    void getValue_異常ケース_存在しない列を指定する_IllegalArgumentExceptionが送出されること() {
        Table table = sample().compute();
        assertThrows(IllegalArgumentException.class, () -> table.getValue(0, "missing"));
    }
}

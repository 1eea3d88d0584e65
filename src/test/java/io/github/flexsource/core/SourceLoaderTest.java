package io.github.flexsource.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.github.flexsource.exception.DataSourceReadException;
import io.github.flexsource.exception.UnsupportedFormatException;
import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.TabularDataset;
import io.github.flexsource.parser.FormatReader;
import io.github.flexsource.parser.ReaderRegistry;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

class SourceLoaderTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(SourceLoader.class);

    private ListAppender<ILoggingEvent> appender;

    private FormatReader reader;

    private SourceLoader loader;

    private final TabularDataset dataset =
            TabularDataset.of(Arrays.asList(Column.string("a")), Collections.emptyList());

    @BeforeEach
    void setUp() throws IOException {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);

        reader = mock(FormatReader.class);
        when(reader.read(anyList(), anyMap())).thenReturn(dataset);
        Map<String, Object> defaults = new HashMap<>();
        defaults.put("a", 1);
        defaults.put("b", 1);
        defaults.put("c", 1);
        ReaderRegistry registry = ReaderRegistry.empty();
        registry.register("fake", reader, defaults);
        loader = new SourceLoader(registry.snapshot());
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private long warnings() {
        return appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
    }

    @SuppressWarnings("unchecked")
    @Test
    void load_正常ケース_全ての階層にパラメータがある_既定値より旧引数より属性が優先されること()
            throws Exception {
        Map<String, Object> kwargs = new HashMap<>();
        kwargs.put("b", 2);
        kwargs.put("c", 2);
        Map<String, Object> attributes = Collections.singletonMap("c", 3);

        TabularDataset result =
                loader.load(Collections.singletonList("x.fake"), "FAKE", attributes, kwargs);

        assertSame(dataset, result);
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(reader).read(any(), captor.capture());
        assertEquals(1, captor.getValue().get("a"));
        assertEquals(2, captor.getValue().get("b"));
        assertEquals(3, captor.getValue().get("c"));
        // 旧形式の引数は非推奨の警告を出す
        assertEquals(1, warnings());
    }

    @Test
    void load_正常ケース_旧引数がない_警告が出ないこと() throws Exception {
        loader.load(Collections.singletonList("x.fake"), "fake", null, Collections.emptyMap());

        verify(reader).read(Collections.singletonList("x.fake"), new HashMap<>(Map.of("a", 1,
                "b", 1, "c", 1)));
        assertEquals(0, warnings());
    }

    @SuppressWarnings("unchecked")
    @Test
    void load_正常ケース_ソースがない_空のソースで読込器が呼ばれること() throws Exception {
        loader.load(null, "fake", null, null);

        ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
        verify(reader).read(captor.capture(), anyMap());
        assertTrue(captor.getValue().isEmpty());
    }

    @Test
    void load_異常ケース_読込器がIOExceptionを送出する_DataSourceReadExceptionに包まれること()
            throws Exception {
        IOException cause = new IOException("disk error");
        when(reader.read(anyList(), anyMap())).thenThrow(cause);

        DataSourceReadException ex = assertThrows(DataSourceReadException.class,
                () -> loader.load(Collections.singletonList("x.fake"), "fake", null, null));
        assertSame(cause, ex.getCause());
        assertTrue(ex.getMessage().contains("disk error"));
    }

    @Test
    void load_異常ケース_未登録の形式を指定する_UnsupportedFormatExceptionが送出されること() {
        assertThrows(UnsupportedFormatException.class,
                () -> loader.load(Collections.singletonList("x.csv"), "csv", null, null));
    }
}

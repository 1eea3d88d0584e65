package io.github.flexsource.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.github.flexsource.exception.LegacyLabelResolutionException;
import io.github.flexsource.exception.UnsupportedLegacyFeatureException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LegacyMappingNormalizerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger(LegacyMappingNormalizer.class);

    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
    }

    private long warnings() {
        return appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
    }

    @Test
    void normalize_正常ケース_入れ子のgold_labelを指定する_列名に置き換わり警告が出ること() {
        Map<String, Object> mapping = new LinkedHashMap<>();
        mapping.put("label", Collections.singletonMap("gold_label", "sentiment"));

        Map<String, Object> normalized = LegacyMappingNormalizer.normalize(mapping);

        assertEquals(Collections.singletonMap("label", "sentiment"), normalized);
        assertEquals(1, warnings());
        // 入力は変更されない
        assertTrue(mapping.get("label") instanceof Map);
    }

    @Test
    void normalize_正常ケース_複数のサブキーがある_優先順位の高いキーが使われること() {
        Map<String, Object> label = new LinkedHashMap<>();
        label.put("field", "f");
        label.put("gold_label", "g");
        label.put("name", " ");
        Map<String, Object> mapping = Collections.singletonMap("label", label);

        assertEquals("g", LegacyMappingNormalizer.normalize(mapping).get("label"));
    }

    @Test
    void normalize_正常ケース_targetを指定する_位置を保ってlabelに改名されること() {
        Map<String, Object> mapping = new LinkedHashMap<>();
        mapping.put("text", "review");
        mapping.put("target", "sentiment");
        mapping.put("extra", Arrays.asList("a", "b"));

        Map<String, Object> normalized = LegacyMappingNormalizer.normalize(mapping);

        assertEquals(Arrays.asList("text", "label", "extra"), new ArrayList<>(normalized.keySet()));
        assertEquals("sentiment", normalized.get("label"));
        assertEquals(1, warnings());
    }

    @Test
    void normalize_正常ケース_targetとlabelが両方ある_targetは改名されないこと() {
        Map<String, Object> mapping = new LinkedHashMap<>();
        mapping.put("label", "sentiment");
        mapping.put("target", "other");

        Map<String, Object> normalized = LegacyMappingNormalizer.normalize(mapping);

        assertEquals(mapping, normalized);
        assertEquals(0, warnings());
    }

    @Test
    void normalize_異常ケース_metadata_fileを指定する_UnsupportedLegacyFeatureExceptionが送出されること() {
        Map<String, Object> mapping =
                Collections.singletonMap("label", Collections.singletonMap("metadata_file", "x"));
        UnsupportedLegacyFeatureException ex = assertThrows(
                UnsupportedLegacyFeatureException.class,
                () -> LegacyMappingNormalizer.normalize(mapping));
        assertTrue(ex.getMessage().contains("metadata_file"));
    }

    @Test
    void normalize_異常ケース_認識できるサブキーがない_LegacyLabelResolutionExceptionが送出されること() {
        Map<String, Object> mapping =
                Collections.singletonMap("label", Collections.singletonMap("column", "x"));
        assertThrows(LegacyLabelResolutionException.class,
                () -> LegacyMappingNormalizer.normalize(mapping));
    }
}

package io.github.flexsource.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.github.flexsource.exception.DataSourceException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

class DataSourceConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final Logger logger = (Logger) LoggerFactory.getLogger(DataSourceConfigLoader.class);

    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        logger.detachAppender(appender);
    }

    private List<String> warnings() {
        return appender.list.stream().filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }

    private Path write(String name, String yaml) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, yaml.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void load_正常ケース_相対パスのソースを読む_YAMLの場所から解決されること() throws Exception {
        Path yaml = write("ds.yml", "source:\n  - data/a.csv\n  - data/b.csv\n"
                + "attributes:\n  sep: ';'\nmapping:\n  text: review\n");

        DataSourceDefinition definition = DataSourceConfigLoader.load(yaml);

        assertEquals(Arrays.asList(tempDir.resolve("data/a.csv").toString(),
                tempDir.resolve("data/b.csv").toString()), definition.getSource());
        assertEquals(Collections.singletonMap("sep", ";"), definition.getAttributes());
        assertEquals(Collections.singletonMap("text", "review"), definition.getMapping());
        assertNull(definition.getFormat());
        assertTrue(definition.getKwargs().isEmpty());
        assertTrue(warnings().isEmpty());
    }

    @Test
    void load_正常ケース_URLとバックエンド名と絶対パス_変更されないこと() throws Exception {
        String absolute = tempDir.resolve("abs.json").toAbsolutePath().toString();
        Path yaml = write("ds.yml", "source: elasticsearch\nformat: elasticsearch\n"
                + "attributes:\n  es_host: http://localhost:9200\n  index: reviews\n"
                + "  path: s3://bucket/data.json\n  nested:\n    source: " + absolute + "\n");

        DataSourceDefinition definition = DataSourceConfigLoader.load(yaml);

        assertEquals(Collections.singletonList("elasticsearch"), definition.getSource());
        assertEquals("elasticsearch", definition.getFormat());
        assertEquals("s3://bucket/data.json", definition.getAttributes().get("path"));
        assertEquals(Collections.singletonMap("source", absolute),
                definition.getAttributes().get("nested"));
    }

    @Test
    void load_正常ケース_拡張子のない既存ファイル_相対パスとして解決されること() throws Exception {
        Files.createFile(tempDir.resolve("records"));
        Path yaml = write("ds.yml", "format: json\npath: records\n");

        DataSourceDefinition definition = DataSourceConfigLoader.load(yaml);

        assertTrue(definition.getSource().isEmpty());
        assertEquals(tempDir.resolve("records").toString(), definition.getKwargs().get("path"));
    }

    @Test
    void load_正常ケース_forwardキーを使う_警告の上でマッピングとして読まれること() throws Exception {
        Path yaml = write("ds.yml", "source: a.json\nforward:\n  text: review\n"
                + "lines: true\n");

        DataSourceDefinition definition = DataSourceConfigLoader.load(yaml);

        assertEquals(Collections.singletonMap("text", "review"), definition.getMapping());
        assertEquals(Collections.singletonMap("lines", true), definition.getKwargs());
        assertEquals(Collections.singletonList(
                "The key 'forward' is deprecated! Please use the 'mapping' key in the future."),
                warnings());
    }

    @Test
    void load_正常ケース_mappingとforwardの両方がある_mappingが優先されること() throws Exception {
        Path yaml = write("ds.yml", "source: a.json\nmapping:\n  text: body\n"
                + "forward:\n  text: review\n");

        DataSourceDefinition definition = DataSourceConfigLoader.load(yaml);

        assertEquals(Collections.singletonMap("text", "body"), definition.getMapping());
        assertTrue(warnings().isEmpty());
        assertFalse(definition.getKwargs().containsKey("forward"));
    }

    @Test
    void load_正常ケース_マッピングにpathという論理名がある_列名が書き換えられないこと() throws Exception {
        Path yaml = write("ds.yml", "source: a.json\nmapping:\n  path: meta.origin\n"
                + "  source: [meta.source, meta.lang]\n");

        DataSourceDefinition definition = DataSourceConfigLoader.load(yaml);

        assertEquals("meta.origin", definition.getMapping().get("path"));
        assertEquals(Arrays.asList("meta.source", "meta.lang"),
                definition.getMapping().get("source"));
        assertEquals(Collections.singletonList(tempDir.resolve("a.json").toString()),
                definition.getSource());
    }

    @Test
    void load_正常ケース_forwardにsourceという論理名がある_列名が書き換えられないこと() throws Exception {
        Path yaml = write("ds.yml", "source: a.json\nforward:\n  source: meta.origin\n");

        DataSourceDefinition definition = DataSourceConfigLoader.load(yaml);

        assertEquals(Collections.singletonMap("source", "meta.origin"), definition.getMapping());
    }

    @Test
    void load_異常ケース_マッピングでない文書_DataSourceExceptionが送出されること() throws Exception {
        Path yaml = write("ds.yml", "- a.csv\n- b.csv\n");
        assertThrows(DataSourceException.class, () -> DataSourceConfigLoader.load(yaml));
    }

    @Test
    void save_正常ケース_単一ソースを書き出す_スカラーとして書き出されること() throws Exception {
        Map<String, Object> mapping = new LinkedHashMap<>();
        mapping.put("text", "review");
        mapping.put("label", "sentiment");
        DataSourceDefinition definition = DataSourceDefinition.builder()
                .source(new ArrayList<>(List.of("/data/reviews.csv"))).format("csv")
                .mapping(mapping).build();

        Path yaml = DataSourceConfigLoader.save(definition, tempDir.resolve("out.yml"), false);

        Map<String, Object> document =
                new Yaml().load(Files.readString(yaml, StandardCharsets.UTF_8));
        assertEquals(Arrays.asList("source", "attributes", "mapping"),
                new ArrayList<>(document.keySet()));
        assertEquals("/data/reviews.csv", document.get("source"));
        assertEquals(Collections.emptyMap(), document.get("attributes"));
        assertEquals(mapping, document.get("mapping"));
    }

    @Test
    void save_正常ケース_絶対パス化を指定する_相対パスのみ絶対パスになること() throws Exception {
        DataSourceDefinition definition = DataSourceDefinition.builder()
                .source(new ArrayList<>(List.of("rel/a.csv", "http://host/b.csv"))).build();

        Path yaml = DataSourceConfigLoader.save(definition, tempDir.resolve("out.yml"), true);

        Map<String, Object> document =
                new Yaml().load(Files.readString(yaml, StandardCharsets.UTF_8));
        assertEquals(Arrays.asList(Paths.get("rel/a.csv").toAbsolutePath().normalize().toString(),
                "http://host/b.csv"), document.get("source"));
    }
}

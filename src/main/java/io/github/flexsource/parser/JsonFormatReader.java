package io.github.flexsource.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.DataRow;
import io.github.flexsource.frame.Partition;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Implementation of {@link FormatReader} that reads JSON files with Jackson.
 *
 * <p>
 * A file may hold one JSON object per line (JSON lines), a sequence of concatenated objects, or a
 * top-level array of objects. Columns are the union of the object keys in order of first
 * appearance; a record lacking a key yields a missing value.
 * </p>
 *
 * <p>
 * Supported parameters:
 * </p>
 * <ul>
 * <li>{@code flatten}: flattens nested objects and lists of objects into {@code a.b} and
 * {@code a.*.b} columns (see {@link JsonFlattener}), default {@code false}</li>
 * <li>{@code encoding}: file encoding, default UTF-8</li>
 * <li>{@code include_path_column}: default {@code true}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class JsonFormatReader extends FileFormatReader {

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * {@inheritDoc}
     */
    @Override
    protected FilePartition inspect(Path file, ReaderParameters params) throws IOException {
        boolean flatten = params.getBoolean("flatten", false);
        Charset charset = params.getCharset("encoding", StandardCharsets.UTF_8);

        // Scan all records once for the column union
        Set<String> names = new LinkedHashSet<>();
        try (Stream<Map<String, Object>> records = records(file, charset, flatten)) {
            records.forEach(record -> names.addAll(record.keySet()));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        List<String> columnNames = new ArrayList<>(names);
        List<Column> columns =
                columnNames.stream().map(Column::object).collect(Collectors.toList());

        Partition rows = () -> {
            AtomicLong counter = new AtomicLong();
            Stream<Map<String, Object>> records;
            try {
                records = records(file, charset, flatten);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to open JSON file: " + file, e);
            }
            return records.map(record -> {
                List<Object> values = new ArrayList<>(columnNames.size());
                for (String name : columnNames) {
                    values.add(record.get(name));
                }
                return new DataRow(counter.getAndIncrement(), values);
            });
        };
        return new FilePartition(columns, rows);
    }

    private Stream<Map<String, Object>> records(Path file, Charset charset, boolean flatten)
            throws IOException {
        MappingIterator<JsonNode> nodes =
                mapper.readerFor(JsonNode.class).readValues(Files.newBufferedReader(file, charset));
        return StreamSupport
                .stream(Spliterators.spliteratorUnknownSize(nodes, Spliterator.ORDERED), false)
                .onClose(() -> close(nodes))
                .flatMap(node -> node.isArray() ? StreamSupport.stream(node.spliterator(), false)
                        : Stream.of(node))
                .filter(JsonNode::isObject)
                .map(node -> flatten ? JsonFlattener.flatten(node) : JsonFlattener.toMap(node));
    }

    private static void close(MappingIterator<JsonNode> nodes) {
        try {
            nodes.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

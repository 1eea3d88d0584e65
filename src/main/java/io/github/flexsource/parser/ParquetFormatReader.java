package io.github.flexsource.parser;

import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.DataRow;
import io.github.flexsource.frame.DataType;
import io.github.flexsource.frame.Partition;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.metadata.FileMetaData;
import org.apache.parquet.hadoop.util.HadoopInputFile;

/**
 * Implementation of {@link FormatReader} that reads Apache Parquet files through parquet-avro.
 *
 * <p>
 * The Avro schema stored by parquet-avro writers is used when present, otherwise it is derived
 * from the Parquet schema. Avro types map to {@link DataType}s: strings and enums to
 * {@link DataType#STRING}, int and long to {@link DataType#LONG}, float and double to
 * {@link DataType#DOUBLE}, boolean to {@link DataType#BOOLEAN}, anything else (records, arrays,
 * maps, bytes) to {@link DataType#OBJECT}. Nested records are read as maps, arrays as lists.
 * </p>
 *
 * <p>
 * Supported parameters:
 * </p>
 * <ul>
 * <li>{@code columns}: names of the columns to keep, default all</li>
 * <li>{@code include_path_column}: default {@code true}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public class ParquetFormatReader extends FileFormatReader {

    /**
     * {@inheritDoc}
     */
    @Override
    protected FilePartition inspect(java.nio.file.Path file, ReaderParameters params)
            throws IOException {
        Configuration conf = new Configuration();
        org.apache.hadoop.fs.Path hadoopPath = new org.apache.hadoop.fs.Path(file.toUri());
        Schema schema = readAvroSchema(hadoopPath, conf);

        List<String> projection = params.getStringList("columns");
        List<Schema.Field> fields = new ArrayList<>();
        for (Schema.Field field : schema.getFields()) {
            if (projection.isEmpty() || projection.contains(field.name())) {
                fields.add(field);
            }
        }
        if (fields.size() < projection.size()) {
            List<String> names = schema.getFields().stream().map(Schema.Field::name)
                    .collect(Collectors.toList());
            throw new IllegalArgumentException(
                    "Unknown columns " + projection + " in Parquet file " + file + ": " + names);
        }
        List<Column> columns = fields.stream().map(f -> new Column(f.name(), typeOf(f.schema())))
                .collect(Collectors.toList());

        Partition rows = () -> {
            ParquetReader<GenericRecord> reader;
            try {
                reader = AvroParquetReader
                        .<GenericRecord>builder(HadoopInputFile.fromPath(hadoopPath, conf)).build();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to open Parquet file: " + file, e);
            }
            RecordIterator records = new RecordIterator(reader);
            return StreamSupport
                    .stream(Spliterators.spliteratorUnknownSize(records, Spliterator.ORDERED),
                            false)
                    .onClose(records::close).map(record -> {
                        List<Object> values = new ArrayList<>(fields.size());
                        for (Schema.Field field : fields) {
                            values.add(toJava(record.get(field.name())));
                        }
                        return new DataRow(records.position(), values);
                    });
        };
        return new FilePartition(columns, rows);
    }

    private static Schema readAvroSchema(org.apache.hadoop.fs.Path path, Configuration conf)
            throws IOException {
        try (ParquetFileReader reader =
                ParquetFileReader.open(HadoopInputFile.fromPath(path, conf))) {
            FileMetaData meta = reader.getFooter().getFileMetaData();
            String avroJson = meta.getKeyValueMetaData().get("parquet.avro.schema");
            if (avroJson == null) {
                avroJson = meta.getKeyValueMetaData().get("avro.schema");
            }
            if (avroJson != null && !avroJson.isEmpty()) {
                return new Schema.Parser().parse(avroJson);
            }
            return new AvroSchemaConverter(conf).convert(meta.getSchema());
        }
    }

    static DataType typeOf(Schema schema) {
        Schema base = schema;
        if (schema.getType() == Schema.Type.UNION) {
            List<Schema> branches = schema.getTypes().stream()
                    .filter(s -> s.getType() != Schema.Type.NULL).collect(Collectors.toList());
            if (branches.size() != 1) {
                return DataType.OBJECT;
            }
            base = branches.get(0);
        }
        switch (base.getType()) {
            case STRING:
            case ENUM:
                return DataType.STRING;
            case INT:
            case LONG:
                return base.getLogicalType() == null ? DataType.LONG : DataType.OBJECT;
            case FLOAT:
            case DOUBLE:
                return DataType.DOUBLE;
            case BOOLEAN:
                return DataType.BOOLEAN;
            default:
                return DataType.OBJECT;
        }
    }

    static Object toJava(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CharSequence || value instanceof GenericEnumSymbol) {
            return value.toString();
        }
        if (value instanceof Integer) {
            return ((Integer) value).longValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof GenericRecord) {
            GenericRecord record = (GenericRecord) value;
            Map<String, Object> map = new LinkedHashMap<>();
            for (Schema.Field field : record.getSchema().getFields()) {
                map.put(field.name(), toJava(record.get(field.name())));
            }
            return map;
        }
        if (value instanceof Map) {
            Map<String, Object> map = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> map.put(String.valueOf(k), toJava(v)));
            return map;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(ParquetFormatReader::toJava)
                    .collect(Collectors.toList());
        }
        if (value instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) value).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return bytes;
        }
        if (value instanceof GenericFixed) {
            return ((GenericFixed) value).bytes().clone();
        }
        return value;
    }

    /**
     * Iterates over the records of a {@link ParquetReader}, tracking the row position.
     */
    private static final class RecordIterator implements Iterator<GenericRecord> {

        private final ParquetReader<GenericRecord> reader;

        private GenericRecord next;

        private long position = -1;

        private boolean done;

        RecordIterator(ParquetReader<GenericRecord> reader) {
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                try {
                    next = reader.read();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                done = next == null;
            }
            return next != null;
        }

        @Override
        public GenericRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            GenericRecord current = next;
            next = null;
            position++;
            return current;
        }

        long position() {
            return position;
        }

        void close() {
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}

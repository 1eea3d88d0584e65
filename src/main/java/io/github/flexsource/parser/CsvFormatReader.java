package io.github.flexsource.parser;

import io.github.flexsource.frame.Column;
import io.github.flexsource.frame.DataRow;
import io.github.flexsource.frame.Partition;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Implementation of {@link FormatReader} that reads delimited text files with Apache Commons CSV.
 *
 * <p>
 * Every column is read as text. Supported parameters:
 * </p>
 * <ul>
 * <li>{@code sep}: field delimiter, default {@code ,}</li>
 * <li>{@code encoding}: file encoding, default UTF-8</li>
 * <li>{@code header}: whether the first record holds the column names, default {@code true};
 * without a header the columns are named {@code 0}, {@code 1}, ...</li>
 * <li>{@code na_filter}: whether NA markers become missing values, default {@code true}</li>
 * <li>{@code include_path_column}: default {@code false}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvFormatReader extends FileFormatReader {

    /**
     * {@inheritDoc}
     */
    @Override
    protected FilePartition inspect(Path file, ReaderParameters params) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(params.getString("sep", ","))
                .build();
        Charset charset = params.getCharset("encoding", StandardCharsets.UTF_8);
        boolean header = params.getBoolean("header", true);
        boolean naFilter = params.getBoolean(NA_FILTER, true);

        List<String> names;
        try (CSVParser parser = CSVParser.parse(file, charset, format)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                log.warn("CSV file is empty: {}", file);
                names = new ArrayList<>();
            } else if (header) {
                names = deduplicate(records.next().toList());
            } else {
                names = IntStream.range(0, records.next().size()).mapToObj(String::valueOf)
                        .collect(Collectors.toList());
            }
        }
        int width = names.size();
        List<Column> columns = names.stream().map(Column::string).collect(Collectors.toList());

        Partition rows = () -> {
            CSVParser parser = open(file, charset, format);
            Stream<CSVRecord> records = parser.stream().onClose(() -> close(parser));
            if (header) {
                records = records.skip(1);
            }
            long firstRecord = header ? 2 : 1;
            return records.map(record -> {
                List<Object> values = new ArrayList<>(width);
                for (int i = 0; i < width; i++) {
                    values.add(i < record.size() ? filterNa(record.get(i), naFilter) : null);
                }
                return new DataRow(record.getRecordNumber() - firstRecord, values);
            });
        };
        return new FilePartition(columns, rows);
    }

    /**
     * Delimited files only get a {@code path} column on request.
     */
    @Override
    protected boolean includePathColumnByDefault() {
        return false;
    }

    private static CSVParser open(Path file, Charset charset, CSVFormat format) {
        try {
            return CSVParser.parse(file, charset, format);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open CSV file: " + file, e);
        }
    }

    private static void close(CSVParser parser) {
        try {
            parser.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package io.github.flexsource.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes records as JSON lines, one object per line.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RecordExporter {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Writes all records to a file and closes the stream.
     *
     * @param records records to write
     * @param target output file, replaced when it exists
     * @return the number of records written
     * @throws IOException if the file cannot be written or a record cannot be serialized
     */
    public long export(Stream<Map<String, Object>> records, Path target) throws IOException {
        long count = 0;
        try (Stream<Map<String, Object>> stream = records;
                Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                SequenceWriter sequence =
                        mapper.writer().withRootValueSeparator("\n").writeValues(writer)) {
            Iterator<Map<String, Object>> iterator = stream.iterator();
            while (iterator.hasNext()) {
                sequence.write(iterator.next());
                count++;
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        log.info("Exported {} records to {}", count, target);
        return count;
    }
}

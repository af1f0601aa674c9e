package de.uos.ikw.izpb.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Helpers around Jackson readers and writers to read and write whole tables at once.
 */
public class ObjectReaderUtils {
    private static final Logger logger = LoggerFactory.getLogger(ObjectReaderUtils.class);

    public static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .enable(CsvParser.Feature.ALLOW_COMMENTS)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    /**
     * Reads a CSV file row by row as plain string maps and converts each row to the given type.
     * Rows that cannot be parsed or converted are skipped with a warning, so one broken row does
     * not invalidate the whole table.
     *
     * @param path   CSV file to read.
     * @param schema Schema of the file (header, separators).
     * @param type   Row type.
     * @return List of all the well-formed rows.
     */
    public static <T> List<T> readAllRows(Path path, CsvSchema schema, Class<T> type) throws IOException {
        ObjectReader reader = CSV_MAPPER.readerForMapOf(String.class).with(schema);
        List<T> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> iterator = reader.readValues(path.toFile())) {
            long lastFailure = -1;
            int numRow = 0;
            while (true) {
                numRow++;
                Map<String, String> rawRow;
                try {
                    if (!iterator.hasNextValue()) {
                        break;
                    }
                    rawRow = iterator.nextValue();
                } catch (JsonProcessingException e) {
                    long offset = iterator.getCurrentLocation().getCharOffset();
                    if (offset == lastFailure) {
                        logger.warn("Stopped reading {} at row {}: parser does not advance", path, numRow);
                        break;
                    }
                    lastFailure = offset;
                    logger.warn("Skipped unreadable row {} in {}: {}", numRow, path, e.getOriginalMessage());
                    continue;
                }
                try {
                    rows.add(CSV_MAPPER.convertValue(rawRow, type));
                } catch (IllegalArgumentException e) {
                    logger.warn("Skipped malformed row {} in {}: {}", numRow, path, e.getMessage());
                }
            }
        }
        return rows;
    }

    /**
     * Writes all values with a header row, using the property order declared by the row type.
     *
     * @param path   Destination file (overwritten).
     * @param type   Row type.
     * @param values Rows to write.
     */
    public static <T> void writeAllRows(Path path, Class<T> type, List<T> values) throws IOException {
        CsvSchema schema = CSV_MAPPER.schemaFor(type).withHeader();
        ObjectWriter writer = CSV_MAPPER.writerFor(type).with(schema);
        try (SequenceWriter sequenceWriter = writer.writeValues(path.toFile())) {
            sequenceWriter.writeAll(values);
        }
    }
}

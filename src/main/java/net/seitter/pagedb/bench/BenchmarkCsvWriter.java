package net.seitter.pagedb.bench;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends benchmark results to a CSV file, writing the header line only into a new or empty file.
 */
public class BenchmarkCsvWriter {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkCsvWriter.class);

    private final CsvMapper mapper;
    private final CsvSchema schema;

    public BenchmarkCsvWriter() {
        this.mapper = new CsvMapper();
        this.schema = mapper.schemaFor(BenchmarkResult.class);
    }

    /**
     * Appends one row.
     *
     * @param csvFile The CSV file, created when missing
     * @param result The result to append
     * @throws IOException If the file cannot be written
     */
    public void append(Path csvFile, BenchmarkResult result) throws IOException {
        boolean writeHeader = !Files.exists(csvFile) || Files.size(csvFile) == 0;
        CsvSchema rowSchema = writeHeader ? schema.withHeader() : schema.withoutHeader();

        try (Writer writer = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
             SequenceWriter rows = mapper.writer(rowSchema).writeValues(writer)) {
            rows.write(result);
        }

        logger.debug("Appended benchmark result to {}", csvFile);
    }

    /**
     * Renders a result as a CSV line without header.
     *
     * @param result The result
     * @return The CSV line, newline included
     * @throws IOException If the result cannot be serialized
     */
    public String toCsvLine(BenchmarkResult result) throws IOException {
        return mapper.writer(schema.withoutHeader()).writeValueAsString(result);
    }
}

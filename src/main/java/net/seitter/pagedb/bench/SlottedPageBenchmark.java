package net.seitter.pagedb.bench;

import net.seitter.pagedb.buffer.BufferPoolConfig;
import net.seitter.pagedb.record.FixedSlotEstimate;
import net.seitter.pagedb.record.RecordId;
import net.seitter.pagedb.record.RecordScan;
import net.seitter.pagedb.record.SlottedFileManager;
import net.seitter.pagedb.record.SlottedPageLayout;
import net.seitter.pagedb.record.SpaceReport;
import net.seitter.pagedb.storage.PagedFile;
import net.seitter.pagedb.storage.PagedFileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Measures space utilization of the slotted layout: inserts records, scans them back,
 * deletes every other one and compares the resulting pages with fixed-size slots.
 */
public class SlottedPageBenchmark {
    private static final Logger logger = LoggerFactory.getLogger(SlottedPageBenchmark.class);

    public static final int DEFAULT_RECORD_COUNT = 200;
    public static final int DEFAULT_MAX_RECORD_LENGTH = 200;
    public static final long DEFAULT_SEED = 42L;

    private final int recordCount;
    private final int maxRecordLength;
    private final Path dataFile;
    private final long seed;
    private final int pageSize;

    /**
     * Creates a benchmark over generated records.
     *
     * @param recordCount The number of records to insert
     * @param maxRecordLength The longest generated record
     */
    public SlottedPageBenchmark(int recordCount, int maxRecordLength) {
        this(recordCount, maxRecordLength, null, DEFAULT_SEED, PagedFileManager.DEFAULT_PAGE_SIZE);
    }

    /**
     * Creates a benchmark.
     *
     * @param recordCount The number of records to insert, at most this many lines when reading a data file
     * @param maxRecordLength The longest generated record, unused with a data file
     * @param dataFile A file with one record per line, or null to generate records
     * @param seed The seed of the record length generator
     * @param pageSize The page size in bytes
     */
    public SlottedPageBenchmark(int recordCount, int maxRecordLength, Path dataFile, long seed, int pageSize) {
        if (recordCount <= 0) {
            throw new IllegalArgumentException("Record count must be positive, got " + recordCount);
        }
        int limit = SlottedPageLayout.maxRecordLength(pageSize);
        if (dataFile == null && (maxRecordLength <= 0 || maxRecordLength > limit)) {
            throw new IllegalArgumentException("Maximum record length must be between 1 and " + limit
                    + ", got " + maxRecordLength);
        }
        this.recordCount = recordCount;
        this.maxRecordLength = maxRecordLength;
        this.dataFile = dataFile;
        this.seed = seed;
        this.pageSize = pageSize;
    }

    /**
     * Runs the benchmark. Any existing file at the path is replaced and the file is destroyed afterwards.
     *
     * @param workFile The path of the scratch slotted file
     * @return The counts and space measurements of the run
     * @throws IOException If the data file cannot be read or the storage layers fail
     */
    public SlottedPageBenchmarkResult run(Path workFile) throws IOException {
        List<byte[]> records = dataFile != null ? readRecords() : generateRecords();

        Files.deleteIfExists(workFile);
        PagedFileManager pagedFileManager = new PagedFileManager(pageSize, BufferPoolConfig.getDefault());
        SlottedFileManager slottedFileManager = new SlottedFileManager(pagedFileManager);
        String path = workFile.toString();
        slottedFileManager.createFile(path);
        PagedFile file = slottedFileManager.openFile(path);

        int scanned = 0;
        int deleted = 0;
        SpaceReport spaceReport;
        try {
            List<RecordId> recordIds = new ArrayList<>(records.size());
            for (byte[] record : records) {
                recordIds.add(slottedFileManager.insertRecord(file, record));
            }

            try (RecordScan scan = slottedFileManager.openScan(file)) {
                while (scan.next() != null) {
                    scanned++;
                }
            }
            logger.info("Inserted {} records; scanned {} records", records.size(), scanned);

            for (int i = 0; i < recordIds.size(); i += 2) {
                slottedFileManager.deleteRecord(file, recordIds.get(i));
                deleted++;
            }

            spaceReport = slottedFileManager.measureSpace(file);
        } finally {
            pagedFileManager.shutdown();
        }
        slottedFileManager.destroyFile(path);

        int[] lengths = new int[records.size()];
        for (int i = 0; i < lengths.length; i++) {
            lengths[i] = records.get(i).length;
        }

        return new SlottedPageBenchmarkResult(records.size(), scanned, deleted, lengths, spaceReport,
                FixedSlotEstimate.compare(lengths, pageSize));
    }

    private List<byte[]> generateRecords() {
        Random random = new Random(seed);
        List<byte[]> records = new ArrayList<>(recordCount);
        for (int i = 0; i < recordCount; i++) {
            int length = 1 + random.nextInt(maxRecordLength);
            byte[] record = new byte[length];
            for (int j = 0; j < length; j++) {
                record[j] = (byte) ('A' + (i + j) % 26);
            }
            records.add(record);
        }
        return records;
    }

    private List<byte[]> readRecords() throws IOException {
        int limit = SlottedPageLayout.maxRecordLength(pageSize);
        List<byte[]> records = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(dataFile, StandardCharsets.UTF_8)) {
            String line;
            while (records.size() < recordCount && (line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                byte[] record = line.getBytes(StandardCharsets.UTF_8);
                if (record.length > limit) {
                    throw new IOException("Record " + (records.size() + 1) + " of " + dataFile + " is "
                            + record.length + " bytes, records are limited to " + limit);
                }
                records.add(record);
            }
        }

        if (records.isEmpty()) {
            throw new IOException("No records read from " + dataFile);
        }
        logger.info("Read {} records from {}", records.size(), dataFile);
        return records;
    }
}

package net.seitter.pagedb.bench;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import net.seitter.pagedb.record.FixedSlotEstimate;
import net.seitter.pagedb.storage.PagedFileManager;

/**
 * Tests for the SlottedPageBenchmark class.
 */
public class SlottedPageBenchmarkTest {

    @TempDir
    File tempDir;

    @Test
    public void testGeneratedRecords() throws IOException {
        Path workFile = new File(tempDir, "sp.db").toPath();
        SlottedPageBenchmarkResult result = new SlottedPageBenchmark(200, 200).run(workFile);

        assertEquals(200, result.getInsertedRecords());
        assertEquals(200, result.getScannedRecords());
        assertEquals(100, result.getDeletedRecords());
        assertEquals(100, result.getSpaceReport().getLiveRecordCount());
        assertTrue(result.getSpaceReport().getPageCount() > 1);
        assertTrue(Arrays.stream(result.getRecordLengths()).allMatch(length -> length >= 1 && length <= 200));
        assertEquals(Arrays.stream(result.getRecordLengths()).sum(), result.getTotalUserBytes());
        assertEquals(FixedSlotEstimate.SLOT_SIZES.length, result.getFixedSlotEstimates().size());
        assertFalse(Files.exists(workFile), "Scratch file should be destroyed");
    }

    @Test
    public void testRecordsAreDeterministic() throws IOException {
        SlottedPageBenchmarkResult first = new SlottedPageBenchmark(50, 80)
                .run(new File(tempDir, "a.db").toPath());
        SlottedPageBenchmarkResult second = new SlottedPageBenchmark(50, 80)
                .run(new File(tempDir, "b.db").toPath());

        assertArrayEquals(first.getRecordLengths(), second.getRecordLengths());
        assertEquals(first.getSpaceReport().getTotalUsedBytes(), second.getSpaceReport().getTotalUsedBytes());
    }

    @Test
    public void testRecordsFromDataFile() throws IOException {
        Path dataFile = new File(tempDir, "records.txt").toPath();
        Files.write(dataFile, Arrays.asList("alpha", "", "beta", "gamma", "delta"), StandardCharsets.UTF_8);

        SlottedPageBenchmarkResult result = new SlottedPageBenchmark(3, 0, dataFile,
                SlottedPageBenchmark.DEFAULT_SEED, PagedFileManager.DEFAULT_PAGE_SIZE)
                .run(new File(tempDir, "file.db").toPath());

        assertEquals(3, result.getInsertedRecords(), "Empty lines are skipped and the count is capped");
        assertArrayEquals(new int[] {5, 4, 5}, result.getRecordLengths());
        assertEquals(2, result.getDeletedRecords());
        assertEquals(1, result.getSpaceReport().getLiveRecordCount());
        assertEquals(4, result.getSpaceReport().getLiveRecordBytes());
        assertEquals(1, result.getSpaceReport().getPageCount());
        assertTrue(result.getFixedSlotEstimates().get(0).isApplicable());
    }

    @Test
    public void testEmptyDataFile() throws IOException {
        Path dataFile = new File(tempDir, "empty.txt").toPath();
        Files.createFile(dataFile);

        SlottedPageBenchmark benchmark = new SlottedPageBenchmark(10, 0, dataFile,
                SlottedPageBenchmark.DEFAULT_SEED, PagedFileManager.DEFAULT_PAGE_SIZE);
        assertThrows(IOException.class, () -> benchmark.run(new File(tempDir, "x.db").toPath()));
    }

    @Test
    public void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new SlottedPageBenchmark(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new SlottedPageBenchmark(10, 0));
        assertThrows(IllegalArgumentException.class, () -> new SlottedPageBenchmark(10, 5000));
    }

    @Test
    public void testPrintedReport() throws IOException {
        SlottedPageBenchmarkResult result = new SlottedPageBenchmark(20, 40)
                .run(new File(tempDir, "print.db").toPath());
        StringWriter output = new StringWriter();

        result.print(new PrintWriter(output));

        String text = output.toString();
        assertTrue(text.startsWith("Inserted 20 records; scanned 20 records"), text);
        assertTrue(text.contains("Pages used: 1,"), text);
        assertTrue(text.contains("Static fixed-slot comparison"), text);
        assertTrue(text.contains("M\tslots/page\tpages_needed\tutilization(%)\tnotes"), text);
    }
}

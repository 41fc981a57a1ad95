package net.seitter.pagedb;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import net.seitter.pagedb.buffer.BufferPoolConfig;
import net.seitter.pagedb.buffer.ReplacementPolicy;
import net.seitter.pagedb.record.RecordException;
import net.seitter.pagedb.storage.PagedFileManager;

/**
 * Tests for the shell commands of PageDB.
 */
public class PageDBTest {

    @TempDir
    File tempDir;

    private PageDB pageDB;
    private String path;

    @BeforeEach
    public void setUp() {
        pageDB = new PageDB(new PagedFileManager(PagedFileManager.DEFAULT_PAGE_SIZE,
                new BufferPoolConfig(4, ReplacementPolicy.LRU)));
        path = new File(tempDir, "shell.db").getAbsolutePath();
    }

    @AfterEach
    public void tearDown() {
        pageDB.shutdown();
    }

    @Test
    public void testInsertScanDelete() throws IOException {
        pageDB.executeCommand("create " + path);
        pageDB.executeCommand("open " + path);

        assertEquals("Inserted record (0,0)", pageDB.executeCommand("insert hello world"));
        assertEquals("Inserted record (0,1)", pageDB.executeCommand("insert second"));
        assertEquals("hello world", pageDB.executeCommand("get 0 0"));

        String scan = pageDB.executeCommand("scan");
        assertTrue(scan.contains("(0,0) hello world"), scan);
        assertTrue(scan.endsWith("2 records"), scan);

        assertEquals("Deleted record (0,0)", pageDB.executeCommand("delete 0 0"));
        assertTrue(pageDB.executeCommand("scan").endsWith("1 record"));
        assertThrows(RecordException.class, () -> pageDB.executeCommand("delete 0 0"));

        assertTrue(pageDB.executeCommand("report").startsWith("Pages used: 1,"));
        assertTrue(pageDB.executeCommand("close").startsWith("Closed"));
    }

    @Test
    public void testStatsAreJson() throws IOException {
        pageDB.executeCommand("create " + path);
        pageDB.executeCommand("open " + path);
        pageDB.executeCommand("insert a");
        pageDB.executeCommand("scan");

        JsonNode stats = new ObjectMapper().readTree(pageDB.executeCommand("stats"));
        // insert misses page 0, scan fixes page 0 twice (record, then end of slots) and misses page 1
        assertEquals(4, stats.get("logicalReads").asLong());
        assertEquals(2, stats.get("pageHits").asLong());
        assertEquals(stats.get("logicalReads").asLong(),
                stats.get("pageHits").asLong() + stats.get("pageMisses").asLong());
        assertTrue(stats.has("hitRatio"));
    }

    @Test
    public void testConfigAndBuffer() throws IOException {
        assertEquals("Buffer pool: 2 buffers, MRU", pageDB.executeCommand("config 2 mru"));
        pageDB.executeCommand("create " + path);
        pageDB.executeCommand("open " + path);
        pageDB.executeCommand("insert x");

        String buffer = pageDB.executeCommand("buffer");
        assertTrue(buffer.startsWith("file\tpage\tfixed\tdirty"), buffer);
        assertTrue(buffer.endsWith("1 of 2 buffers in use"), buffer);
        assertEquals("Flushed dirty pages", pageDB.executeCommand("flush"));
    }

    @Test
    public void testCommandErrors() throws IOException {
        assertThrows(IllegalStateException.class, () -> pageDB.executeCommand("insert x"));
        assertThrows(IllegalArgumentException.class, () -> pageDB.executeCommand("bogus"));
        assertThrows(IllegalArgumentException.class, () -> pageDB.executeCommand("delete 1"));
        assertThrows(IllegalArgumentException.class, () -> pageDB.executeCommand("config many"));
        assertThrows(IllegalArgumentException.class, () -> pageDB.executeCommand("config 3 fifo"));
        assertTrue(pageDB.executeCommand("help").contains("insert <text>"));
    }

    @Test
    public void testPolicyBenchmarkFromCommandLine() throws IOException {
        File csv = new File(tempDir, "out.csv");
        StringWriter output = new StringWriter();

        PageDB.runBenchmark(new String[] {"pf-bench", "5", "mru", "30", "10", "0.5", csv.getPath()},
                new PrintWriter(output));

        assertTrue(output.toString().startsWith("policy=MRU,pool=5,ops=30,pages=10,write_frac=0.50,"),
                output.toString());
        List<String> lines = Files.readAllLines(csv.toPath(), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(1).startsWith("MRU,5,30,10,0.50,30,"), lines.get(1));
    }

    @Test
    public void testSlottedBenchmarkFromCommandLine() throws IOException {
        StringWriter output = new StringWriter();

        PageDB.runBenchmark(new String[] {"sp-bench", "40", "60"}, new PrintWriter(output));

        assertTrue(output.toString().startsWith("Inserted 40 records; scanned 40 records"), output.toString());
    }
}

package net.seitter.pagedb.bench;

import net.seitter.pagedb.buffer.BufferFrame;
import net.seitter.pagedb.buffer.BufferPoolConfig;
import net.seitter.pagedb.buffer.BufferStatistics;
import net.seitter.pagedb.buffer.ReplacementPolicy;
import net.seitter.pagedb.storage.PagedFile;
import net.seitter.pagedb.storage.PagedFileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

/**
 * Runs a cyclic read/write workload against a fresh paged file to compare replacement policies.
 * Page {@code i % pages} is accessed on step {@code i}; a seeded random draw decides whether
 * the access rewrites the page or only reads it.
 */
public class BufferPolicyBenchmark {
    private static final Logger logger = LoggerFactory.getLogger(BufferPolicyBenchmark.class);

    public static final int DEFAULT_POOL_SIZE = 5;
    public static final int DEFAULT_OPS = 50;
    public static final int DEFAULT_PAGES = 10;
    public static final double DEFAULT_WRITE_FRACTION = 0.3;
    public static final long DEFAULT_SEED = 42L;

    private final BufferPoolConfig config;
    private final int ops;
    private final int pages;
    private final double writeFraction;
    private final long seed;
    private final int pageSize;

    public BufferPolicyBenchmark(BufferPoolConfig config, int ops, int pages, double writeFraction) {
        this(config, ops, pages, writeFraction, DEFAULT_SEED, PagedFileManager.DEFAULT_PAGE_SIZE);
    }

    public BufferPolicyBenchmark(BufferPoolConfig config, int ops, int pages, double writeFraction,
                                 long seed, int pageSize) {
        if (ops < 0) {
            throw new IllegalArgumentException("Operation count must be non-negative, got " + ops);
        }
        if (pages <= 0) {
            throw new IllegalArgumentException("Page count must be positive, got " + pages);
        }
        if (writeFraction < 0.0 || writeFraction > 1.0) {
            throw new IllegalArgumentException("Write fraction must be between 0 and 1, got " + writeFraction);
        }
        this.config = config;
        this.ops = ops;
        this.pages = pages;
        this.writeFraction = writeFraction;
        this.seed = seed;
        this.pageSize = pageSize;
    }

    /**
     * Builds the benchmark with defaults for every parameter not given.
     *
     * @param poolSize The buffer pool capacity
     * @param policy The replacement policy
     * @return The benchmark
     */
    public static BufferPolicyBenchmark withPool(int poolSize, ReplacementPolicy policy) {
        return new BufferPolicyBenchmark(new BufferPoolConfig(poolSize, policy),
                DEFAULT_OPS, DEFAULT_PAGES, DEFAULT_WRITE_FRACTION);
    }

    /**
     * Runs the workload. Any existing file at the path is replaced and the file is destroyed afterwards.
     *
     * @param workFile The path of the scratch paged file
     * @return The parameters and the buffer statistics of the run
     * @throws IOException If the paged file layer fails
     */
    public BenchmarkResult run(Path workFile) throws IOException {
        Files.deleteIfExists(workFile);

        PagedFileManager pagedFileManager = new PagedFileManager(pageSize, config);
        String path = workFile.toString();
        pagedFileManager.createFile(path);
        PagedFile file = pagedFileManager.openFile(path);

        BufferStatistics statistics;
        try {
            for (int i = 0; i < pages; i++) {
                BufferFrame frame = pagedFileManager.allocatePage(file);
                writeText(frame, "page-" + i);
                pagedFileManager.unfixPage(file, frame.getPageId().getPageNumber(), true);
            }

            Random random = new Random(seed);
            for (int i = 0; i < ops; i++) {
                int pageNumber = i % pages;
                BufferFrame frame = pagedFileManager.getThisPage(file, pageNumber);
                if (random.nextDouble() < writeFraction) {
                    writeText(frame, "page-" + pageNumber + "-mod-" + i);
                    pagedFileManager.unfixPage(file, pageNumber, true);
                } else {
                    pagedFileManager.unfixPage(file, pageNumber, false);
                }
            }

            // Snapshot before closing so the final flush is not counted
            statistics = pagedFileManager.getStatistics();
        } finally {
            pagedFileManager.shutdown();
        }

        pagedFileManager.destroyFile(path);

        BenchmarkResult result = new BenchmarkResult(config.getPolicy(), config.getMaxBuffers(),
                ops, pages, writeFraction, statistics);
        logger.info("Buffer policy benchmark finished: {}", result);
        return result;
    }

    /**
     * Writes a NUL terminated string at the start of the page.
     */
    private static void writeText(BufferFrame frame, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.US_ASCII);
        byte[] data = frame.getData();
        int length = Math.min(bytes.length, data.length - 1);
        System.arraycopy(bytes, 0, data, 0, length);
        data[length] = 0;
    }
}

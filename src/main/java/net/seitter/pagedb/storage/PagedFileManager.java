package net.seitter.pagedb.storage;

import net.seitter.pagedb.buffer.BufferFrame;
import net.seitter.pagedb.buffer.BufferPoolConfig;
import net.seitter.pagedb.buffer.BufferPoolManager;
import net.seitter.pagedb.buffer.BufferPoolUtils;
import net.seitter.pagedb.buffer.BufferStatistics;
import net.seitter.pagedb.buffer.IBufferPoolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point to the paged-file layer: creates, opens and closes paged files and
 * gives access to their pages through a single buffer pool it owns.
 */
public class PagedFileManager {
    private static final Logger logger = LoggerFactory.getLogger(PagedFileManager.class);

    /** Default page size in bytes. */
    public static final int DEFAULT_PAGE_SIZE = 4096;

    private final int pageSize;
    private final IBufferPoolManager bufferPool;
    private final Map<Integer, PagedFile> openFiles;
    private final AtomicInteger nextFileId = new AtomicInteger(0);

    /**
     * Creates a paged-file manager with the default page size and buffer pool configuration.
     */
    public PagedFileManager() {
        this(DEFAULT_PAGE_SIZE, BufferPoolConfig.getDefault());
    }

    /**
     * Creates a paged-file manager.
     *
     * @param pageSize The page size in bytes
     * @param config The buffer pool configuration
     */
    public PagedFileManager(int pageSize, BufferPoolConfig config) {
        this(pageSize, new BufferPoolManager(pageSize, config));
    }

    /**
     * Creates a paged-file manager on top of an existing buffer pool.
     *
     * @param pageSize The page size in bytes
     * @param bufferPool The buffer pool serving every file opened here
     */
    public PagedFileManager(int pageSize, IBufferPoolManager bufferPool) {
        this.pageSize = pageSize;
        this.bufferPool = bufferPool;
        this.openFiles = new LinkedHashMap<>();

        logger.info("Paged file manager initialized with page size: {} bytes", pageSize);
    }

    /**
     * Creates a new, empty paged file.
     *
     * @param path The file path
     * @throws PagedFileException With FILE_EXISTS if the file already exists
     * @throws IOException If the file cannot be created
     */
    public void createFile(String path) throws IOException {
        File pagedFile = new File(path);
        File parentDir = pagedFile.getAbsoluteFile().getParentFile();

        if (parentDir != null && !parentDir.exists() && !parentDir.mkdirs()) {
            throw new IOException("Failed to create parent directory " + parentDir.getAbsolutePath());
        }
        if (!pagedFile.createNewFile()) {
            logger.warn("Paged file {} already exists", path);
            throw new PagedFileException(PagedFileError.FILE_EXISTS, path);
        }

        logger.info("Created paged file {}", path);
    }

    /**
     * Deletes a paged file that is not open.
     *
     * @param path The file path
     * @throws PagedFileException With FILE_OPEN if the file is open, FILE_NOT_FOUND if it does not exist
     * @throws IOException If the file cannot be deleted
     */
    public synchronized void destroyFile(String path) throws IOException {
        File pagedFile = new File(path);
        String canonicalPath = pagedFile.getCanonicalPath();

        for (PagedFile file : openFiles.values()) {
            if (new File(file.getPath()).getCanonicalPath().equals(canonicalPath)) {
                throw new PagedFileException(PagedFileError.FILE_OPEN, path);
            }
        }
        if (!pagedFile.exists()) {
            throw new PagedFileException(PagedFileError.FILE_NOT_FOUND, path);
        }

        Files.delete(pagedFile.toPath());
        logger.info("Destroyed paged file {}", path);
    }

    /**
     * Opens a paged file.
     *
     * @param path The file path
     * @return The open file
     * @throws PagedFileException With FILE_NOT_FOUND if the file does not exist
     * @throws IOException If the file cannot be opened
     */
    public synchronized PagedFile openFile(String path) throws IOException {
        PagedFile file = new PagedFile(nextFileId.getAndIncrement(), path, pageSize);
        openFiles.put(file.getFileId(), file);

        logger.info("Opened paged file {} as file {}", path, file.getFileId());
        return file;
    }

    /**
     * Releases every buffered page of a file and closes it.
     * The file stays open if one of its pages is still fixed.
     *
     * @param file The open file
     * @throws PagedFileException With PAGE_FIXED if a page of the file is fixed
     * @throws IOException If a dirty page cannot be written back
     */
    public synchronized void closeFile(PagedFile file) throws IOException {
        checkOpen(file);

        bufferPool.releaseFile(file);
        openFiles.remove(file.getFileId());
        file.close();

        logger.info("Closed paged file {}", file.getPath());
    }

    /**
     * Fixes a page of an open file.
     *
     * @see IBufferPoolManager#getPage(RawPageStore, int)
     */
    public BufferFrame getThisPage(PagedFile file, int pageNumber) throws IOException {
        checkOpen(file);
        return bufferPool.getPage(file, pageNumber);
    }

    /**
     * Extends an open file by one page and fixes the new page in the buffer pool.
     *
     * @param file The open file
     * @return The fixed frame of the new page; its page number is in {@link BufferFrame#getPageId()}
     * @throws IOException If the file cannot be extended or no buffer is available
     */
    public BufferFrame allocatePage(PagedFile file) throws IOException {
        checkOpen(file);
        int pageNumber = file.allocatePage();
        return bufferPool.allocatePage(file, pageNumber);
    }

    /**
     * Unfixes a page of an open file.
     *
     * @see IBufferPoolManager#unfixPage(RawPageStore, int, boolean)
     */
    public void unfixPage(PagedFile file, int pageNumber, boolean dirty) throws PagedFileException {
        checkOpen(file);
        bufferPool.unfixPage(file, pageNumber, dirty);
    }

    /**
     * Marks a fixed page of an open file as modified and most recently used.
     *
     * @see IBufferPoolManager#markUsed(RawPageStore, int)
     */
    public void markUsed(PagedFile file, int pageNumber) throws PagedFileException {
        checkOpen(file);
        bufferPool.markUsed(file, pageNumber);
    }

    /**
     * Fixes a page of an open file for the duration of an operation.
     *
     * @see BufferPoolUtils#withPage(IBufferPoolManager, RawPageStore, int, boolean, BufferPoolUtils.PageOperation)
     */
    public <T> T withPage(PagedFile file, int pageNumber, boolean markDirty,
                          BufferPoolUtils.PageOperation<T> operation) throws IOException {
        checkOpen(file);
        return BufferPoolUtils.withPage(bufferPool, file, pageNumber, markDirty, operation);
    }

    /**
     * Applies a new buffer pool configuration and resets the statistics.
     *
     * @param config The new configuration
     * @throws IOException If the pool cannot be reconfigured
     */
    public void configure(BufferPoolConfig config) throws IOException {
        bufferPool.configure(config);
    }

    /**
     * Gets a snapshot of the buffer pool statistics.
     *
     * @return The statistics
     */
    public BufferStatistics getStatistics() {
        return bufferPool.getStatistics();
    }

    /**
     * Gets the buffer pool.
     *
     * @return The buffer pool manager
     */
    public IBufferPoolManager getBufferPool() {
        return bufferPool;
    }

    /**
     * Gets the page size of every file managed here.
     *
     * @return The page size in bytes
     */
    public int getPageSize() {
        return pageSize;
    }

    /**
     * Gets the files currently open.
     *
     * @return The open files in opening order
     */
    public synchronized List<PagedFile> getOpenFiles() {
        return new ArrayList<>(openFiles.values());
    }

    /**
     * Closes every open file and shuts the buffer pool down. A file that cannot be
     * released cleanly is still closed once the pool has flushed what it can, and
     * the first failure is rethrown with any later ones suppressed.
     *
     * @throws IOException If a file cannot be released or the pool cannot be flushed
     */
    public synchronized void shutdown() throws IOException {
        logger.info("Shutting down paged file manager...");

        IOException failure = null;
        for (PagedFile file : getOpenFiles()) {
            try {
                closeFile(file);
            } catch (IOException e) {
                logger.error("Failed to close paged file {} cleanly", file.getPath(), e);
                failure = merge(failure, e);
            }
        }

        try {
            bufferPool.shutdown();
        } catch (IOException e) {
            logger.error("Failed to shut down buffer pool", e);
            failure = merge(failure, e);
        }

        // Files refused above are closed last, after the pool has flushed their pages
        for (PagedFile file : getOpenFiles()) {
            openFiles.remove(file.getFileId());
            file.close();
        }

        if (failure != null) {
            throw failure;
        }
        logger.info("Paged file manager shutdown complete");
    }

    private static IOException merge(IOException first, IOException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    private synchronized void checkOpen(PagedFile file) {
        if (file == null || openFiles.get(file.getFileId()) != file) {
            throw new IllegalArgumentException("File " + file + " is not open");
        }
    }
}

package net.seitter.pagedb.buffer;

import net.seitter.pagedb.storage.PageId;
import net.seitter.pagedb.storage.PagedFileError;
import net.seitter.pagedb.storage.PagedFileException;
import net.seitter.pagedb.storage.RawPageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manages the buffer pool shared by all open files.
 * Frames are taken from the free list first, then created up to the configured
 * capacity, and only then obtained by evicting an unfixed resident page
 * according to the replacement policy.
 */
public class BufferPoolManager implements IBufferPoolManager {
    private static final Logger logger = LoggerFactory.getLogger(BufferPoolManager.class);

    private final int pageSize;
    private final RecencyTable usedList;
    private final Deque<BufferFrame> freeList;
    private BufferPoolConfig config;
    private int frameCount;

    // Statistics counters
    private final AtomicLong logicalReads = new AtomicLong(0);
    private final AtomicLong logicalWrites = new AtomicLong(0);
    private final AtomicLong physicalReads = new AtomicLong(0);
    private final AtomicLong physicalWrites = new AtomicLong(0);
    private final AtomicLong pageHits = new AtomicLong(0);
    private final AtomicLong pageMisses = new AtomicLong(0);

    /**
     * Creates a new buffer pool manager.
     *
     * @param pageSize The size of every page it caches
     * @param config The initial capacity and replacement policy
     */
    public BufferPoolManager(int pageSize, BufferPoolConfig config) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        if (config == null) {
            throw new IllegalArgumentException("Buffer pool configuration cannot be null");
        }
        this.pageSize = pageSize;
        this.config = config;
        this.usedList = new RecencyTable();
        this.freeList = new ArrayDeque<>();

        logger.info("Buffer pool initialized with capacity: {} pages of {} bytes, policy: {}",
                config.getMaxBuffers(), pageSize, config.getPolicy());
    }

    @Override
    public synchronized BufferFrame getPage(RawPageStore file, int pageNumber) throws IOException {
        PageId pageId = identify(file, pageNumber);
        logicalReads.incrementAndGet();

        BufferFrame frame = usedList.get(pageId);
        if (frame != null) {
            if (frame.isFixed()) {
                logger.warn("Page {} requested while already fixed", pageId);
                throw new PageAlreadyFixedException(pageId, frame);
            }

            frame.fix();
            usedList.moveToHead(frame);
            pageHits.incrementAndGet();

            logger.debug("Page {} hit in buffer pool", pageId);
            return frame;
        }

        // Page is not in the buffer pool, need to load from disk
        pageMisses.incrementAndGet();
        frame = acquireFrame();

        try {
            physicalReads.incrementAndGet();
            file.readPage(pageNumber, frame.getData());
        } catch (IOException e) {
            frame.reset();
            freeList.push(frame);
            throw e;
        }

        frame.bind(file, pageId);
        frame.fix();
        usedList.insertAtHead(frame);

        logger.debug("Page {} loaded from disk to buffer pool", pageId);
        return frame;
    }

    @Override
    public synchronized void unfixPage(RawPageStore file, int pageNumber, boolean dirty)
            throws PagedFileException {
        BufferFrame frame = fixedFrame(identify(file, pageNumber));

        if (dirty) {
            frame.markDirty();
            logicalWrites.incrementAndGet();
        }

        frame.unfix();
        usedList.moveToHead(frame);
    }

    @Override
    public synchronized BufferFrame allocatePage(RawPageStore file, int pageNumber) throws IOException {
        PageId pageId = identify(file, pageNumber);

        if (usedList.contains(pageId)) {
            logger.warn("Attempted to allocate page {} which is already in the buffer pool", pageId);
            throw new PagedFileException(PagedFileError.PAGE_ALREADY_IN_BUFFER, pageId);
        }

        BufferFrame frame = acquireFrame();
        frame.clear();
        frame.bind(file, pageId);
        frame.fix();
        usedList.insertAtHead(frame);

        logger.debug("Allocated buffer for new page {}", pageId);
        return frame;
    }

    @Override
    public synchronized void releaseFile(RawPageStore file) throws IOException {
        List<BufferFrame> frames = usedList.framesOf(file.getFileId());

        // Refuse before writing anything so the release is all or nothing
        for (BufferFrame frame : frames) {
            if (frame.isFixed()) {
                logger.warn("Cannot release file {}, page {} is still fixed", file.getFileId(), frame.getPageId());
                throw new PagedFileException(PagedFileError.PAGE_FIXED, frame.getPageId());
            }
        }

        for (BufferFrame frame : frames) {
            if (frame.isDirty()) {
                writeBack(frame);
            }
            usedList.remove(frame);
            frame.reset();
            freeList.push(frame);
        }

        logger.debug("Released {} pages of file {}", frames.size(), file.getFileId());
    }

    @Override
    public synchronized void markUsed(RawPageStore file, int pageNumber) throws PagedFileException {
        BufferFrame frame = fixedFrame(identify(file, pageNumber));

        frame.markDirty();
        logicalWrites.incrementAndGet();
        usedList.moveToHead(frame);
    }

    @Override
    public synchronized void flushAll() throws IOException {
        int flushed = 0;
        for (BufferFrame frame : usedList.frames()) {
            if (frame.isDirty()) {
                writeBack(frame);
                flushed++;
            }
        }
        logger.debug("Flushed {} dirty pages", flushed);
    }

    @Override
    public synchronized void configure(BufferPoolConfig newConfig) throws IOException {
        if (newConfig == null) {
            throw new IllegalArgumentException("Buffer pool configuration cannot be null");
        }
        for (BufferFrame frame : usedList.frames()) {
            if (frame.isFixed()) {
                logger.warn("Cannot reconfigure buffer pool while page {} is fixed", frame.getPageId());
                throw new PagedFileException(PagedFileError.PAGE_FIXED, frame.getPageId());
            }
        }

        // Shrink to the new capacity, free frames first. The configuration and
        // counters only change once the pool fits the new capacity.
        while (frameCount > newConfig.getMaxBuffers() && !freeList.isEmpty()) {
            freeList.pop();
            frameCount--;
        }
        try {
            while (frameCount > newConfig.getMaxBuffers()) {
                BufferFrame victim = usedList.findUnfixed(newConfig.getPolicy());
                evict(victim);
                frameCount--;
            }
        } catch (IOException e) {
            logger.error("Failed to shrink buffer pool to {} pages, keeping {}",
                    newConfig.getMaxBuffers(), config, e);
            throw e;
        }

        this.config = newConfig;
        resetStatistics();
        logger.info("Buffer pool reconfigured: capacity {} pages, policy {}",
                newConfig.getMaxBuffers(), newConfig.getPolicy());
    }

    @Override
    public synchronized BufferPoolConfig getConfig() {
        return config;
    }

    @Override
    public BufferStatistics getStatistics() {
        return new BufferStatistics(
                logicalReads.get(),
                logicalWrites.get(),
                physicalReads.get(),
                physicalWrites.get(),
                pageHits.get(),
                pageMisses.get());
    }

    @Override
    public synchronized List<FrameStatus> describe() {
        List<FrameStatus> statuses = new ArrayList<>();
        for (BufferFrame frame : usedList.frames()) {
            PageId pageId = frame.getPageId();
            statuses.add(new FrameStatus(pageId.getFileId(), pageId.getPageNumber(),
                    frame.isFixed(), frame.isDirty()));
        }
        return statuses;
    }

    @Override
    public synchronized int getSize() {
        return usedList.size();
    }

    @Override
    public synchronized int getCapacity() {
        return config.getMaxBuffers();
    }

    @Override
    public synchronized int getFrameCount() {
        return frameCount;
    }

    @Override
    public synchronized int getFreeFrameCount() {
        return freeList.size();
    }

    @Override
    public synchronized int getDirtyPageCount() {
        int dirty = 0;
        for (BufferFrame frame : usedList.frames()) {
            if (frame.isDirty()) {
                dirty++;
            }
        }
        return dirty;
    }

    /**
     * Gets the page size this pool caches.
     *
     * @return The page size in bytes
     */
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public synchronized void shutdown() throws IOException {
        flushAll();
        usedList.clear();
        freeList.clear();
        frameCount = 0;
        logger.info("Buffer pool shut down");
    }

    /**
     * Verifies the used list and page index agree.
     *
     * @throws IllegalStateException If they disagree
     */
    synchronized void checkConsistency() {
        usedList.checkConsistency();
        if (usedList.size() + freeList.size() != frameCount) {
            throw new IllegalStateException("Frames lost: " + usedList.size() + " used + "
                    + freeList.size() + " free != " + frameCount + " allocated");
        }
    }

    /**
     * Obtains an unlinked frame without identity: from the free list, by creating
     * one below capacity, or by evicting a victim.
     */
    private BufferFrame acquireFrame() throws IOException {
        BufferFrame frame = freeList.poll();
        if (frame != null) {
            return frame;
        }

        if (frameCount < config.getMaxBuffers()) {
            try {
                frame = new BufferFrame(pageSize);
            } catch (OutOfMemoryError e) {
                logger.error("Cannot allocate a new buffer frame of {} bytes", pageSize);
                throw new PagedFileException(PagedFileError.NO_MEMORY, frameCount + " frames allocated");
            }
            frameCount++;
            return frame;
        }

        BufferFrame victim = usedList.findUnfixed(config.getPolicy());
        if (victim == null) {
            logger.warn("Cannot evict any pages from buffer pool, all {} pages are fixed", usedList.size());
            throw new PagedFileException(PagedFileError.NO_BUFFER_SPACE, (PageId) null);
        }

        evict(victim);
        return victim;
    }

    /**
     * Writes back a dirty victim and unlinks it. If the write fails the victim stays resident and dirty.
     */
    private void evict(BufferFrame victim) throws IOException {
        PageId victimPageId = victim.getPageId();
        if (victim.isDirty()) {
            writeBack(victim);
            logger.debug("Evicted dirty page {} and flushed to disk", victimPageId);
        } else {
            logger.debug("Evicted clean page {}", victimPageId);
        }
        usedList.remove(victim);
        victim.reset();
    }

    private void writeBack(BufferFrame frame) throws IOException {
        frame.getFile().writePage(frame.getPageId().getPageNumber(), frame.getData());
        frame.markClean();
        physicalWrites.incrementAndGet();
    }

    private BufferFrame fixedFrame(PageId pageId) throws PagedFileException {
        BufferFrame frame = usedList.get(pageId);
        if (frame == null) {
            logger.warn("Page {} is not in the buffer pool", pageId);
            throw new PagedFileException(PagedFileError.PAGE_NOT_IN_BUFFER, pageId);
        }
        if (!frame.isFixed()) {
            logger.warn("Page {} is not fixed", pageId);
            throw new PagedFileException(PagedFileError.PAGE_NOT_FIXED, pageId);
        }
        return frame;
    }

    private PageId identify(RawPageStore file, int pageNumber) {
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
        if (pageNumber < 0) {
            throw new IllegalArgumentException("Page number must be non-negative, got " + pageNumber);
        }
        if (file.getPageSize() != pageSize) {
            throw new IllegalArgumentException("File " + file.getFileId() + " uses " + file.getPageSize()
                    + " byte pages, the buffer pool holds " + pageSize + " byte pages");
        }
        return new PageId(file.getFileId(), pageNumber);
    }

    private void resetStatistics() {
        logicalReads.set(0);
        logicalWrites.set(0);
        physicalReads.set(0);
        physicalWrites.set(0);
        pageHits.set(0);
        pageMisses.set(0);
    }
}

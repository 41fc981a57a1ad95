package net.seitter.pagedb.buffer;

import net.seitter.pagedb.storage.PagedFileException;
import net.seitter.pagedb.storage.RawPageStore;

import java.io.IOException;
import java.util.List;

/**
 * Interface for a buffer pool manager that caches fixed-size pages of open files in memory.
 * A page may be read or written by its holder only while it is fixed.
 */
public interface IBufferPoolManager {
    /**
     * Fixes a page in the buffer pool, reading it from the file if it is not resident.
     *
     * @param file The open file
     * @param pageNumber The page number
     * @return The fixed frame holding the page
     * @throws PageAlreadyFixedException If the page is resident and already fixed
     * @throws PagedFileException With INVALID_PAGE if the page does not exist, or NO_BUFFER_SPACE
     *         if every resident page is fixed
     * @throws IOException If the page cannot be read or a victim cannot be written back
     */
    BufferFrame getPage(RawPageStore file, int pageNumber) throws IOException;

    /**
     * Unfixes a page, making it eligible for eviction and the most recently used one.
     *
     * @param file The open file
     * @param pageNumber The page number
     * @param dirty Whether the holder modified the page; false leaves an earlier dirty mark in place
     * @throws PagedFileException With PAGE_NOT_IN_BUFFER or PAGE_NOT_FIXED
     */
    void unfixPage(RawPageStore file, int pageNumber, boolean dirty) throws PagedFileException;

    /**
     * Fixes a frame for a freshly allocated page without reading it from disk.
     *
     * @param file The open file
     * @param pageNumber The number of the new page
     * @return The fixed, zero-filled frame
     * @throws PagedFileException With PAGE_ALREADY_IN_BUFFER if the page is already resident
     * @throws IOException If a victim cannot be written back
     */
    BufferFrame allocatePage(RawPageStore file, int pageNumber) throws IOException;

    /**
     * Writes back and drops every resident page of a file. Nothing is released if one of them is fixed.
     *
     * @param file The file being closed
     * @throws PagedFileException With PAGE_FIXED if a page of the file is fixed
     * @throws IOException If a dirty page cannot be written back
     */
    void releaseFile(RawPageStore file) throws IOException;

    /**
     * Marks a fixed page as modified and most recently used.
     *
     * @param file The open file
     * @param pageNumber The page number
     * @throws PagedFileException With PAGE_NOT_IN_BUFFER or PAGE_NOT_FIXED
     */
    void markUsed(RawPageStore file, int pageNumber) throws PagedFileException;

    /**
     * Writes back every dirty resident page. Residency and fix state are unchanged.
     *
     * @throws IOException If a page cannot be written
     */
    void flushAll() throws IOException;

    /**
     * Applies a new capacity and replacement policy and resets the statistics.
     *
     * @param config The new configuration
     * @throws PagedFileException With PAGE_FIXED if any page is fixed
     * @throws IOException If a surplus dirty page cannot be written back
     */
    void configure(BufferPoolConfig config) throws IOException;

    /**
     * Gets the current configuration.
     *
     * @return The configuration
     */
    BufferPoolConfig getConfig();

    /**
     * Gets a snapshot of the statistics counters. Reading does not reset them.
     *
     * @return The statistics
     */
    BufferStatistics getStatistics();

    /**
     * Describes the resident pages from the most to the least recently used.
     *
     * @return The status of each resident page
     */
    List<FrameStatus> describe();

    /**
     * Gets the current number of resident pages.
     *
     * @return The number of pages in the used list
     */
    int getSize();

    /**
     * Gets the maximum number of frames.
     *
     * @return The capacity in pages
     */
    int getCapacity();

    /**
     * Gets the number of frames allocated so far, resident or free.
     *
     * @return The number of frames
     */
    int getFrameCount();

    /**
     * Gets the number of frames on the free list.
     *
     * @return The number of free frames
     */
    int getFreeFrameCount();

    /**
     * Gets the number of dirty resident pages.
     *
     * @return The number of dirty pages
     */
    int getDirtyPageCount();

    /**
     * Flushes every dirty page and drops all frames.
     *
     * @throws IOException If a dirty page cannot be written back
     */
    void shutdown() throws IOException;
}

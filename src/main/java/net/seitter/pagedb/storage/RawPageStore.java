package net.seitter.pagedb.storage;

import java.io.IOException;

/**
 * Whole-page I/O primitives for one open file.
 * The buffer pool reads and writes pages only through this interface.
 */
public interface RawPageStore {
    /**
     * Gets the process-unique id of this open file.
     *
     * @return The file id
     */
    int getFileId();

    /**
     * Gets the size of each page in bytes.
     *
     * @return The page size
     */
    int getPageSize();

    /**
     * Reads a page into the given buffer.
     *
     * @param pageNumber The page number to read
     * @param buffer The destination, exactly one page long
     * @throws PagedFileException With {@link PagedFileError#INVALID_PAGE} if the page has not been allocated
     * @throws IOException If the read fails
     */
    void readPage(int pageNumber, byte[] buffer) throws IOException;

    /**
     * Writes a buffer to an allocated page.
     *
     * @param pageNumber The page number to write
     * @param buffer The page contents, exactly one page long
     * @throws PagedFileException With {@link PagedFileError#INVALID_PAGE} if the page has not been allocated
     * @throws IOException If the write fails
     */
    void writePage(int pageNumber, byte[] buffer) throws IOException;

    /**
     * Extends the file by one zero-filled page.
     *
     * @return The number of the new page
     * @throws IOException If the file cannot be extended
     */
    int allocatePage() throws IOException;

    /**
     * Gets the number of allocated pages.
     *
     * @return The total number of pages
     * @throws IOException If the file size cannot be determined
     */
    int getTotalPages() throws IOException;

    /**
     * Closes the underlying file.
     */
    void close();
}

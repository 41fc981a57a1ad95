package net.seitter.pagedb.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Page store kept in memory, with switches to make reads or writes fail.
 */
public class InMemoryPageStore implements RawPageStore {
    private final int fileId;
    private final int pageSize;
    private final List<byte[]> pages = new ArrayList<>();
    private boolean failReads;
    private boolean failWrites;
    private int readCount;
    private int writeCount;

    public InMemoryPageStore(int fileId, int pageSize) {
        this.fileId = fileId;
        this.pageSize = pageSize;
    }

    /**
     * Creates a store that already holds some zero-filled pages.
     */
    public static InMemoryPageStore withPages(int fileId, int pageSize, int pageCount) {
        InMemoryPageStore store = new InMemoryPageStore(fileId, pageSize);
        for (int i = 0; i < pageCount; i++) {
            store.allocatePage();
        }
        return store;
    }

    @Override
    public int getFileId() {
        return fileId;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public void readPage(int pageNumber, byte[] buffer) throws IOException {
        checkPageNumber(pageNumber);
        if (failReads) {
            throw new IOException("Injected read failure on page " + pageNumber);
        }
        readCount++;
        System.arraycopy(pages.get(pageNumber), 0, buffer, 0, pageSize);
    }

    @Override
    public void writePage(int pageNumber, byte[] buffer) throws IOException {
        checkPageNumber(pageNumber);
        if (failWrites) {
            throw new IOException("Injected write failure on page " + pageNumber);
        }
        writeCount++;
        System.arraycopy(buffer, 0, pages.get(pageNumber), 0, pageSize);
    }

    @Override
    public int allocatePage() {
        pages.add(new byte[pageSize]);
        return pages.size() - 1;
    }

    @Override
    public int getTotalPages() {
        return pages.size();
    }

    @Override
    public void close() {
    }

    /**
     * Gets a copy of the stored bytes of a page.
     */
    public byte[] getStoredPage(int pageNumber) {
        return Arrays.copyOf(pages.get(pageNumber), pageSize);
    }

    public void setFailReads(boolean failReads) {
        this.failReads = failReads;
    }

    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    public int getReadCount() {
        return readCount;
    }

    public int getWriteCount() {
        return writeCount;
    }

    private void checkPageNumber(int pageNumber) throws PagedFileException {
        if (pageNumber < 0 || pageNumber >= pages.size()) {
            throw new PagedFileException(PagedFileError.INVALID_PAGE, new PageId(fileId, pageNumber));
        }
    }
}

package net.seitter.pagedb.storage;

import java.util.Objects;

/**
 * Uniquely identifies a page within the running system.
 * A PageId consists of the id of an open file and a page number within that file.
 */
public class PageId {
    private final int fileId;
    private final int pageNumber;

    /**
     * Creates a new PageId.
     *
     * @param fileId The id of the open file containing the page
     * @param pageNumber The number of the page within the file
     */
    public PageId(int fileId, int pageNumber) {
        this.fileId = fileId;
        this.pageNumber = pageNumber;
    }

    /**
     * Gets the file id.
     *
     * @return The file id
     */
    public int getFileId() {
        return fileId;
    }

    /**
     * Gets the page number.
     *
     * @return The page number
     */
    public int getPageNumber() {
        return pageNumber;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PageId pageId = (PageId) o;
        return fileId == pageId.fileId && pageNumber == pageId.pageNumber;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fileId, pageNumber);
    }

    @Override
    public String toString() {
        return fileId + ":" + pageNumber;
    }
}

package net.seitter.pagedb.buffer;

/**
 * Represents the status of a resident page in the buffer pool.
 */
public class FrameStatus {
    private final int fileId;
    private final int pageNumber;
    private final boolean fixed;
    private final boolean dirty;

    public FrameStatus(int fileId, int pageNumber, boolean fixed, boolean dirty) {
        this.fileId = fileId;
        this.pageNumber = pageNumber;
        this.fixed = fixed;
        this.dirty = dirty;
    }

    public int getFileId() {
        return fileId;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public boolean isFixed() {
        return fixed;
    }

    public boolean isDirty() {
        return dirty;
    }

    @Override
    public String toString() {
        return fileId + "\t" + pageNumber + "\t" + (fixed ? 1 : 0) + "\t" + (dirty ? 1 : 0);
    }
}

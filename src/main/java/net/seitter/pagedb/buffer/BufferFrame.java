package net.seitter.pagedb.buffer;

import net.seitter.pagedb.storage.PageId;
import net.seitter.pagedb.storage.RawPageStore;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * An in-memory slot of the buffer pool holding a cached copy of one disk page.
 * The identity of a frame is rebound whenever it is reused for a different page.
 */
public class BufferFrame {
    private final byte[] data;
    private RawPageStore file;
    private PageId pageId;
    private boolean fixed;
    private boolean dirty;

    // used-list links, maintained by RecencyTable only
    BufferFrame prev;
    BufferFrame next;

    /**
     * Creates an unbound frame.
     *
     * @param pageSize The size of the page payload in bytes
     */
    BufferFrame(int pageSize) {
        this.data = new byte[pageSize];
    }

    /**
     * Gets the identity of the page currently held.
     *
     * @return The page ID, or null if the frame is free
     */
    public PageId getPageId() {
        return pageId;
    }

    /**
     * Gets the file owning the page currently held.
     *
     * @return The owning file, or null if the frame is free
     */
    public RawPageStore getFile() {
        return file;
    }

    /**
     * Gets the page payload. Callers may read and write it while the page is fixed.
     *
     * @return The page data
     */
    public byte[] getData() {
        return data;
    }

    /**
     * Gets the page payload as a little-endian ByteBuffer.
     *
     * @return The page data as a ByteBuffer
     */
    public ByteBuffer getBuffer() {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Gets the size of the payload in bytes.
     *
     * @return The page size
     */
    public int getPageSize() {
        return data.length;
    }

    public boolean isFixed() {
        return fixed;
    }

    public boolean isDirty() {
        return dirty;
    }

    void bind(RawPageStore file, PageId pageId) {
        this.file = file;
        this.pageId = pageId;
        this.dirty = false;
    }

    void fix() {
        fixed = true;
    }

    void unfix() {
        fixed = false;
    }

    void markDirty() {
        dirty = true;
    }

    void markClean() {
        dirty = false;
    }

    void clear() {
        Arrays.fill(data, (byte) 0);
    }

    /**
     * Drops the page identity so the frame can go back to the free list.
     */
    void reset() {
        file = null;
        pageId = null;
        fixed = false;
        dirty = false;
        prev = null;
        next = null;
    }

    @Override
    public String toString() {
        return "BufferFrame{" + pageId + ", fixed=" + fixed + ", dirty=" + dirty + "}";
    }
}

package net.seitter.pagedb.record;

import net.seitter.pagedb.buffer.BufferFrame;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Layout of a page holding variable-length records.
 * <pre>
 * [freeStart (4)] [record data, growing up ...]    [... slot n-1] ... [slot 0] [slotCount (4)]
 * </pre>
 * Each slot is a 4 byte record offset followed by a 4 byte record length; a negative
 * length marks a deleted record. All integers are little-endian. A page whose
 * freeStart is 0 has never been initialized and holds no records.
 */
public class SlottedPageLayout {
    public static final int HEADER_SIZE = 4;
    public static final int SLOT_COUNT_SIZE = 4;
    public static final int SLOT_ENTRY_SIZE = 8;
    public static final int DELETED_LENGTH = -1;

    private static final int FREE_START_OFFSET = 0;

    private final ByteBuffer buffer;
    private final int pageSize;

    /**
     * Creates a layout over the page held by a fixed frame.
     *
     * @param frame The fixed frame
     */
    public SlottedPageLayout(BufferFrame frame) {
        this(frame.getBuffer());
    }

    /**
     * Creates a layout over raw page bytes.
     *
     * @param data The page data
     */
    public SlottedPageLayout(byte[] data) {
        this(ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN));
    }

    private SlottedPageLayout(ByteBuffer buffer) {
        this.buffer = buffer;
        this.pageSize = buffer.capacity();
    }

    /**
     * Gets the largest record that fits on an empty page.
     *
     * @param pageSize The page size in bytes
     * @return The maximum record length
     */
    public static int maxRecordLength(int pageSize) {
        return pageSize - HEADER_SIZE - SLOT_COUNT_SIZE - SLOT_ENTRY_SIZE;
    }

    /**
     * Initializes an empty page: data starts right after the header, no slots.
     */
    public void initialize() {
        buffer.putInt(FREE_START_OFFSET, HEADER_SIZE);
        setSlotCount(0);
    }

    public boolean isInitialized() {
        return buffer.getInt(FREE_START_OFFSET) != 0;
    }

    public void ensureInitialized() {
        if (!isInitialized()) {
            initialize();
        }
    }

    public int getFreeStart() {
        int freeStart = buffer.getInt(FREE_START_OFFSET);
        return freeStart == 0 ? HEADER_SIZE : freeStart;
    }

    public int getSlotCount() {
        if (!isInitialized()) {
            return 0;
        }
        int slotCount = buffer.getInt(pageSize - SLOT_COUNT_SIZE);
        int freeStart = buffer.getInt(FREE_START_OFFSET);
        if (slotCount < 0 || freeStart < HEADER_SIZE
                || freeStart > pageSize - SLOT_COUNT_SIZE - (long) slotCount * SLOT_ENTRY_SIZE) {
            throw new IllegalStateException("Corrupt slotted page: freeStart " + freeStart
                    + ", slot count " + slotCount + ", page size " + pageSize);
        }
        return slotCount;
    }

    /**
     * Gets the offset of the lowest slot entry, where the slot directory begins.
     *
     * @return The slot directory start offset
     */
    public int getSlotDirectoryStart() {
        return pageSize - SLOT_COUNT_SIZE - getSlotCount() * SLOT_ENTRY_SIZE;
    }

    /**
     * Gets the gap between the end of the record data and the slot directory.
     *
     * @return The number of free bytes
     */
    public int getFreeSpace() {
        return getSlotDirectoryStart() - getFreeStart();
    }

    /**
     * Checks whether a record plus one new slot entry fits in the free space.
     *
     * @param recordLength The record length
     * @return true if the record fits
     */
    public boolean canFit(int recordLength) {
        return recordLength + SLOT_ENTRY_SIZE <= getFreeSpace();
    }

    /**
     * Appends a record at freeStart and gives it the next slot.
     *
     * @param record The record bytes
     * @return The new slot number, or -1 if the record does not fit
     */
    public int insertRecord(byte[] record) {
        if (!canFit(record.length)) {
            return -1;
        }

        int freeStart = getFreeStart();
        int slot = getSlotCount();

        buffer.put(freeStart, record);
        writeSlot(slot, freeStart, record.length);
        setSlotCount(slot + 1);
        buffer.putInt(FREE_START_OFFSET, freeStart + record.length);

        return slot;
    }

    public int getSlotOffset(int slot) {
        return buffer.getInt(slotPosition(slot));
    }

    public int getSlotLength(int slot) {
        return buffer.getInt(slotPosition(slot) + 4);
    }

    public boolean isValidSlot(int slot) {
        return slot >= 0 && slot < getSlotCount();
    }

    public boolean isLive(int slot) {
        return getSlotLength(slot) > 0;
    }

    /**
     * Copies a live record out of the page.
     *
     * @param slot The slot number
     * @return A copy of the record bytes
     */
    public byte[] getRecord(int slot) {
        int length = getSlotLength(slot);
        if (length <= 0) {
            throw new IllegalStateException("Slot " + slot + " holds no record");
        }
        byte[] record = new byte[length];
        buffer.get(getSlotOffset(slot), record);
        return record;
    }

    /**
     * Tombstones a slot. The record bytes stay where they are and the space is not reused.
     *
     * @param slot The slot number
     */
    public void deleteRecord(int slot) {
        writeSlot(slot, getSlotOffset(slot), DELETED_LENGTH);
    }

    /**
     * Gets the bytes taken by header, record data (live or deleted), slot directory and trailer.
     *
     * @return The used bytes, at most the page size
     */
    public int getUsedBytes() {
        int used = getFreeStart() + getSlotCount() * SLOT_ENTRY_SIZE + SLOT_COUNT_SIZE;
        return Math.min(used, pageSize);
    }

    public int getLiveRecordCount() {
        int live = 0;
        int slotCount = getSlotCount();
        for (int slot = 0; slot < slotCount; slot++) {
            if (isLive(slot)) {
                live++;
            }
        }
        return live;
    }

    public int getLiveRecordBytes() {
        int bytes = 0;
        int slotCount = getSlotCount();
        for (int slot = 0; slot < slotCount; slot++) {
            bytes += Math.max(0, getSlotLength(slot));
        }
        return bytes;
    }

    private void setSlotCount(int slotCount) {
        buffer.putInt(pageSize - SLOT_COUNT_SIZE, slotCount);
    }

    private void writeSlot(int slot, int offset, int length) {
        int position = slotPosition(slot);
        buffer.putInt(position, offset);
        buffer.putInt(position + 4, length);
    }

    private int slotPosition(int slot) {
        return pageSize - SLOT_COUNT_SIZE - (slot + 1) * SLOT_ENTRY_SIZE;
    }
}

package net.seitter.pagedb.record;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

/**
 * Tests for the SlottedPageLayout class.
 */
public class SlottedPageLayoutTest {

    private static final int PAGE_SIZE = 64;

    @Test
    public void testInitializeWritesLittleEndianHeaderAndTrailer() {
        byte[] data = new byte[PAGE_SIZE];
        SlottedPageLayout layout = new SlottedPageLayout(data);

        assertFalse(layout.isInitialized());
        layout.initialize();

        assertTrue(layout.isInitialized());
        assertArrayEquals(new byte[] {4, 0, 0, 0}, slice(data, 0, 4), "freeStart should follow the header");
        assertArrayEquals(new byte[] {0, 0, 0, 0}, slice(data, 60, 4));
        assertEquals(0, layout.getSlotCount());
        assertEquals(56, layout.getFreeSpace());
    }

    @Test
    public void testInsertLaysOutRecordAndSlot() {
        byte[] data = new byte[PAGE_SIZE];
        SlottedPageLayout layout = new SlottedPageLayout(data);
        layout.initialize();

        assertEquals(0, layout.insertRecord("abc".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(1, layout.insertRecord("de".getBytes(StandardCharsets.US_ASCII)));

        // Record bytes are packed after the header
        assertEquals("abcde", new String(data, 4, 5, StandardCharsets.US_ASCII));
        assertArrayEquals(new byte[] {9, 0, 0, 0}, slice(data, 0, 4));
        // Slot 0 sits right before the trailer, slot 1 below it
        assertArrayEquals(new byte[] {4, 0, 0, 0, 3, 0, 0, 0}, slice(data, 52, 8));
        assertArrayEquals(new byte[] {7, 0, 0, 0, 2, 0, 0, 0}, slice(data, 44, 8));
        assertArrayEquals(new byte[] {2, 0, 0, 0}, slice(data, 60, 4));

        assertEquals(44, layout.getSlotDirectoryStart());
        assertEquals(35, layout.getFreeSpace());
        assertEquals(9 + 16 + 4, layout.getUsedBytes());
        assertArrayEquals("de".getBytes(StandardCharsets.US_ASCII), layout.getRecord(1));
    }

    @Test
    public void testDeleteLeavesTombstone() {
        byte[] data = new byte[PAGE_SIZE];
        SlottedPageLayout layout = new SlottedPageLayout(data);
        layout.initialize();
        layout.insertRecord(new byte[] {1, 2});
        layout.insertRecord(new byte[] {3});

        layout.deleteRecord(0);

        assertFalse(layout.isLive(0));
        assertTrue(layout.isLive(1));
        assertEquals(SlottedPageLayout.DELETED_LENGTH, layout.getSlotLength(0));
        assertArrayEquals(new byte[] {-1, -1, -1, -1}, slice(data, 56, 4));
        assertEquals(2, layout.getSlotCount(), "Deleting keeps the slot");
        assertEquals(7, layout.getFreeStart(), "Deleting does not reclaim space");
        assertEquals(1, layout.getLiveRecordCount());
        assertEquals(1, layout.getLiveRecordBytes());
        assertThrows(IllegalStateException.class, () -> layout.getRecord(0));
    }

    @Test
    public void testLargestRecordFitsExactly() {
        int max = SlottedPageLayout.maxRecordLength(PAGE_SIZE);
        assertEquals(48, max);

        SlottedPageLayout layout = new SlottedPageLayout(new byte[PAGE_SIZE]);
        layout.initialize();
        assertFalse(layout.canFit(max + 1));
        assertTrue(layout.canFit(max));
        assertEquals(0, layout.insertRecord(new byte[max]));
        assertEquals(0, layout.getFreeSpace());
        assertEquals(PAGE_SIZE, layout.getUsedBytes());
        assertEquals(-1, layout.insertRecord(new byte[1]));
    }

    @Test
    public void testInsertFailsWhenPageIsFull() {
        SlottedPageLayout layout = new SlottedPageLayout(new byte[PAGE_SIZE]);
        layout.initialize();

        int inserted = 0;
        while (layout.insertRecord(new byte[] {7, 7, 7, 7}) >= 0) {
            inserted++;
        }

        // 56 free bytes, 12 per record
        assertEquals(4, inserted);
        assertEquals(4, layout.getSlotCount());
        assertEquals(8, layout.getFreeSpace());
    }

    @Test
    public void testUninitializedPageLooksEmpty() {
        SlottedPageLayout layout = new SlottedPageLayout(new byte[PAGE_SIZE]);

        assertEquals(0, layout.getSlotCount());
        assertEquals(SlottedPageLayout.HEADER_SIZE, layout.getFreeStart());
        assertEquals(56, layout.getFreeSpace());
        assertEquals(8, layout.getUsedBytes());

        layout.ensureInitialized();
        assertTrue(layout.isInitialized());
    }

    @Test
    public void testCorruptHeaderIsDetected() {
        byte[] data = new byte[PAGE_SIZE];
        data[0] = 100;
        SlottedPageLayout layout = new SlottedPageLayout(data);

        assertThrows(IllegalStateException.class, layout::getSlotCount);
    }

    private static byte[] slice(byte[] data, int offset, int length) {
        byte[] result = new byte[length];
        System.arraycopy(data, offset, result, 0, length);
        return result;
    }
}

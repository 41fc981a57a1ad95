package net.seitter.pagedb.buffer;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import net.seitter.pagedb.storage.InMemoryPageStore;
import net.seitter.pagedb.storage.PagedFileError;
import net.seitter.pagedb.storage.PagedFileException;

public class BufferPoolUtilsTest {

    private InMemoryPageStore store;
    private BufferPoolManager bufferPool;

    @BeforeEach
    public void setUp() {
        store = InMemoryPageStore.withPages(0, 16, 2);
        bufferPool = new BufferPoolManager(16, new BufferPoolConfig(2, ReplacementPolicy.LRU));
    }

    @Test
    public void testWithPageUnfixesAndMarksDirty() throws IOException {
        int value = BufferPoolUtils.withPage(bufferPool, store, 1, true, frame -> {
            assertTrue(frame.isFixed());
            frame.getData()[0] = 5;
            return 17;
        });

        assertEquals(17, value);
        FrameStatus status = bufferPool.describe().get(0);
        assertFalse(status.isFixed(), "Page should be unfixed after the operation");
        assertTrue(status.isDirty());
        assertEquals(1, bufferPool.getStatistics().getLogicalWrites());
    }

    @Test
    public void testWithPageUnfixesCleanWhenOperationFails() throws IOException {
        IOException e = assertThrows(IOException.class,
                () -> BufferPoolUtils.withPage(bufferPool, store, 0, true, frame -> {
                    throw new IOException("boom");
                }));
        assertEquals("boom", e.getMessage());

        FrameStatus status = bufferPool.describe().get(0);
        assertFalse(status.isFixed());
        assertFalse(status.isDirty(), "A failed operation must not dirty the page");
        bufferPool.checkConsistency();
    }

    @Test
    public void testWithPageKeepsOperationFailureWhenUnfixFails() throws IOException {
        IOException e = assertThrows(IOException.class,
                () -> BufferPoolUtils.withPage(bufferPool, store, 0, true, frame -> {
                    bufferPool.unfixPage(store, 0, false);
                    throw new IOException("boom");
                }));

        assertEquals("boom", e.getMessage(), "The operation failure must not be replaced");
        assertEquals(1, e.getSuppressed().length);
        PagedFileException unfixFailure = assertInstanceOf(PagedFileException.class, e.getSuppressed()[0]);
        assertEquals(PagedFileError.PAGE_NOT_FIXED, unfixFailure.getError());
        bufferPool.checkConsistency();
    }

    @Test
    public void testWithPageReadOnly() throws IOException {
        byte first = BufferPoolUtils.withPage(bufferPool, store, 0, false, frame -> frame.getData()[0]);

        assertEquals(0, first);
        assertEquals(0, bufferPool.getDirtyPageCount());
    }
}

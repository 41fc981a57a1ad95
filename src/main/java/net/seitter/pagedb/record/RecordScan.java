package net.seitter.pagedb.record;

import net.seitter.pagedb.storage.PagedFile;
import net.seitter.pagedb.storage.PagedFileError;
import net.seitter.pagedb.storage.PagedFileException;
import net.seitter.pagedb.storage.PagedFileManager;

import java.io.Closeable;
import java.io.IOException;

/**
 * Forward-only cursor over the live records of a slotted file.
 * No page stays fixed between calls to {@link #next()}.
 */
public class RecordScan implements Closeable {
    private final PagedFileManager pagedFileManager;
    private final PagedFile file;
    private int currentPage;
    private int currentSlot;
    private boolean closed;

    RecordScan(PagedFileManager pagedFileManager, PagedFile file) {
        this.pagedFileManager = pagedFileManager;
        this.file = file;
        this.currentPage = 0;
        this.currentSlot = 0;
    }

    /**
     * Gets the next live record.
     *
     * @return The record, or null once the scan has passed the last page
     * @throws IOException If a page cannot be read
     */
    public ScannedRecord next() throws IOException {
        if (closed) {
            throw new IllegalStateException("Scan is closed");
        }

        while (true) {
            ScannedRecord record;
            try {
                record = pagedFileManager.withPage(file, currentPage, false, frame -> {
                    SlottedPageLayout layout = new SlottedPageLayout(frame);
                    int slotCount = layout.getSlotCount();
                    for (int slot = currentSlot; slot < slotCount; slot++) {
                        if (layout.isLive(slot)) {
                            currentSlot = slot + 1;
                            return new ScannedRecord(new RecordId(currentPage, slot), layout.getRecord(slot));
                        }
                    }
                    return null;
                });
            } catch (PagedFileException e) {
                if (e.getError() == PagedFileError.INVALID_PAGE) {
                    return null;
                }
                throw e;
            }

            if (record != null) {
                return record;
            }
            currentPage++;
            currentSlot = 0;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        closed = true;
    }
}

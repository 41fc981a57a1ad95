package net.seitter.pagedb.record;

import net.seitter.pagedb.buffer.BufferFrame;
import net.seitter.pagedb.storage.PagedFile;
import net.seitter.pagedb.storage.PagedFileError;
import net.seitter.pagedb.storage.PagedFileException;
import net.seitter.pagedb.storage.PagedFileManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores variable-length records in slotted pages obtained from the buffer pool.
 * Insertion tries every page from page 0 upward and appends a new page only when
 * none has room. Deleted records leave tombstones whose space is never reused.
 */
public class SlottedFileManager {
    private static final Logger logger = LoggerFactory.getLogger(SlottedFileManager.class);

    private final PagedFileManager pagedFileManager;

    public SlottedFileManager(PagedFileManager pagedFileManager) {
        this.pagedFileManager = pagedFileManager;
    }

    public void createFile(String path) throws IOException {
        pagedFileManager.createFile(path);
    }

    public PagedFile openFile(String path) throws IOException {
        return pagedFileManager.openFile(path);
    }

    public void closeFile(PagedFile file) throws IOException {
        pagedFileManager.closeFile(file);
    }

    public void destroyFile(String path) throws IOException {
        pagedFileManager.destroyFile(path);
    }

    /**
     * Inserts a record into the first page with room for it.
     *
     * @param file The open file
     * @param record The record bytes
     * @return The id of the new record
     * @throws IOException If a page cannot be fixed, read or allocated
     */
    public RecordId insertRecord(PagedFile file, byte[] record) throws IOException {
        int maxLength = getMaxRecordLength();
        if (record == null || record.length == 0 || record.length > maxLength) {
            throw new IllegalArgumentException("Record length must be between 1 and " + maxLength
                    + " bytes, got " + (record == null ? "null" : String.valueOf(record.length)));
        }

        for (int pageNumber = 0; ; pageNumber++) {
            BufferFrame frame;
            try {
                frame = pagedFileManager.getThisPage(file, pageNumber);
            } catch (PagedFileException e) {
                if (e.getError() != PagedFileError.INVALID_PAGE) {
                    throw e;
                }
                return insertIntoNewPage(file, record);
            }

            int slot = -1;
            try {
                SlottedPageLayout layout = new SlottedPageLayout(frame);
                layout.ensureInitialized();
                slot = layout.insertRecord(record);
            } finally {
                pagedFileManager.unfixPage(file, pageNumber, slot >= 0);
            }

            if (slot >= 0) {
                logger.debug("Inserted {} byte record at ({},{})", record.length, pageNumber, slot);
                return new RecordId(pageNumber, slot);
            }
        }
    }

    /**
     * Tombstones a record.
     *
     * @param file The open file
     * @param recordId The record to delete
     * @throws RecordException If the slot does not exist or is already deleted
     * @throws IOException If the page cannot be fixed
     */
    public void deleteRecord(PagedFile file, RecordId recordId) throws IOException {
        pagedFileManager.withPage(file, recordId.getPageNumber(), true, frame -> {
            SlottedPageLayout layout = liveSlot(frame, recordId);
            layout.deleteRecord(recordId.getSlot());
            return null;
        });
        logger.debug("Deleted record {}", recordId);
    }

    /**
     * Reads a single record.
     *
     * @param file The open file
     * @param recordId The record to read
     * @return A copy of the record bytes
     * @throws RecordException If the slot does not exist or is deleted
     * @throws IOException If the page cannot be fixed
     */
    public byte[] getRecord(PagedFile file, RecordId recordId) throws IOException {
        return pagedFileManager.withPage(file, recordId.getPageNumber(), false,
                frame -> liveSlot(frame, recordId).getRecord(recordId.getSlot()));
    }

    /**
     * Opens a scan positioned before the first record of page 0.
     *
     * @param file The open file
     * @return The scan
     */
    public RecordScan openScan(PagedFile file) {
        if (!pagedFileManager.getOpenFiles().contains(file)) {
            throw new IllegalArgumentException("File " + file + " is not open");
        }
        return new RecordScan(pagedFileManager, file);
    }

    /**
     * Walks every page of the file and measures how much of it is used.
     *
     * @param file The open file
     * @return The space report
     * @throws IOException If a page cannot be read
     */
    public SpaceReport measureSpace(PagedFile file) throws IOException {
        List<Integer> usedBytes = new ArrayList<>();
        int[] liveRecords = new int[1];
        long[] liveBytes = new long[1];

        for (int pageNumber = 0; ; pageNumber++) {
            try {
                int used = pagedFileManager.withPage(file, pageNumber, false, frame -> {
                    SlottedPageLayout layout = new SlottedPageLayout(frame);
                    liveRecords[0] += layout.getLiveRecordCount();
                    liveBytes[0] += layout.getLiveRecordBytes();
                    return layout.getUsedBytes();
                });
                usedBytes.add(used);
            } catch (PagedFileException e) {
                if (e.getError() == PagedFileError.INVALID_PAGE) {
                    break;
                }
                throw e;
            }
        }

        return new SpaceReport(pagedFileManager.getPageSize(), usedBytes, liveRecords[0], liveBytes[0]);
    }

    public int getMaxRecordLength() {
        return SlottedPageLayout.maxRecordLength(pagedFileManager.getPageSize());
    }

    private RecordId insertIntoNewPage(PagedFile file, byte[] record) throws IOException {
        BufferFrame frame = pagedFileManager.allocatePage(file);
        int pageNumber = frame.getPageId().getPageNumber();

        int slot;
        try {
            SlottedPageLayout layout = new SlottedPageLayout(frame);
            layout.initialize();
            slot = layout.insertRecord(record);
        } finally {
            pagedFileManager.unfixPage(file, pageNumber, true);
        }

        logger.debug("Allocated page {} of file {} for a {} byte record", pageNumber, file.getFileId(), record.length);
        return new RecordId(pageNumber, slot);
    }

    private static SlottedPageLayout liveSlot(BufferFrame frame, RecordId recordId) throws RecordException {
        SlottedPageLayout layout = new SlottedPageLayout(frame);
        if (!layout.isValidSlot(recordId.getSlot())) {
            throw new RecordException(RecordException.Reason.INVALID_SLOT, recordId);
        }
        if (!layout.isLive(recordId.getSlot())) {
            throw new RecordException(RecordException.Reason.RECORD_DELETED, recordId);
        }
        return layout;
    }
}

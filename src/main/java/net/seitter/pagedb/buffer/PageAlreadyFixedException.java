package net.seitter.pagedb.buffer;

import net.seitter.pagedb.storage.PageId;
import net.seitter.pagedb.storage.PagedFileError;
import net.seitter.pagedb.storage.PagedFileException;

/**
 * Thrown when a page that is already fixed is requested again.
 * The resident frame is attached so the caller can inspect it; this is not a second pin.
 */
public class PageAlreadyFixedException extends PagedFileException {
    private static final long serialVersionUID = 1L;

    private final transient BufferFrame frame;

    public PageAlreadyFixedException(PageId pageId, BufferFrame frame) {
        super(PagedFileError.PAGE_ALREADY_FIXED, pageId);
        this.frame = frame;
    }

    /**
     * Gets the frame holding the already fixed page.
     *
     * @return The resident frame
     */
    public BufferFrame getFrame() {
        return frame;
    }
}

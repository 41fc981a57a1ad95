package net.seitter.pagedb.storage;

import java.io.IOException;

/**
 * Signals a failure of the paged-file or buffer pool layer.
 * Carries the error code and, when the failure concerns a single page, its identity.
 */
public class PagedFileException extends IOException {
    private static final long serialVersionUID = 1L;

    private final PagedFileError error;
    private final PageId pageId;

    public PagedFileException(PagedFileError error, PageId pageId) {
        super(pageId == null ? error.getDescription() : error.getDescription() + " (" + pageId + ")");
        this.error = error;
        this.pageId = pageId;
    }

    public PagedFileException(PagedFileError error, String detail) {
        super(error.getDescription() + ": " + detail);
        this.error = error;
        this.pageId = null;
    }

    /**
     * Gets the error code.
     *
     * @return The error code
     */
    public PagedFileError getError() {
        return error;
    }

    /**
     * Gets the page the failure concerns.
     *
     * @return The page identity, or null if the failure is not about a single page
     */
    public PageId getPageId() {
        return pageId;
    }
}

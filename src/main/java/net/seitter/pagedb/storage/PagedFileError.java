package net.seitter.pagedb.storage;

/**
 * Error codes reported by the paged-file and buffer pool layers.
 */
public enum PagedFileError {
    NO_MEMORY("no memory left to grow the buffer pool"),
    NO_BUFFER_SPACE("no buffer space, every resident page is fixed"),
    PAGE_FIXED("page is fixed in the buffer"),
    PAGE_ALREADY_FIXED("page is already fixed in the buffer"),
    PAGE_NOT_FIXED("page is not fixed in the buffer"),
    PAGE_NOT_IN_BUFFER("page is not in the buffer"),
    PAGE_ALREADY_IN_BUFFER("page is already in the buffer"),
    INVALID_PAGE("invalid page number"),
    FILE_EXISTS("file already exists"),
    FILE_NOT_FOUND("file not found"),
    FILE_OPEN("file is open");

    private final String description;

    PagedFileError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}

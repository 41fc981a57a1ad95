package net.seitter.pagedb.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

/**
 * A file of fixed-size pages on disk.
 * Page N lives at byte offset N * pageSize; there is no file header.
 */
public class PagedFile implements RawPageStore {
    private static final Logger logger = LoggerFactory.getLogger(PagedFile.class);

    private final int fileId;
    private final String path;
    private final int pageSize;
    private final RandomAccessFile file;
    private final FileChannel channel;

    /**
     * Opens an existing paged file.
     *
     * @param fileId The process-unique id assigned to this open file
     * @param path The file path
     * @param pageSize The size of each page in bytes
     * @throws IOException If there's an error accessing the file
     */
    public PagedFile(int fileId, String path, int pageSize) throws IOException {
        this.fileId = fileId;
        this.path = path;
        this.pageSize = pageSize;

        File pagedFile = new File(path);
        if (!pagedFile.exists()) {
            throw new PagedFileException(PagedFileError.FILE_NOT_FOUND, path);
        }

        this.file = new RandomAccessFile(pagedFile, "rw");
        this.channel = file.getChannel();

        if (file.length() % pageSize != 0) {
            logger.warn("File {} has a trailing partial page ({} bytes), it will be ignored",
                    path, file.length() % pageSize);
        }

        logger.debug("Opened paged file {} as file {} with {} pages", path, fileId, getTotalPages());
    }

    @Override
    public int getFileId() {
        return fileId;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    /**
     * Gets the file path.
     *
     * @return The path
     */
    public String getPath() {
        return path;
    }

    @Override
    public void readPage(int pageNumber, byte[] buffer) throws IOException {
        checkPageNumber(pageNumber);

        ByteBuffer target = ByteBuffer.wrap(buffer, 0, pageSize);
        long offset = (long) pageNumber * pageSize;
        while (target.hasRemaining()) {
            int bytesRead = channel.read(target, offset + target.position());
            if (bytesRead < 0) {
                throw new IOException("Unexpected end of file reading page " + pageNumber + " of " + path);
            }
        }
    }

    @Override
    public void writePage(int pageNumber, byte[] buffer) throws IOException {
        checkPageNumber(pageNumber);
        writeAt(pageNumber, buffer);
    }

    @Override
    public int allocatePage() throws IOException {
        int pageNumber = getTotalPages();
        writeAt(pageNumber, new byte[pageSize]);
        logger.debug("Allocated page {} at end of {}", pageNumber, path);
        return pageNumber;
    }

    @Override
    public int getTotalPages() throws IOException {
        return (int) (file.length() / pageSize);
    }

    private void checkPageNumber(int pageNumber) throws IOException {
        if (pageNumber < 0 || pageNumber >= getTotalPages()) {
            throw new PagedFileException(PagedFileError.INVALID_PAGE, new PageId(fileId, pageNumber));
        }
    }

    private void writeAt(int pageNumber, byte[] buffer) throws IOException {
        ByteBuffer source = ByteBuffer.wrap(buffer, 0, pageSize);
        long offset = (long) pageNumber * pageSize;
        while (source.hasRemaining()) {
            channel.write(source, offset + source.position());
        }
        channel.force(false);
    }

    @Override
    public void close() {
        try {
            if (channel.isOpen()) {
                channel.force(true);
                channel.close();
            }
            file.close();
            logger.debug("Closed paged file {}", path);
        } catch (IOException e) {
            logger.error("Error closing paged file {}", path, e);
        }
    }

    @Override
    public String toString() {
        return "PagedFile{" + fileId + ", " + path + "}";
    }
}

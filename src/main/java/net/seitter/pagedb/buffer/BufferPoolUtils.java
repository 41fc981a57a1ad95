package net.seitter.pagedb.buffer;

import net.seitter.pagedb.storage.RawPageStore;

import java.io.IOException;

/**
 * Utility methods for working with the buffer pool in a safe way.
 * These methods ensure pages are unfixed in all code paths.
 */
public final class BufferPoolUtils {

    private BufferPoolUtils() {
    }

    /**
     * Functional interface for operations on a fixed page.
     *
     * @param <T> The return type of the operation
     */
    @FunctionalInterface
    public interface PageOperation<T> {
        /**
         * Executes an operation on a fixed page.
         *
         * @param frame The frame holding the page
         * @return The result of the operation
         * @throws IOException If an I/O error occurs
         */
        T execute(BufferFrame frame) throws IOException;
    }

    /**
     * Fixes a page, performs an operation on it and unfixes it again, whether the
     * operation succeeds or throws. The page is unfixed dirty only if the operation
     * completed and {@code markDirty} is set.
     *
     * @param <T> The return type of the operation
     * @param bufferPool The buffer pool to use
     * @param file The open file
     * @param pageNumber The page to operate on
     * @param markDirty Whether a completed operation modified the page
     * @param operation The operation to perform on the page
     * @return The result of the operation
     * @throws IOException If the page cannot be fixed or the operation fails
     */
    public static <T> T withPage(IBufferPoolManager bufferPool, RawPageStore file, int pageNumber,
                                 boolean markDirty, PageOperation<T> operation) throws IOException {
        BufferFrame frame = bufferPool.getPage(file, pageNumber);
        T result;
        try {
            result = operation.execute(frame);
        } catch (Throwable t) {
            // Unfix clean; an unfix failure must not hide the original one
            try {
                bufferPool.unfixPage(file, pageNumber, false);
            } catch (IOException | RuntimeException unfixFailure) {
                t.addSuppressed(unfixFailure);
            }
            throw t;
        }
        bufferPool.unfixPage(file, pageNumber, markDirty);
        return result;
    }
}

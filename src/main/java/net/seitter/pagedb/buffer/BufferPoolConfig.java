package net.seitter.pagedb.buffer;

/**
 * Configuration for the buffer pool.
 */
public class BufferPoolConfig {
    /** Upper bound accepted for the number of buffer frames. */
    public static final int MAX_BUFFERS = 4096;
    /** Default number of buffer frames. */
    public static final int DEFAULT_MAX_BUFFERS = 20;

    private final int maxBuffers;
    private final ReplacementPolicy policy;

    /**
     * Creates a new buffer pool configuration.
     *
     * @param maxBuffers The maximum number of buffer frames, between 1 and {@link #MAX_BUFFERS}
     * @param policy The replacement policy
     */
    public BufferPoolConfig(int maxBuffers, ReplacementPolicy policy) {
        if (maxBuffers <= 0 || maxBuffers > MAX_BUFFERS) {
            throw new IllegalArgumentException("Buffer count must be between 1 and " + MAX_BUFFERS
                    + ", got " + maxBuffers);
        }
        if (policy == null) {
            throw new IllegalArgumentException("Replacement policy cannot be null");
        }
        this.maxBuffers = maxBuffers;
        this.policy = policy;
    }

    /**
     * Gets the maximum number of buffer frames.
     *
     * @return The maximum number of frames
     */
    public int getMaxBuffers() {
        return maxBuffers;
    }

    /**
     * Gets the replacement policy.
     *
     * @return The replacement policy
     */
    public ReplacementPolicy getPolicy() {
        return policy;
    }

    /**
     * Gets the default buffer pool configuration.
     *
     * @return The default configuration
     */
    public static BufferPoolConfig getDefault() {
        return new BufferPoolConfig(DEFAULT_MAX_BUFFERS, ReplacementPolicy.LRU);
    }

    @Override
    public String toString() {
        return "BufferPoolConfig{maxBuffers=" + maxBuffers + ", policy=" + policy + "}";
    }
}

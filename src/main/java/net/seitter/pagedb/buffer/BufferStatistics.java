package net.seitter.pagedb.buffer;

/**
 * Point-in-time copy of the buffer pool counters.
 */
public class BufferStatistics {
    private final long logicalReads;
    private final long logicalWrites;
    private final long physicalReads;
    private final long physicalWrites;
    private final long pageHits;
    private final long pageMisses;

    public BufferStatistics(long logicalReads, long logicalWrites, long physicalReads,
                            long physicalWrites, long pageHits, long pageMisses) {
        this.logicalReads = logicalReads;
        this.logicalWrites = logicalWrites;
        this.physicalReads = physicalReads;
        this.physicalWrites = physicalWrites;
        this.pageHits = pageHits;
        this.pageMisses = pageMisses;
    }

    public long getLogicalReads() {
        return logicalReads;
    }

    public long getLogicalWrites() {
        return logicalWrites;
    }

    public long getPhysicalReads() {
        return physicalReads;
    }

    public long getPhysicalWrites() {
        return physicalWrites;
    }

    public long getPageHits() {
        return pageHits;
    }

    public long getPageMisses() {
        return pageMisses;
    }

    /**
     * Gets the percentage of page requests served from the buffer.
     *
     * @return The hit ratio in percent, 0 if there were no requests
     */
    public double getHitRatio() {
        long total = pageHits + pageMisses;
        return total > 0 ? (double) pageHits / total * 100.0 : 0.0;
    }

    @Override
    public String toString() {
        return "BufferStatistics{" +
                "logicalReads=" + logicalReads +
                ", logicalWrites=" + logicalWrites +
                ", physicalReads=" + physicalReads +
                ", physicalWrites=" + physicalWrites +
                ", pageHits=" + pageHits +
                ", pageMisses=" + pageMisses +
                '}';
    }
}

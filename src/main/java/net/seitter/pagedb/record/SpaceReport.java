package net.seitter.pagedb.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Space utilization of a slotted file at the time it was measured.
 */
public class SpaceReport {
    private final int pageSize;
    private final List<Integer> usedBytesPerPage;
    private final int liveRecordCount;
    private final long liveRecordBytes;

    public SpaceReport(int pageSize, List<Integer> usedBytesPerPage, int liveRecordCount, long liveRecordBytes) {
        this.pageSize = pageSize;
        this.usedBytesPerPage = Collections.unmodifiableList(new ArrayList<>(usedBytesPerPage));
        this.liveRecordCount = liveRecordCount;
        this.liveRecordBytes = liveRecordBytes;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getPageCount() {
        return usedBytesPerPage.size();
    }

    public List<Integer> getUsedBytesPerPage() {
        return usedBytesPerPage;
    }

    public long getTotalUsedBytes() {
        long total = 0;
        for (int used : usedBytesPerPage) {
            total += used;
        }
        return total;
    }

    /**
     * Gets the used fraction of all pages, header, tombstones and slot directory included.
     *
     * @return The utilization between 0 and 1, or 0 for a file without pages
     */
    public double getAverageUtilization() {
        if (usedBytesPerPage.isEmpty()) {
            return 0.0;
        }
        return (double) getTotalUsedBytes() / ((long) usedBytesPerPage.size() * pageSize);
    }

    public int getLiveRecordCount() {
        return liveRecordCount;
    }

    public long getLiveRecordBytes() {
        return liveRecordBytes;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Pages used: %d, total used bytes: %d, avg util per page: %.2f%%",
                getPageCount(), getTotalUsedBytes(), 100.0 * getAverageUtilization());
    }
}

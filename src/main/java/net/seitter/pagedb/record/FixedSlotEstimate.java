package net.seitter.pagedb.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * What storing a set of records in fixed-size slots would cost, for comparison
 * with the slotted layout.
 */
public class FixedSlotEstimate {
    /** Slot sizes the comparison table covers. */
    public static final int[] SLOT_SIZES = {32, 64, 128, 256};

    private final int slotSize;
    private final int slotsPerPage;
    private final int oversizedRecords;
    private final int pagesNeeded;
    private final double utilization;

    private FixedSlotEstimate(int slotSize, int slotsPerPage, int oversizedRecords, int pagesNeeded, double utilization) {
        this.slotSize = slotSize;
        this.slotsPerPage = slotsPerPage;
        this.oversizedRecords = oversizedRecords;
        this.pagesNeeded = pagesNeeded;
        this.utilization = utilization;
    }

    /**
     * Estimates the fixed-slot layout for one slot size.
     *
     * @param recordLengths The lengths of all records
     * @param pageSize The page size in bytes
     * @param slotSize The fixed slot size in bytes
     * @return The estimate
     */
    public static FixedSlotEstimate estimate(int[] recordLengths, int pageSize, int slotSize) {
        int slotsPerPage = pageSize / slotSize;
        if (slotsPerPage <= 0) {
            return new FixedSlotEstimate(slotSize, slotsPerPage, 0, -1, 0.0);
        }

        int oversized = 0;
        long totalBytes = 0;
        for (int length : recordLengths) {
            if (length > slotSize) {
                oversized++;
            }
            totalBytes += length;
        }
        if (oversized > 0) {
            return new FixedSlotEstimate(slotSize, slotsPerPage, oversized, -1, 0.0);
        }

        int pagesNeeded = (recordLengths.length + slotsPerPage - 1) / slotsPerPage;
        double utilization = pagesNeeded == 0 ? 0.0 : (double) totalBytes / ((long) pagesNeeded * pageSize);
        return new FixedSlotEstimate(slotSize, slotsPerPage, 0, pagesNeeded, utilization);
    }

    /**
     * Estimates the fixed-slot layout for every size in {@link #SLOT_SIZES}.
     *
     * @param recordLengths The lengths of all records
     * @param pageSize The page size in bytes
     * @return One estimate per slot size, smallest first
     */
    public static List<FixedSlotEstimate> compare(int[] recordLengths, int pageSize) {
        List<FixedSlotEstimate> estimates = new ArrayList<>();
        for (int slotSize : SLOT_SIZES) {
            estimates.add(estimate(recordLengths, pageSize, slotSize));
        }
        return estimates;
    }

    public int getSlotSize() {
        return slotSize;
    }

    public int getSlotsPerPage() {
        return slotsPerPage;
    }

    public int getOversizedRecords() {
        return oversizedRecords;
    }

    /**
     * @return The pages needed, or -1 when the layout is inapplicable
     */
    public int getPagesNeeded() {
        return pagesNeeded;
    }

    public double getUtilization() {
        return utilization;
    }

    public boolean isApplicable() {
        return pagesNeeded >= 0;
    }

    @Override
    public String toString() {
        if (slotsPerPage <= 0) {
            return slotSize + "\t" + slotsPerPage + "\t-\t-\tslot too large";
        }
        if (oversizedRecords > 0) {
            return slotSize + "\t" + slotsPerPage + "\t-\t-\tinapplicable: "
                    + oversizedRecords + " records exceed slot size";
        }
        return String.format(Locale.ROOT, "%d\t%d\t%d\t%.2f\t-", slotSize, slotsPerPage, pagesNeeded, utilization * 100.0);
    }
}

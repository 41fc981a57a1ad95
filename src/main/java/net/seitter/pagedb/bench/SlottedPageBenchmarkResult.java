package net.seitter.pagedb.bench;

import net.seitter.pagedb.record.FixedSlotEstimate;
import net.seitter.pagedb.record.SpaceReport;

import java.io.PrintWriter;
import java.util.List;

/**
 * Outcome of a slotted page benchmark run.
 */
public class SlottedPageBenchmarkResult {
    private final int insertedRecords;
    private final int scannedRecords;
    private final int deletedRecords;
    private final int[] recordLengths;
    private final SpaceReport spaceReport;
    private final List<FixedSlotEstimate> fixedSlotEstimates;

    public SlottedPageBenchmarkResult(int insertedRecords, int scannedRecords, int deletedRecords,
                                      int[] recordLengths, SpaceReport spaceReport,
                                      List<FixedSlotEstimate> fixedSlotEstimates) {
        this.insertedRecords = insertedRecords;
        this.scannedRecords = scannedRecords;
        this.deletedRecords = deletedRecords;
        this.recordLengths = recordLengths.clone();
        this.spaceReport = spaceReport;
        this.fixedSlotEstimates = List.copyOf(fixedSlotEstimates);
    }

    public int getInsertedRecords() {
        return insertedRecords;
    }

    public int getScannedRecords() {
        return scannedRecords;
    }

    public int getDeletedRecords() {
        return deletedRecords;
    }

    /**
     * Gets the sum of the lengths of every inserted record, deleted ones included.
     *
     * @return The total user bytes
     */
    public long getTotalUserBytes() {
        long total = 0;
        for (int length : recordLengths) {
            total += length;
        }
        return total;
    }

    public int[] getRecordLengths() {
        return recordLengths.clone();
    }

    public SpaceReport getSpaceReport() {
        return spaceReport;
    }

    public List<FixedSlotEstimate> getFixedSlotEstimates() {
        return fixedSlotEstimates;
    }

    /**
     * Prints the run in the layout of the classic slotted page test driver.
     *
     * @param out The destination
     */
    public void print(PrintWriter out) {
        out.printf("Inserted %d records; scanned %d records%n", insertedRecords, scannedRecords);
        out.println(spaceReport);
        out.printf("Total user bytes (sum of record lengths): %d%n", getTotalUserBytes());
        out.println();
        out.println("Static fixed-slot comparison (M = slot size in bytes)");
        out.println("M\tslots/page\tpages_needed\tutilization(%)\tnotes");
        for (FixedSlotEstimate estimate : fixedSlotEstimates) {
            out.println(estimate);
        }
        out.flush();
    }
}

package net.seitter.pagedb.record;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class FixedSlotEstimateTest {

    @Test
    public void testAllSlotSizesApplicable() {
        List<FixedSlotEstimate> estimates = FixedSlotEstimate.compare(new int[] {10, 20, 30}, 4096);

        assertEquals(4, estimates.size());
        FixedSlotEstimate smallest = estimates.get(0);
        assertEquals(32, smallest.getSlotSize());
        assertEquals(128, smallest.getSlotsPerPage());
        assertEquals(1, smallest.getPagesNeeded());
        assertEquals(60.0 / 4096, smallest.getUtilization(), 1e-9);
        assertTrue(smallest.isApplicable());
        assertEquals(256, estimates.get(3).getSlotSize());
        assertEquals(16, estimates.get(3).getSlotsPerPage());
    }

    @Test
    public void testOversizedRecordsMakeSlotSizeInapplicable() {
        List<FixedSlotEstimate> estimates = FixedSlotEstimate.compare(new int[] {40, 100, 70}, 4096);

        FixedSlotEstimate slot32 = estimates.get(0);
        assertFalse(slot32.isApplicable());
        assertEquals(3, slot32.getOversizedRecords());
        assertTrue(slot32.toString().contains("inapplicable: 3 records exceed slot size"));

        FixedSlotEstimate slot64 = estimates.get(1);
        assertEquals(2, slot64.getOversizedRecords());
        assertEquals(-1, slot64.getPagesNeeded());

        assertTrue(estimates.get(2).isApplicable());
        assertEquals(1, estimates.get(2).getPagesNeeded());
    }

    @Test
    public void testPagesNeededRoundsUp() {
        int[] lengths = new int[300];
        Arrays.fill(lengths, 200);

        FixedSlotEstimate estimate = FixedSlotEstimate.estimate(lengths, 4096, 256);

        assertEquals(16, estimate.getSlotsPerPage());
        assertEquals(19, estimate.getPagesNeeded());
        assertEquals(60000.0 / (19 * 4096), estimate.getUtilization(), 1e-9);
    }

    @Test
    public void testSlotLargerThanPage() {
        FixedSlotEstimate estimate = FixedSlotEstimate.estimate(new int[] {1}, 128, 256);

        assertEquals(0, estimate.getSlotsPerPage());
        assertFalse(estimate.isApplicable());
        assertTrue(estimate.toString().endsWith("slot too large"));
    }
}

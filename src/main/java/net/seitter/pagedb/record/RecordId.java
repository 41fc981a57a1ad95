package net.seitter.pagedb.record;

import java.util.Objects;

/**
 * Identifies a record by the page holding it and its slot on that page.
 * A record keeps its id for as long as it lives; deleting other records never renumbers slots.
 */
public class RecordId {
    private final int pageNumber;
    private final int slot;

    public RecordId(int pageNumber, int slot) {
        this.pageNumber = pageNumber;
        this.slot = slot;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public int getSlot() {
        return slot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordId recordId = (RecordId) o;
        return pageNumber == recordId.pageNumber && slot == recordId.slot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageNumber, slot);
    }

    @Override
    public String toString() {
        return "(" + pageNumber + "," + slot + ")";
    }
}

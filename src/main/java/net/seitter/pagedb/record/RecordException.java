package net.seitter.pagedb.record;

import java.io.IOException;

/**
 * Signals an operation on a record id that does not name a live record.
 */
public class RecordException extends IOException {
    private static final long serialVersionUID = 1L;

    /**
     * Why the record id was rejected.
     */
    public enum Reason {
        /** The slot number is outside the page's slot directory. */
        INVALID_SLOT,
        /** The slot is a tombstone. */
        RECORD_DELETED
    }

    private final Reason reason;
    private final RecordId recordId;

    public RecordException(Reason reason, RecordId recordId) {
        super((reason == Reason.INVALID_SLOT ? "No such slot " : "Record already deleted ") + recordId);
        this.reason = reason;
        this.recordId = recordId;
    }

    public Reason getReason() {
        return reason;
    }

    public RecordId getRecordId() {
        return recordId;
    }
}

package net.seitter.pagedb.record;

/**
 * A record returned by a scan: a private copy of its bytes and its record id.
 */
public class ScannedRecord {
    private final RecordId recordId;
    private final byte[] data;

    public ScannedRecord(RecordId recordId, byte[] data) {
        this.recordId = recordId;
        this.data = data;
    }

    public RecordId getRecordId() {
        return recordId;
    }

    public byte[] getData() {
        return data;
    }

    public int getLength() {
        return data.length;
    }
}

package com.github.dimitryivaniuta.edgeguard.sync;

public record SyncOutcome(Status status, String storedDocument) {

    public enum Status {
        /** Written: first upload, newer timestamp, or the stored copy was unusable. */
        STORED,
        /** Same timestamp as the stored copy, nothing written. */
        NOT_MODIFIED,
        /** Client is behind; {@link #storedDocument()} carries the newer server copy. */
        CONFLICT
    }

    static SyncOutcome stored() {
        return new SyncOutcome(Status.STORED, null);
    }

    static SyncOutcome notModified() {
        return new SyncOutcome(Status.NOT_MODIFIED, null);
    }

    static SyncOutcome conflict(String storedDocument) {
        return new SyncOutcome(Status.CONFLICT, storedDocument);
    }
}

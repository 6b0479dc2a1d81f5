package com.nchat.connectors.sync;

/** How a {@link SyncConflict} was settled. */
public enum ConflictResolution {
    /** Keep the data from the side that produced the change. */
    SOURCE_WINS("source_wins"),
    /** Keep the data already on the receiving side. */
    TARGET_WINS("target_wins"),
    /** Keep whichever side has the later {@code updatedAt}; ties go to the source. */
    LATEST_WINS("latest_wins"),
    /** A person decides; no data is picked automatically. */
    MANUAL("manual");

    private final String wireName;

    ConflictResolution(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}

package com.nchat.connectors.sync;

/** Point-in-time counters across a whole {@link SyncEngine}. */
public final class SyncSummary {

    private final int  queueSize;
    private final int  pending;
    private final int  processing;
    private final int  errors;
    private final long completed;
    private final int  conflicts;
    private final int  integrations;

    SyncSummary(int queueSize, int pending, int processing, int errors, long completed,
                int conflicts, int integrations) {
        this.queueSize    = queueSize;
        this.pending      = pending;
        this.processing   = processing;
        this.errors       = errors;
        this.completed    = completed;
        this.conflicts    = conflicts;
        this.integrations = integrations;
    }

    /** Items still tracked: pending, processing or parked in error. */
    public int  getQueueSize()    { return queueSize; }
    public int  getPending()      { return pending; }
    public int  getProcessing()   { return processing; }
    public int  getErrors()       { return errors; }
    /** Items completed since the engine was created. */
    public long getCompleted()    { return completed; }
    /** Unresolved conflicts. */
    public int  getConflicts()    { return conflicts; }
    /** Distinct integrations with tracked items. */
    public int  getIntegrations() { return integrations; }

    @Override
    public String toString() {
        return "SyncSummary{queue=" + queueSize + ", pending=" + pending + ", processing=" + processing +
               ", errors=" + errors + ", completed=" + completed + ", conflicts=" + conflicts +
               ", integrations=" + integrations + '}';
    }
}

package com.nchat.connectors.sync;

/**
 * Settings for {@link SyncEngine}.
 *
 * <pre>
 *   SyncEngineConfig config = SyncEngineConfig.builder()
 *       .maxQueueSize(5_000)
 *       .conflictPolicy(c -&gt; Optional.of(ConflictResolution.LATEST_WINS))
 *       .build();
 * </pre>
 */
public final class SyncEngineConfig {

    private final int              maxQueueSize;
    private final ConflictPolicy   conflictPolicy;
    private final SyncItemListener itemListener;

    private SyncEngineConfig(Builder b) {
        this.maxQueueSize   = b.maxQueueSize;
        this.conflictPolicy = b.conflictPolicy;
        this.itemListener   = b.itemListener;
    }

    public static SyncEngineConfig defaults() { return builder().build(); }

    public int              getMaxQueueSize()   { return maxQueueSize; }
    /** {@code null} leaves every conflict for manual resolution. */
    public ConflictPolicy   getConflictPolicy() { return conflictPolicy; }
    public SyncItemListener getItemListener()   { return itemListener; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int              maxQueueSize = 10_000;
        private ConflictPolicy   conflictPolicy;
        private SyncItemListener itemListener;

        public Builder maxQueueSize(int maxQueueSize)          { this.maxQueueSize = maxQueueSize; return this; }
        public Builder conflictPolicy(ConflictPolicy policy)   { this.conflictPolicy = policy; return this; }
        public Builder itemListener(SyncItemListener listener) { this.itemListener = listener; return this; }

        public SyncEngineConfig build() {
            if (maxQueueSize <= 0) {
                throw new IllegalArgumentException("maxQueueSize must be > 0, got: " + maxQueueSize);
            }
            return new SyncEngineConfig(this);
        }
    }
}

package com.nchat.connectors.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nchat.connectors.error.ConnectorException;
import com.nchat.connectors.error.ErrorCategory;
import com.nchat.connectors.error.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Queue of changes to push to or pull from external providers, with conflict
 * tracking and checksum-based delta detection.
 *
 * <h2>Queue</h2>
 * Pending items are served highest priority first, FIFO within a priority.
 * A completed item leaves the queue. A failed item goes back to pending until
 * it has used {@code maxRetries} attempts, or straight to {@code error} when
 * the failure classifies as not retryable.
 *
 * <h2>Threading</h2>
 * All bookkeeping is guarded by the engine's monitor. {@link #processQueue}
 * runs handlers outside the monitor, on the calling thread, and only one call
 * may run at a time.
 *
 * <pre>
 *   SyncEngine engine = new SyncEngine();
 *   engine.prepareDeltaSync("jira-1", "ticket", records, SyncDirection.OUTGOING);
 *   List&lt;SyncResult&gt; results = engine.processQueue(item -&gt;
 *       jira.withRetry(() -&gt; jira.getDelegate().push(item), "push"), 50);
 * </pre>
 */
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    /** Provider id reported on the engine's own {@link ConnectorException}s. */
    public static final String ENGINE_ID = "sync";

    static final String UPDATED_AT_FIELD = "updatedAt";
    static final String AUTO_RESOLVER    = "auto";
    static final String SYSTEM_RESOLVER  = "system";

    private static final List<Function<String, Instant>> TIMESTAMP_FORMATS = List.of(
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

    private static final Comparator<SyncItem> QUEUE_ORDER = Comparator
            .comparingInt(SyncItem::getPriority).reversed()
            .thenComparingLong(SyncItem::sequence);

    private final SyncEngineConfig config;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final PriorityBlockingQueue<SyncItem> pending = new PriorityBlockingQueue<>(64, QUEUE_ORDER);
    private final Map<String, SyncItem>     items     = new LinkedHashMap<>();
    private final Map<String, SyncConflict> conflicts = new LinkedHashMap<>();
    private final Map<String, SyncState>    states    = new LinkedHashMap<>();
    private final AtomicLong    sequence   = new AtomicLong();
    private final AtomicBoolean processing = new AtomicBoolean();
    private long completedTotal;

    public SyncEngine() {
        this(SyncEngineConfig.defaults());
    }

    public SyncEngine(SyncEngineConfig config) {
        this(config, Clock.systemUTC());
    }

    public SyncEngine(SyncEngineConfig config, Clock clock) {
        this.config = config;
        this.clock  = clock;
    }

    // ------------------------------------------------------------------
    // Queue
    // ------------------------------------------------------------------

    /**
     * Adds a change to the queue.
     *
     * @throws ConnectorException {@code rate_limit} (retryable) when the queue
     *         already holds {@code maxQueueSize} items
     */
    public synchronized SyncItem enqueue(SyncRequest request) throws ConnectorException {
        if (items.size() >= config.getMaxQueueSize()) {
            throw ConnectorException.builder(
                            "Sync queue is full (" + config.getMaxQueueSize() + " items)",
                            ErrorCategory.RATE_LIMIT, ENGINE_ID)
                    .detail("integrationId", request.getIntegrationId())
                    .build();
        }
        SyncItem item = new SyncItem(UUID.randomUUID().toString(), sequence.incrementAndGet(), request,
                clock.instant());
        items.put(item.getId(), item);
        pending.add(item);
        log.debug("Queued {}", item);
        return item;
    }

    /** Takes the next pending item and marks it {@code processing}. */
    public synchronized Optional<SyncItem> dequeue() {
        SyncItem item = pending.poll();
        if (item == null) {
            return Optional.empty();
        }
        item.startAttempt();
        return Optional.of(item);
    }

    /**
     * Records a successful item and drops it from the queue.
     *
     * @return {@code false} if the item is unknown
     */
    public synchronized boolean complete(String itemId) {
        SyncItem item = items.remove(itemId);
        if (item == null) {
            return false;
        }
        pending.remove(item);
        completedTotal++;
        Instant now = clock.instant();
        mergeState(item, b -> b.syncedCount(current(item).getSyncedCount() + 1).lastSyncAt(now));
        return true;
    }

    /**
     * Records a failed attempt. The item returns to pending while it has
     * attempts left, otherwise it is parked in {@code error}.
     *
     * @return {@code false} if the item is unknown
     */
    public synchronized boolean error(String itemId, String message) {
        return fail(itemId, message, true);
    }

    public synchronized Optional<SyncItem> getItem(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    /** Items still tracked: pending, processing or parked in error. */
    public synchronized int getQueueSize() {
        return items.size();
    }

    public synchronized int getPendingCount() {
        return count(item -> item.getStatus() == SyncItemStatus.PENDING);
    }

    public synchronized List<SyncItem> getItemsByStatus(SyncItemStatus status) {
        return select(item -> item.getStatus() == status);
    }

    public synchronized List<SyncItem> getItemsForIntegration(String integrationId) {
        return select(item -> item.getIntegrationId().equals(integrationId));
    }

    public synchronized void clearQueue() {
        items.clear();
        pending.clear();
    }

    /** @return the number of items removed */
    public synchronized int clearIntegrationQueue(String integrationId) {
        return removeWhere(item -> item.getIntegrationId().equals(integrationId));
    }

    // ------------------------------------------------------------------
    // Conflicts
    // ------------------------------------------------------------------

    /**
     * Compares both versions of an entity as JSON trees. Equal data is not a
     * conflict. Otherwise the conflict is recorded and offered to the
     * configured {@link ConflictPolicy}.
     */
    public synchronized Optional<SyncConflict> detectConflict(String integrationId, String entityType,
                                                              String entityId, Map<String, ?> sourceData,
                                                              Map<String, ?> targetData) {
        JsonNode source = mapper.valueToTree(sourceData);
        JsonNode target = mapper.valueToTree(targetData);
        if (source.equals(target)) {
            return Optional.empty();
        }
        SyncConflict conflict = new SyncConflict(UUID.randomUUID().toString(), integrationId, entityType,
                entityId, sourceData, targetData, clock.instant());
        ConflictPolicy policy = config.getConflictPolicy();
        if (policy != null) {
            Optional<ConflictResolution> automatic = Optional.empty();
            try {
                automatic = policy.resolve(conflict);
            } catch (RuntimeException e) {
                log.warn("Conflict policy failed on {}; leaving it open", conflict, e);
            }
            if (automatic.isPresent()) {
                conflict = conflict.resolve(automatic.get(), AUTO_RESOLVER, clock.instant());
            }
        }
        conflicts.put(conflict.getId(), conflict);
        log.info("Conflict on {}/{}/{} ({})", integrationId, entityType, entityId,
                conflict.isResolved() ? conflict.getResolution().wireName() : "open");
        return Optional.of(conflict);
    }

    public Optional<SyncConflict> resolveConflict(String conflictId, ConflictResolution resolution) {
        return resolveConflict(conflictId, resolution, SYSTEM_RESOLVER);
    }

    /** @return the resolved conflict, or empty if {@code conflictId} is unknown */
    public synchronized Optional<SyncConflict> resolveConflict(String conflictId, ConflictResolution resolution,
                                                               String resolvedBy) {
        SyncConflict conflict = conflicts.get(conflictId);
        if (conflict == null) {
            return Optional.empty();
        }
        SyncConflict resolved = conflict.resolve(resolution, resolvedBy, clock.instant());
        conflicts.put(conflictId, resolved);
        return Optional.of(resolved);
    }

    public synchronized Optional<SyncConflict> getConflict(String conflictId) {
        return Optional.ofNullable(conflicts.get(conflictId));
    }

    public synchronized List<SyncConflict> getUnresolvedConflicts() {
        return conflicts.values().stream().filter(c -> !c.isResolved()).toList();
    }

    public synchronized List<SyncConflict> getConflictsForIntegration(String integrationId) {
        return conflicts.values().stream().filter(c -> c.getIntegrationId().equals(integrationId)).toList();
    }

    /**
     * The data that wins under the conflict's resolution. Empty while the
     * conflict is open or when it is resolved {@link ConflictResolution#MANUAL manually}.
     */
    public Optional<Map<String, Object>> getResolvedData(SyncConflict conflict) {
        if (conflict.getResolution() == null) {
            return Optional.empty();
        }
        ConflictResolution resolution = conflict.getResolution();
        if (resolution == ConflictResolution.SOURCE_WINS) {
            return Optional.of(conflict.getSourceData());
        }
        if (resolution == ConflictResolution.TARGET_WINS) {
            return Optional.of(conflict.getTargetData());
        }
        if (resolution == ConflictResolution.LATEST_WINS) {
            boolean targetNewer = updatedAt(conflict.getTargetData()).isAfter(updatedAt(conflict.getSourceData()));
            return Optional.of(targetNewer ? conflict.getTargetData() : conflict.getSourceData());
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Delta and full sync
    // ------------------------------------------------------------------

    /**
     * SHA-256 hex of {@code data} serialised as JSON with keys sorted, so the
     * checksum does not depend on map ordering.
     */
    public String computeChecksum(Map<String, ?> data) {
        byte[] canonical;
        try {
            canonical = mapper.writeValueAsString(data).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Sync data is not serialisable as JSON", e);
        }
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** A missing previous checksum always counts as changed. */
    public boolean hasChanged(String previousChecksum, Map<String, ?> data) {
        return previousChecksum == null || !previousChecksum.equals(computeChecksum(data));
    }

    /**
     * Queues only the records whose data changed since their last sync:
     * {@code create} for records never synced, {@code update} for the rest.
     *
     * @return the queued items
     */
    public synchronized List<SyncItem> prepareDeltaSync(String integrationId, String entityType,
                                                        List<SyncRecord> records, SyncDirection direction)
            throws ConnectorException {
        List<SyncItem> queued = new ArrayList<>();
        for (SyncRecord record : records) {
            if (!hasChanged(record.getPreviousChecksum(), record.getData())) {
                continue;
            }
            SyncOperation operation = record.getPreviousChecksum() == null
                    ? SyncOperation.CREATE
                    : SyncOperation.UPDATE;
            queued.add(enqueue(request(integrationId, entityType, record, direction, operation)));
        }
        log.info("Delta sync {}/{}: {} of {} records changed", integrationId, entityType,
                queued.size(), records.size());
        return queued;
    }

    /**
     * Drops every tracked item for the integration and entity type, then
     * queues all {@code records} as updates.
     */
    public synchronized List<SyncItem> prepareFullResync(String integrationId, String entityType,
                                                         List<SyncRecord> records, SyncDirection direction)
            throws ConnectorException {
        int dropped = removeWhere(item -> item.getIntegrationId().equals(integrationId)
                && item.getEntityType().equals(entityType));
        List<SyncItem> queued = new ArrayList<>();
        for (SyncRecord record : records) {
            queued.add(enqueue(request(integrationId, entityType, record, direction, SyncOperation.UPDATE)));
        }
        log.info("Full resync {}/{}: dropped {}, queued {}", integrationId, entityType, dropped, queued.size());
        return queued;
    }

    // ------------------------------------------------------------------
    // Processing
    // ------------------------------------------------------------------

    /**
     * Handles up to {@code batchSize} pending items on the calling thread and
     * reports one {@link SyncResult} per integration, entity type and
     * direction, in the order first seen.
     *
     * @throws ConnectorException {@code rate_limit} (retryable) when another
     *         call is still processing
     */
    public List<SyncResult> processQueue(SyncItemHandler handler, int batchSize) throws ConnectorException {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + batchSize);
        }
        if (!processing.compareAndSet(false, true)) {
            throw ConnectorException.builder("Sync queue is already being processed",
                    ErrorCategory.RATE_LIMIT, ENGINE_ID).build();
        }
        long start = clock.millis();
        Map<String, Tally> tallies = new LinkedHashMap<>();
        List<SyncItem> batch = takeBatch(batchSize);
        int handled = 0;
        try {
            for (SyncItem item : batch) {
                Tally tally = tallies.computeIfAbsent(
                        item.getIntegrationId() + '|' + item.getEntityType() + '|' + item.getDirection(),
                        key -> new Tally(item));
                markSyncing(item);

                boolean success = false;
                try {
                    handler.handle(item);
                    complete(item.getId());
                    tally.count(item.getOperation());
                    success = true;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Sync batch interrupted; returning {} items to the queue", batch.size() - handled);
                    break;
                } catch (Exception e) {
                    ConnectorException failure = ErrorClassifier.classify(e, item.getIntegrationId());
                    fail(item.getId(), failure.getMessage(), failure.isRetryable());
                    tally.failed(failure.getMessage());
                    log.warn("Sync of {} failed ({}): {}", item, failure.getCategory().wireName(),
                            failure.getMessage());
                }
                handled++;
                notifyListener(item, success);
            }
        } finally {
            release(batch.subList(handled, batch.size()));
            finishStates(tallies.values());
            processing.set(false);
        }
        long elapsed = clock.millis() - start;
        List<SyncResult> results = tallies.values().stream().map(t -> t.toResult(elapsed)).toList();
        if (!results.isEmpty()) {
            log.info("Processed sync batch: {}", results);
        }
        return results;
    }

    public boolean isProcessing() {
        return processing.get();
    }

    // ------------------------------------------------------------------
    // State
    // ------------------------------------------------------------------

    /** Stored state for the pair, or an idle one if nothing was recorded yet. */
    public synchronized SyncState getSyncState(String integrationId, String entityType) {
        SyncState stored = states.get(stateKey(integrationId, entityType));
        SyncState.Builder builder = stored != null
                ? stored.toBuilder()
                : SyncState.builder(integrationId, entityType);
        return builder.pendingCount(pendingFor(integrationId, entityType)).build();
    }

    /** Applies {@code changes} to the pair's state, for example a new cursor. */
    public synchronized SyncState updateSyncState(String integrationId, String entityType,
                                                  Consumer<SyncState.Builder> changes) {
        SyncState.Builder builder = getSyncState(integrationId, entityType).toBuilder();
        changes.accept(builder);
        SyncState updated = builder.build();
        states.put(stateKey(integrationId, entityType), updated);
        return getSyncState(integrationId, entityType);
    }

    public synchronized List<SyncState> getAllSyncStates() {
        return states.values().stream()
                .map(s -> getSyncState(s.getIntegrationId(), s.getEntityType()))
                .toList();
    }

    public synchronized SyncSummary getSummary() {
        int integrations = (int) items.values().stream().map(SyncItem::getIntegrationId).distinct().count();
        return new SyncSummary(
                items.size(),
                getPendingCount(),
                count(item -> item.getStatus() == SyncItemStatus.PROCESSING),
                count(item -> item.getStatus() == SyncItemStatus.ERROR),
                completedTotal,
                getUnresolvedConflicts().size(),
                integrations);
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    /** Claims the whole batch up front so a requeued item waits for the next call. */
    private synchronized List<SyncItem> takeBatch(int batchSize) {
        List<SyncItem> batch = new ArrayList<>();
        Optional<SyncItem> next;
        while (batch.size() < batchSize && (next = dequeue()).isPresent()) {
            batch.add(next.get());
        }
        return batch;
    }

    /** Puts claimed but unhandled items back, without charging them an attempt. */
    private synchronized void release(List<SyncItem> unhandled) {
        for (SyncItem item : unhandled) {
            if (items.containsKey(item.getId()) && item.getStatus() == SyncItemStatus.PROCESSING) {
                item.release();
                pending.add(item);
            }
        }
    }

    private synchronized boolean fail(String itemId, String message, boolean retryable) {
        SyncItem item = items.get(itemId);
        if (item == null) {
            return false;
        }
        pending.remove(item);
        if (retryable && item.getAttempts() < item.getMaxRetries()) {
            item.requeue(message);
            pending.add(item);
            log.debug("Requeued {} after: {}", item, message);
        } else {
            item.park(message);
            mergeState(item, b -> b.errorCount(current(item).getErrorCount() + 1).lastError(message));
            log.warn("Gave up on {}: {}", item, message);
        }
        return true;
    }

    private synchronized void markSyncing(SyncItem item) {
        mergeState(item, b -> b.status(SyncStatus.SYNCING));
    }

    private synchronized void finishStates(Iterable<Tally> tallies) {
        for (Tally tally : tallies) {
            SyncStatus status = tally.errors > 0 ? SyncStatus.ERROR : SyncStatus.IDLE;
            SyncState state = getSyncState(tally.integrationId, tally.entityType);
            states.put(stateKey(tally.integrationId, tally.entityType), state.toBuilder().status(status).build());
        }
    }

    private void notifyListener(SyncItem item, boolean success) {
        SyncItemListener listener = config.getItemListener();
        if (listener == null) {
            return;
        }
        try {
            listener.onItemProcessed(item, success);
        } catch (RuntimeException e) {
            log.warn("Sync item listener failed on {}", item, e);
        }
    }

    private SyncState current(SyncItem item) {
        return getSyncState(item.getIntegrationId(), item.getEntityType());
    }

    private void mergeState(SyncItem item, Consumer<SyncState.Builder> changes) {
        SyncState.Builder builder = current(item).toBuilder();
        changes.accept(builder);
        states.put(stateKey(item.getIntegrationId(), item.getEntityType()), builder.build());
    }

    private int pendingFor(String integrationId, String entityType) {
        return count(item -> item.getStatus() == SyncItemStatus.PENDING
                && item.getIntegrationId().equals(integrationId)
                && item.getEntityType().equals(entityType));
    }

    private int removeWhere(Predicate<SyncItem> filter) {
        List<SyncItem> doomed = select(filter);
        for (SyncItem item : doomed) {
            items.remove(item.getId());
            pending.remove(item);
        }
        return doomed.size();
    }

    private List<SyncItem> select(Predicate<SyncItem> filter) {
        return items.values().stream().filter(filter).toList();
    }

    private int count(Predicate<SyncItem> filter) {
        return (int) items.values().stream().filter(filter).count();
    }

    private static SyncRequest request(String integrationId, String entityType, SyncRecord record,
                                       SyncDirection direction, SyncOperation operation) {
        return SyncRequest.builder(integrationId, entityType, record.getEntityId())
                .direction(direction)
                .operation(operation)
                .payload(record.getData())
                .build();
    }

    private static String stateKey(String integrationId, String entityType) {
        return integrationId + '|' + entityType;
    }

    /**
     * Reads {@code updatedAt} as an ISO-8601 instant, offset date-time, local
     * date-time or date (UTC), or epoch millis. Missing or unreadable values
     * sort first.
     */
    static Instant updatedAt(Map<String, Object> data) {
        Object value = data.get(UPDATED_AT_FIELD);
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            for (Function<String, Instant> format : TIMESTAMP_FORMATS) {
                try {
                    return format.apply(text);
                } catch (DateTimeParseException e) {
                    log.trace("'{}' does not match: {}", text, e.getMessage());
                }
            }
            log.debug("Unreadable {} '{}'", UPDATED_AT_FIELD, text);
        }
        return Instant.MIN;
    }

    private static final class Tally {
        final String integrationId;
        final String entityType;
        final SyncDirection direction;
        int created;
        int updated;
        int deleted;
        int errors;
        final List<String> messages = new ArrayList<>();

        Tally(SyncItem first) {
            this.integrationId = first.getIntegrationId();
            this.entityType = first.getEntityType();
            this.direction = first.getDirection();
        }

        void count(SyncOperation operation) {
            if (operation == SyncOperation.CREATE) {
                created++;
            } else if (operation == SyncOperation.DELETE) {
                deleted++;
            } else {
                updated++;
            }
        }

        void failed(String message) {
            errors++;
            messages.add(message);
        }

        SyncResult toResult(long durationMs) {
            return new SyncResult(integrationId, entityType, direction, created, updated, deleted, errors,
                    messages, durationMs);
        }
    }
}

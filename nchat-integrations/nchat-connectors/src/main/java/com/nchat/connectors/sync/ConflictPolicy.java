package com.nchat.connectors.sync;

import java.util.Optional;

/**
 * Picks a resolution for a freshly detected conflict. An empty result leaves
 * the conflict open for {@link SyncEngine#resolveConflict}.
 */
@FunctionalInterface
public interface ConflictPolicy {

    Optional<ConflictResolution> resolve(SyncConflict conflict);
}

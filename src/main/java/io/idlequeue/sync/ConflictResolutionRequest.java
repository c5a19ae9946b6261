package io.idlequeue.sync;

import io.idlequeue.model.ConflictType;
import io.idlequeue.model.ResolutionStrategy;

/**
 * A client's answer to a detected conflict. A null {@code resolution} falls back to the per-type default.
 */
public record ConflictResolutionRequest(
        String conflictId,
        ConflictType type,
        Object serverValue,
        Object clientValue,
        ResolutionStrategy resolution
) {
}

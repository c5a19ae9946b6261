package io.idlequeue.model;

import java.util.UUID;

public record Conflict(
        String conflictId,
        ConflictType type,
        Object serverValue,
        Object clientValue,
        ResolutionStrategy resolution
) {
    public static Conflict detected(ConflictType type, Object serverValue, Object clientValue, long nowMs) {
        String id = "conflict-" + nowMs + "-" + UUID.randomUUID().toString().substring(0, 8);
        return new Conflict(id, type, serverValue, clientValue, null);
    }
}

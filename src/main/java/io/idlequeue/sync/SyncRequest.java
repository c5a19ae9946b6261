package io.idlequeue.sync;

import java.util.Set;

/**
 * Client catch-up request. An empty category set asks for everything.
 */
public record SyncRequest(long lastSyncTimestamp, long queueVersion, Set<SyncCategory> requestedData) {
    public SyncRequest {
        requestedData = requestedData == null ? Set.of() : Set.copyOf(requestedData);
    }
}

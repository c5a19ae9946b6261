package io.idlequeue.sync;

import io.idlequeue.model.Notification;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.TaskProgress;
import io.idlequeue.model.TaskQueue;

import java.util.List;

/**
 * Snapshot sent back for a sync request. {@code queue} is null when the client already holds the server version.
 */
public record SyncResponse(
        TaskQueue queue,
        TaskProgress progress,
        PlayerCharacter character,
        List<Notification> notifications,
        long serverVersion,
        String checksum,
        boolean fullSync,
        long timestamp
) {
    public SyncResponse {
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }
}

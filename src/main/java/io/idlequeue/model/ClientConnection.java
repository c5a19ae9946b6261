package io.idlequeue.model;

public record ClientConnection(
        String connectionId,
        String playerId,
        long connectedAt,
        long lastPing,
        long lastHeartbeat,
        long queueVersion,
        boolean healthy
) {
    public static ClientConnection open(String connectionId, String playerId, long nowMs) {
        return new ClientConnection(connectionId, playerId, nowMs, nowMs, nowMs, 0L, true);
    }

    public long lastSeen() {
        return Math.max(lastPing, lastHeartbeat);
    }
}

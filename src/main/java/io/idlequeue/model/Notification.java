package io.idlequeue.model;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record Notification(
        NotificationType type,
        String playerId,
        String taskId,
        Map<String, Object> data,
        long timestamp,
        String messageId
) {
    public Notification {
        Objects.requireNonNull(type, "type");
        data = data == null ? Map.of() : data;
        messageId = messageId == null || messageId.isBlank() ? newMessageId(timestamp) : messageId;
    }

    public static Notification of(NotificationType type, String playerId, String taskId, Map<String, Object> data, long nowMs) {
        return new Notification(type, playerId, taskId, data, nowMs, null);
    }

    private static String newMessageId(long timestamp) {
        return "msg-" + timestamp + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}

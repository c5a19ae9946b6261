package io.idlequeue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    TASK_STARTED("task_started"),
    TASK_PROGRESS("task_progress"),
    TASK_COMPLETED("task_completed"),
    TASK_FAILED("task_failed"),
    QUEUE_UPDATED("queue_updated"),
    SYNC_REQUEST("sync_request"),
    SYNC_RESPONSE("sync_response"),
    DELTA_UPDATE("delta_update"),
    CONFLICT_RESOLUTION("conflict_resolution"),
    HEARTBEAT("heartbeat"),
    HEARTBEAT_RESPONSE("heartbeat_response");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static NotificationType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("NotificationType must not be blank");
        }
        String value = raw.trim();
        for (NotificationType candidate : values()) {
            if (candidate.wireName.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown NotificationType: " + raw);
    }
}

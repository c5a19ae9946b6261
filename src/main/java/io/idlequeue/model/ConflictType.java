package io.idlequeue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    TASK_MODIFIED("task_modified"),
    TASK_ADDED("task_added"),
    TASK_REMOVED("task_removed"),
    QUEUE_STATE_CHANGED("queue_state_changed");

    private final String wireName;

    ConflictType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ConflictType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("ConflictType must not be blank");
        }
        String value = raw.trim();
        for (ConflictType candidate : values()) {
            if (candidate.wireName.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConflictType: " + raw);
    }
}

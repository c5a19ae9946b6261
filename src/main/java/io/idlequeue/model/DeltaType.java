package io.idlequeue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeltaType {
    TASK_ADDED("task_added"),
    TASK_REMOVED("task_removed"),
    TASK_UPDATED("task_updated"),
    QUEUE_STATE_CHANGED("queue_state_changed"),
    TASK_PROGRESS("task_progress");

    private final String wireName;

    DeltaType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DeltaType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("DeltaType must not be blank");
        }
        String value = raw.trim();
        for (DeltaType candidate : values()) {
            if (candidate.wireName.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown DeltaType: " + raw);
    }
}

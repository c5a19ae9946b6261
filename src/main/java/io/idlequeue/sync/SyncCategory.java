package io.idlequeue.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum SyncCategory {
    QUEUE,
    PROGRESS,
    CHARACTER,
    NOTIFICATIONS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SyncCategory fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Sync category must not be blank");
        }
        for (SyncCategory value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown sync category: " + raw);
    }

    public static Set<SyncCategory> all() {
        return EnumSet.allOf(SyncCategory.class);
    }
}

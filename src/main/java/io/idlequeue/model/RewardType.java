package io.idlequeue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RewardType {
    EXPERIENCE("experience"),
    CURRENCY("currency"),
    RESOURCE("resource"),
    ITEM("item");

    private final String wireName;

    RewardType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resources and items land in the inventory; experience and currency are counters on the character.
     */
    public boolean isInventoryItem() {
        return this == RESOURCE || this == ITEM;
    }

    @JsonCreator
    public static RewardType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Reward type must not be blank");
        }
        for (RewardType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown reward type: " + raw);
    }
}

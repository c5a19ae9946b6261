package io.idlequeue.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResolutionStrategy {
    SERVER_WINS("server_wins"),
    CLIENT_WINS("client_wins"),
    MERGE("merge");

    private final String wireName;

    ResolutionStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ResolutionStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("ResolutionStrategy must not be blank");
        }
        String value = raw.trim();
        for (ResolutionStrategy candidate : values()) {
            if (candidate.wireName.equalsIgnoreCase(value) || candidate.name().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ResolutionStrategy: " + raw);
    }
}

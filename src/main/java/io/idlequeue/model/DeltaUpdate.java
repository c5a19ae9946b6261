package io.idlequeue.model;

import java.util.Map;

public record DeltaUpdate(
        DeltaType type,
        String playerId,
        String taskId,
        Map<String, Object> data,
        long timestamp,
        long version,
        String checksum
) {
    public DeltaUpdate {
        data = data == null ? Map.of() : data;
    }
}

package io.idlequeue.model;

import java.util.List;
import java.util.Objects;

public record HarvestingData(
        HarvestingActivity activity,
        List<EquippedTool> tools,
        HarvestingLocation location,
        int expectedYield
) implements ActivityData {
    public HarvestingData {
        Objects.requireNonNull(activity, "activity");
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    @Override
    public TaskType taskType() {
        return TaskType.HARVESTING;
    }
}

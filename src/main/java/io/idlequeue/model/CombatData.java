package io.idlequeue.model;

import java.util.List;
import java.util.Objects;

public record CombatData(
        Enemy enemy,
        int playerLevel,
        CombatStats playerStats,
        List<Equipment> equipment
) implements ActivityData {
    public CombatData {
        Objects.requireNonNull(enemy, "enemy");
        playerStats = playerStats == null ? CombatStats.zero() : playerStats;
        equipment = equipment == null ? List.of() : List.copyOf(equipment);
    }

    @Override
    public TaskType taskType() {
        return TaskType.COMBAT;
    }
}

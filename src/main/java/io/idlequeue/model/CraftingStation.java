package io.idlequeue.model;

import java.util.List;

public record CraftingStation(String stationId, String name, List<Bonus> bonuses, List<Prerequisite> requirements) {
    public CraftingStation {
        bonuses = bonuses == null ? List.of() : List.copyOf(bonuses);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }
}

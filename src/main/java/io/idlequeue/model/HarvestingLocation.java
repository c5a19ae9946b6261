package io.idlequeue.model;

import java.util.List;
import java.util.Map;

public record HarvestingLocation(
        String locationId,
        String name,
        Map<String, Double> bonusModifiers,
        List<Prerequisite> requirements
) {
    public HarvestingLocation {
        bonusModifiers = bonusModifiers == null ? Map.of() : Map.copyOf(bonusModifiers);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }

    public double bonus(String key) {
        Double value = bonusModifiers.get(key);
        return value == null ? 0.0d : value;
    }
}

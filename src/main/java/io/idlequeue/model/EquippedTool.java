package io.idlequeue.model;

import java.util.List;

public record EquippedTool(String toolId, String name, List<Bonus> bonuses, int durability) {
    public EquippedTool {
        bonuses = bonuses == null ? List.of() : List.copyOf(bonuses);
    }
}

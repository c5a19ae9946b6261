package io.idlequeue.model;

public record Equipment(String itemId, String slot, CombatStats stats, int durability) {
    public Equipment {
        stats = stats == null ? CombatStats.zero() : stats;
    }

    public boolean broken() {
        return durability <= 0;
    }
}

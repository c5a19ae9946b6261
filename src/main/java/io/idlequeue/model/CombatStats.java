package io.idlequeue.model;

public record CombatStats(int attack, int defense) {
    public static CombatStats zero() {
        return new CombatStats(0, 0);
    }
}

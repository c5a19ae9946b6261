package io.idlequeue.model;

import java.util.List;

public record Enemy(String enemyId, String name, int level, List<DropEntry> lootTable) {
    public Enemy {
        lootTable = lootTable == null ? List.of() : List.copyOf(lootTable);
    }
}

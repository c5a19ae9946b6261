package io.idlequeue;

import io.idlequeue.config.IdleQueueConfig;
import io.idlequeue.model.Bonus;
import io.idlequeue.model.CharacterStats;
import io.idlequeue.model.CombatData;
import io.idlequeue.model.CombatStats;
import io.idlequeue.model.CraftingData;
import io.idlequeue.model.CurrentActivity;
import io.idlequeue.model.DropEntry;
import io.idlequeue.model.DropTable;
import io.idlequeue.model.Enemy;
import io.idlequeue.model.Equipment;
import io.idlequeue.model.EquippedTool;
import io.idlequeue.model.HarvestingActivity;
import io.idlequeue.model.HarvestingData;
import io.idlequeue.model.ItemStack;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.Recipe;
import io.idlequeue.model.Specialization;
import io.idlequeue.model.Task;
import io.idlequeue.storage.Database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import java.util.stream.Stream;

public final class Fixtures {
    private Fixtures() {
    }

    public static Database database(Path root) {
        Database database = new Database(IdleQueueConfig.fromRoot(root.toString()));
        database.init();
        return database;
    }

    public static HarvestingData harvesting() {
        DropTable drops = new DropTable(
                List.of(new DropEntry("copper_ore", 1, "common")),
                List.of(),
                List.of(),
                List.of(new DropEntry("gear_core", 1, "rare"))
        );
        return new HarvestingData(
                new HarvestingActivity("copper-vein", "Copper Vein", "metallurgical", drops),
                List.of(new EquippedTool("pick-1", "Brass Pickaxe", List.of(), 100)),
                null,
                2
        );
    }

    public static CraftingData crafting() {
        return new CraftingData(
                new Recipe("cog", "Clockwork Cog", 5),
                List.of(),
                null,
                10,
                List.of(new ItemStack("clockwork_cog", 2))
        );
    }

    public static CombatData combat(int enemyLevel, int playerLevel) {
        return new CombatData(
                new Enemy("automaton", "Rogue Automaton", enemyLevel, List.of(new DropEntry("scrap_plate", 1, "common"))),
                playerLevel,
                new CombatStats(5, 5),
                List.of(new Equipment("sword-1", "weapon", new CombatStats(5, 5), 50))
        );
    }

    public static Task harvestTask(String id, long durationMs) {
        return Task.create(id, "Mine " + id, durationMs, harvesting(), 3);
    }

    public static Task craftTask(String id, long durationMs) {
        return Task.create(id, "Craft " + id, durationMs, crafting(), 3);
    }

    public static Task combatTask(String id, long durationMs, int enemyLevel) {
        return Task.create(id, "Fight " + id, durationMs, combat(enemyLevel, 1), 3);
    }

    public static PlayerCharacter character(String userId, int level) {
        return new PlayerCharacter(userId, "Tinker " + userId, level, (level - 1) * 1000L, 0L,
                CharacterStats.defaults(), Specialization.zero(), null, 0L);
    }

    public static PlayerCharacter characterDoing(String userId, int level, CurrentActivity activity, long lastActiveAt) {
        CharacterStats stats = new CharacterStats(20, 30, 40, 10, Map.of(), Map.of(), Map.of());
        return new PlayerCharacter(userId, "Tinker " + userId, level, (level - 1) * 1000L, 0L,
                stats, Specialization.zero(), activity, lastActiveAt);
    }

    public static Bonus bonus(String type, double value) {
        return new Bonus(type, value);
    }

    /**
     * Random source that hands out the given draws in order, repeating the last one.
     */
    public static DoubleSupplier draws(double... values) {
        AtomicInteger next = new AtomicInteger();
        return () -> values[Math.min(next.getAndIncrement(), values.length - 1)];
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

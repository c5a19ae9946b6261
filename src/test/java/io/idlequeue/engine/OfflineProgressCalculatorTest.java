package io.idlequeue.engine;

import io.idlequeue.Fixtures;
import io.idlequeue.MutableClock;
import io.idlequeue.config.EngineSettings;
import io.idlequeue.config.IdleQueueConfig;
import io.idlequeue.model.CurrentActivity;
import io.idlequeue.model.InventoryItem;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.TaskType;
import io.idlequeue.observability.AuditLogger;
import io.idlequeue.storage.CharacterDelta.SkillCategory;
import io.idlequeue.storage.CharacterStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleSupplier;

final class OfflineProgressCalculatorTest {
    private static final long T0 = 1_700_000_000_000L;
    private static final long MINUTE = 60_000L;

    @Test
    void craftingCreditsEverythingInOneUpdate() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-offline-");
        try {
            Harness h = new Harness(root, Fixtures.draws(0.5));
            long lastActive = T0 - 100L * MINUTE - 30_000L;
            h.characters.put(Fixtures.characterDoing("p1", 5,
                    new CurrentActivity(TaskType.CRAFTING, null, lastActive), lastActive), lastActive);

            OfflineProgressCalculator.OfflineResult result = h.calculator.calculate("p1");

            Assertions.assertTrue(result.hasProgress());
            Assertions.assertEquals(100, result.offlineMinutes());
            OfflineProgressCalculator.OfflineProgress progress = result.progress();
            Assertions.assertEquals(180L, progress.experienceGained());
            Assertions.assertEquals(120L, progress.currencyGained());
            Assertions.assertEquals(Map.of("clockmaking", 75), progress.skillsGained());
            Assertions.assertEquals(12, progress.specializationProgress().dpsProgress());
            Assertions.assertEquals(List.of("Clockwork Trinket"), progress.itemsFound());
            Assertions.assertEquals(5, progress.newLevel());
            Assertions.assertTrue(progress.notifications().get(0).contains("1 hour 40 minutes"));
            Assertions.assertTrue(progress.notifications().contains("Gained 180 experience."));

            PlayerCharacter stored = h.characters.get("p1").orElseThrow();
            Assertions.assertEquals(4180L, stored.experience());
            Assertions.assertEquals(120L, stored.currency());
            Assertions.assertEquals(75, stored.stats().craftingSkill("clockmaking"));
            Assertions.assertEquals(12, stored.specialization().dpsProgress());
            Assertions.assertEquals(T0, stored.lastActiveAt());
            List<InventoryItem> inventory = h.characters.inventory("p1");
            Assertions.assertEquals(1, inventory.size());
            Assertions.assertEquals("clockwork_trinket", inventory.get(0).itemId());
            Assertions.assertEquals(1, h.audit.tail(5).size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void harvestingUsesSubTypeAndPicksItemByDraw() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-offline-");
        try {
            Harness h = new Harness(root, Fixtures.draws(0.1, 0.7));
            long lastActive = T0 - 100L * MINUTE;
            h.characters.put(Fixtures.characterDoing("p1", 5,
                    new CurrentActivity(TaskType.HARVESTING, "herbalism", lastActive), lastActive), lastActive);

            OfflineProgressCalculator.OfflineProgress progress = h.calculator.calculate("p1").progress();

            Assertions.assertEquals(150L, progress.experienceGained());
            Assertions.assertEquals(90L, progress.currencyGained());
            Assertions.assertEquals(Map.of("herbalism", 90), progress.skillsGained());
            Assertions.assertEquals(6, progress.specializationProgress().healerProgress());
            Assertions.assertEquals(List.of("Iron Pipes"), progress.itemsFound());
            Assertions.assertEquals(90, h.characters.get("p1").orElseThrow().stats().harvestingSkill("herbalism"));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void combatBuildsTankAndDpsWithoutLuckyDraw() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-offline-");
        try {
            Harness h = new Harness(root, Fixtures.draws(0.99));
            long lastActive = T0 - 100L * MINUTE;
            h.characters.put(Fixtures.characterDoing("p1", 5,
                    new CurrentActivity(TaskType.COMBAT, null, lastActive), lastActive), lastActive);

            OfflineProgressCalculator.OfflineProgress progress = h.calculator.calculate("p1").progress();

            Assertions.assertEquals(225L, progress.experienceGained());
            Assertions.assertEquals(150L, progress.currencyGained());
            Assertions.assertEquals(Map.of("melee", 60), progress.skillsGained());
            Assertions.assertEquals(6, progress.specializationProgress().tankProgress());
            Assertions.assertEquals(7, progress.specializationProgress().dpsProgress());
            Assertions.assertTrue(progress.itemsFound().isEmpty());
            Assertions.assertTrue(h.characters.inventory("p1").isEmpty());
            Assertions.assertTrue(progress.notifications().contains("Tank specialization +6."));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void longAbsenceIsCappedAndLevelFollowsExperience() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-offline-");
        try {
            Harness h = new Harness(root, Fixtures.draws(0.99));
            long lastActive = T0 - 3_000L * MINUTE;
            h.characters.put(Fixtures.characterDoing("p1", 5,
                    new CurrentActivity(TaskType.CRAFTING, "clockmaking", lastActive), lastActive), lastActive);

            OfflineProgressCalculator.OfflineResult result = h.calculator.calculate("p1");

            Assertions.assertEquals(1440, result.offlineMinutes());
            Assertions.assertEquals(2592L, result.progress().experienceGained());
            Assertions.assertEquals(7, result.progress().newLevel());
            Assertions.assertEquals(7, h.characters.get("p1").orElseThrow().level());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void shortAbsenceOrNoActivityChangesNothing() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-offline-");
        try {
            Harness h = new Harness(root, Fixtures.draws(0.0));
            long justNow = T0 - 59_000L;
            h.characters.put(Fixtures.characterDoing("recent", 5,
                    new CurrentActivity(TaskType.CRAFTING, null, justNow), justNow), justNow);
            h.characters.put(Fixtures.characterDoing("idle", 5, null, T0 - 500L * MINUTE), T0);

            OfflineProgressCalculator.OfflineResult recent = h.calculator.calculate("recent");
            OfflineProgressCalculator.OfflineResult idle = h.calculator.calculate("idle");

            Assertions.assertFalse(recent.hasProgress());
            Assertions.assertEquals(0, recent.offlineMinutes());
            Assertions.assertFalse(idle.hasProgress());
            Assertions.assertEquals(4000L, h.characters.get("recent").orElseThrow().experience());
            Assertions.assertEquals(justNow, h.characters.get("recent").orElseThrow().lastActiveAt());
            Assertions.assertThrows(IllegalArgumentException.class, () -> h.calculator.calculate("missing"));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void skillsMapToTheirCategoryWithActivityFallback() {
        Assertions.assertEquals(SkillCategory.HARVESTING, OfflineProgressCalculator.skillCategory("mining", TaskType.COMBAT));
        Assertions.assertEquals(SkillCategory.CRAFTING, OfflineProgressCalculator.skillCategory("alchemy", TaskType.HARVESTING));
        Assertions.assertEquals(SkillCategory.COMBAT, OfflineProgressCalculator.skillCategory("ranged", TaskType.CRAFTING));
        Assertions.assertEquals(SkillCategory.CRAFTING, OfflineProgressCalculator.skillCategory("tinkering", TaskType.CRAFTING));
    }

    private static final class Harness {
        final MutableClock clock = new MutableClock(T0);
        final CharacterStore characters;
        final AuditLogger audit;
        final OfflineProgressCalculator calculator;

        Harness(Path root, DoubleSupplier random) {
            IdleQueueConfig config = IdleQueueConfig.fromRoot(root.toString());
            this.characters = new CharacterStore(Fixtures.database(root));
            this.audit = new AuditLogger(config.auditFile(), clock);
            this.calculator = new OfflineProgressCalculator(characters, EngineSettings.defaults(), clock, random, audit);
        }
    }
}

package io.idlequeue.engine;

import io.idlequeue.Fixtures;
import io.idlequeue.model.CombatData;
import io.idlequeue.model.CombatStats;
import io.idlequeue.model.CraftingData;
import io.idlequeue.model.CraftingStation;
import io.idlequeue.model.Equipment;
import io.idlequeue.model.HarvestingData;
import io.idlequeue.model.HarvestingLocation;
import io.idlequeue.model.ItemStack;
import io.idlequeue.model.Prerequisite;
import io.idlequeue.model.Recipe;
import io.idlequeue.model.ResourceRequirement;
import io.idlequeue.model.Task;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class TaskValidatorTest {
    private final TaskValidator validator = new TaskValidator();

    @Test
    void acceptsWellFormedTasks() {
        Assertions.assertTrue(validator.validate(Fixtures.harvestTask("h-1", 1000L), Fixtures.character("p1", 1)));
        Assertions.assertTrue(validator.validate(Fixtures.craftTask("c-1", 1000L), Fixtures.character("p1", 1)));
        Assertions.assertTrue(validator.validate(Fixtures.combatTask("f-1", 1000L, 6), Fixtures.character("p1", 1)));
    }

    @Test
    void rejectsMissingCharacter() {
        ValidationResult result = validator.check(Fixtures.harvestTask("h-1", 1000L), null);
        Assertions.assertFalse(result.valid());
        Assertions.assertEquals(1, result.errors().size());
    }

    @Test
    void rejectsHarvestingWithoutToolsOrUnmetLocationRequirement() {
        HarvestingData base = Fixtures.harvesting();
        HarvestingData bare = new HarvestingData(base.activity(), List.of(),
                new HarvestingLocation("deep-mine", "Deep Mine", Map.of(),
                        List.of(new Prerequisite("quest", "Open the mine gate", false))),
                1);
        ValidationResult result = validator.check(Task.create("h-2", "Dig", 1000L, bare, 3), Fixtures.character("p1", 1));

        Assertions.assertFalse(result.valid());
        Assertions.assertEquals(2, result.errors().size());
    }

    @Test
    void unmetTaskPrerequisiteFailsAnyType() {
        Task task = Fixtures.craftTask("c-1", 1000L)
                .withRequirements(List.of(new Prerequisite("level", "Guild membership", false)), List.of());
        Assertions.assertFalse(validator.validate(task, Fixtures.character("p1", 1)));
    }

    @Test
    void materialShortfallDoesNotBlockCrafting() {
        CraftingData data = new CraftingData(
                new Recipe("cog", "Cog", 1),
                List.of(new ResourceRequirement("brass", 10, 2)),
                new CraftingStation("bench", "Workbench", List.of(), List.of()),
                1,
                List.of(new ItemStack("clockwork_cog", 1))
        );
        Assertions.assertTrue(validator.validate(Task.create("c-2", "Cog", 1000L, data, 3), Fixtures.character("p1", 1)));
    }

    @Test
    void unmetStationRequirementBlocksCrafting() {
        CraftingData data = new CraftingData(
                new Recipe("cog", "Cog", 1),
                List.of(),
                new CraftingStation("forge", "Steam Forge", List.of(),
                        List.of(new Prerequisite("fuel", "Forge is fuelled", false))),
                1,
                List.of()
        );
        Assertions.assertFalse(validator.validate(Task.create("c-3", "Cog", 1000L, data, 3), Fixtures.character("p1", 1)));
    }

    @Test
    void combatRequiresLevelWithinGraceOfEnemy() {
        Assertions.assertTrue(validator.validate(Fixtures.combatTask("f-1", 1000L, 10), Fixtures.character("p1", 5)));
        ValidationResult tooWeak = validator.check(Fixtures.combatTask("f-2", 1000L, 11), Fixtures.character("p1", 5));
        Assertions.assertFalse(tooWeak.valid());
    }

    @Test
    void brokenEquipmentBlocksCombat() {
        CombatData base = Fixtures.combat(1, 1);
        CombatData broken = new CombatData(base.enemy(), 1, base.playerStats(),
                List.of(new Equipment("sword-1", "weapon", new CombatStats(3, 0), 0)));
        ValidationResult result = validator.check(Task.create("f-3", "Fight", 1000L, broken, 3), Fixtures.character("p1", 1));

        Assertions.assertFalse(result.valid());
        Assertions.assertTrue(result.errors().get(0).contains("sword-1"));
    }
}

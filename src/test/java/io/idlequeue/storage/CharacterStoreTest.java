package io.idlequeue.storage;

import io.idlequeue.Fixtures;
import io.idlequeue.model.CharacterStats;
import io.idlequeue.model.ItemStack;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.Specialization;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class CharacterStoreTest {

    @Test
    void deltasAddToStoredValuesAndRaiseLevel() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-characters-");
        try {
            CharacterStore store = new CharacterStore(Fixtures.database(root));
            store.put(Fixtures.character("p1", 1), 1_000L);

            CharacterDelta first = new CharacterDelta(600L, 25L,
                    List.of(new CharacterDelta.SkillGain(CharacterDelta.SkillCategory.CRAFTING, "clockmaking", 4)),
                    new Specialization(1, 2, 3),
                    List.of(new ItemStack("cog", 2)),
                    null);
            CharacterDelta second = new CharacterDelta(600L, 5L,
                    List.of(new CharacterDelta.SkillGain(CharacterDelta.SkillCategory.CRAFTING, "clockmaking", 6),
                            new CharacterDelta.SkillGain(CharacterDelta.SkillCategory.COMBAT, "melee", 1)),
                    new Specialization(0, 0, 1),
                    List.of(new ItemStack("cog", 3), new ItemStack("spring", 1)),
                    5_000L);

            Assertions.assertTrue(store.apply("p1", first, 2_000L));
            Assertions.assertTrue(store.apply("p1", second, 3_000L));

            PlayerCharacter stored = store.get("p1").orElseThrow();
            Assertions.assertEquals(1200L, stored.experience());
            Assertions.assertEquals(2, stored.level());
            Assertions.assertEquals(30L, stored.currency());
            Assertions.assertEquals(10, stored.stats().craftingSkill("clockmaking"));
            Assertions.assertEquals(1, stored.stats().combatSkill("melee"));
            Assertions.assertEquals(CharacterStats.BASE_ATTRIBUTE, stored.stats().strength());
            Assertions.assertEquals(new Specialization(1, 2, 4), stored.specialization());
            Assertions.assertEquals(5_000L, stored.lastActiveAt());

            Assertions.assertEquals(2, store.inventory("p1").size());
            Assertions.assertEquals("cog", store.inventory("p1").get(0).itemId());
            Assertions.assertEquals(5L, store.inventory("p1").get(0).quantity());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void levelNeverDropsAndMissingCharacterIsReported() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-characters-");
        try {
            CharacterStore store = new CharacterStore(Fixtures.database(root));
            PlayerCharacter veteran = new PlayerCharacter("vet", "Veteran", 9, 100L, 0L, null, null, null, 0L);
            store.put(veteran, 1_000L);

            Assertions.assertTrue(store.apply("vet", CharacterDelta.of(50L, 0L, List.of()), 2_000L));
            Assertions.assertEquals(9, store.get("vet").orElseThrow().level());
            Assertions.assertEquals(0L, store.get("vet").orElseThrow().lastActiveAt());

            Assertions.assertFalse(store.apply("nobody", CharacterDelta.of(50L, 0L, List.of()), 2_000L));
            Assertions.assertTrue(store.get("nobody").isEmpty());
            Assertions.assertTrue(store.inventory("nobody").isEmpty());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

}

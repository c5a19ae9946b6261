package io.idlequeue.model;

import java.util.Map;

public record CharacterStats(
        int strength,
        int dexterity,
        int intelligence,
        int vitality,
        Map<String, Integer> harvestingSkills,
        Map<String, Integer> craftingSkills,
        Map<String, Integer> combatSkills
) {
    public static final int BASE_ATTRIBUTE = 10;

    public CharacterStats {
        harvestingSkills = harvestingSkills == null ? Map.of() : Map.copyOf(harvestingSkills);
        craftingSkills = craftingSkills == null ? Map.of() : Map.copyOf(craftingSkills);
        combatSkills = combatSkills == null ? Map.of() : Map.copyOf(combatSkills);
    }

    public static CharacterStats defaults() {
        return new CharacterStats(BASE_ATTRIBUTE, BASE_ATTRIBUTE, BASE_ATTRIBUTE, BASE_ATTRIBUTE,
                Map.of(), Map.of(), Map.of());
    }

    public int harvestingSkill(String skill) {
        Integer value = harvestingSkills.get(skill);
        return value == null ? 0 : value;
    }

    public int craftingSkill(String skill) {
        Integer value = craftingSkills.get(skill);
        return value == null ? 0 : value;
    }

    public int combatSkill(String skill) {
        Integer value = combatSkills.get(skill);
        return value == null ? 0 : value;
    }
}

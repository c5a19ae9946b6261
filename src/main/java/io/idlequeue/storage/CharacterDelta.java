package io.idlequeue.storage;

import io.idlequeue.model.ItemStack;
import io.idlequeue.model.Specialization;

import java.util.List;

/**
 * Relative change to a character. Every field is added to the stored value; nothing is overwritten except
 * {@code lastActiveAt} when it is set.
 */
public record CharacterDelta(
        long experience,
        long currency,
        List<SkillGain> skills,
        Specialization specialization,
        List<ItemStack> items,
        Long lastActiveAt
) {
    public CharacterDelta {
        skills = skills == null ? List.of() : List.copyOf(skills);
        specialization = specialization == null ? Specialization.zero() : specialization;
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static CharacterDelta of(long experience, long currency, List<ItemStack> items) {
        return new CharacterDelta(experience, currency, List.of(), Specialization.zero(), items, null);
    }

    public boolean isEmpty() {
        return experience == 0L && currency == 0L && skills.isEmpty()
                && !specialization.hasProgress() && items.isEmpty() && lastActiveAt == null;
    }

    public record SkillGain(SkillCategory category, String skill, int amount) {
    }

    public enum SkillCategory {
        HARVESTING("harvestingSkills"),
        CRAFTING("craftingSkills"),
        COMBAT("combatSkills");

        private final String field;

        SkillCategory(String field) {
            this.field = field;
        }

        public String field() {
            return field;
        }
    }
}

package io.idlequeue.engine;

import io.idlequeue.model.Bonus;
import io.idlequeue.model.CombatData;
import io.idlequeue.model.CraftingData;
import io.idlequeue.model.DropEntry;
import io.idlequeue.model.DropTable;
import io.idlequeue.model.Equipment;
import io.idlequeue.model.EquippedTool;
import io.idlequeue.model.HarvestingData;
import io.idlequeue.model.ItemStack;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.Task;
import io.idlequeue.model.TaskReward;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Turns a finished task into rewards. Pure apart from the injected random source; never touches the store.
 */
public final class ActivityRewardEngine {
    static final double CRAFT_SUCCESS_FLOOR = 0.70d;
    static final double CRAFT_SUCCESS_CEILING = 0.95d;
    static final double COMBAT_WIN_FLOOR = 0.50d;
    static final double COMBAT_WIN_CEILING = 0.90d;
    static final double RARE_CHANCE_CEILING = 0.30d;

    private static final String FALLBACK_RESOURCE = "generic_material";
    private static final String FALLBACK_RARE_RESOURCE = "steam_crystal";
    private static final String FALLBACK_COMBAT_LOOT = "combat_trophy";

    private final DoubleSupplier random;

    public ActivityRewardEngine() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    public ActivityRewardEngine(DoubleSupplier random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public ExecutionOutcome execute(Task task, PlayerCharacter character) {
        double multiplier = levelMultiplier(character.level());
        return switch (task.type()) {
            case HARVESTING -> harvest(task.activityData(HarvestingData.class), character, multiplier);
            case CRAFTING -> craft(task.activityData(CraftingData.class), multiplier);
            case COMBAT -> fight(task.activityData(CombatData.class), multiplier);
        };
    }

    static double levelMultiplier(int level) {
        return 1.0d + 0.05d * level;
    }

    static String skillForCategory(String category) {
        if (category == null) {
            return "mining";
        }
        return switch (category.trim().toLowerCase()) {
            case "metallurgical", "mechanical" -> "mining";
            case "botanical", "alchemical" -> "foraging";
            case "archaeological" -> "salvaging";
            case "electrical", "aeronautical" -> "crystal_extraction";
            default -> "mining";
        };
    }

    ExecutionOutcome.Harvesting harvest(HarvestingData data, PlayerCharacter character, double multiplier) {
        double toolBonus = 0.0d;
        for (EquippedTool tool : data.tools()) {
            toolBonus += sumBonuses(tool.bonuses(), "yield");
        }
        String skill = skillForCategory(data.activity().category());
        int skillLevel = character.stats().harvestingSkill(skill);
        double locationBonus = data.location() == null ? 0.0d : data.location().bonus("yield");
        double efficiency = 1.0d + toolBonus * 0.01d + skillLevel * 0.02d + locationBonus * 0.01d;
        DropTable drops = data.activity().dropTable();
        int baseYield = Math.max(1, drops.guaranteed().size() + drops.common().size() + drops.uncommon().size());
        double rareChance = clamp(0.1d + skillLevel * 0.001d, 0.0d, RARE_CHANCE_CEILING);

        List<TaskReward> rewards = new ArrayList<>();
        rewards.add(TaskReward.experience((int) Math.floor(25.0d * multiplier * efficiency)));
        int quantity = (int) Math.floor(baseYield * efficiency * (1.0d + random.getAsDouble() * 0.5d));
        rewards.add(TaskReward.resource(firstItem(FALLBACK_RESOURCE, drops.guaranteed(), drops.common()), quantity, "common"));
        if (random.getAsDouble() < rareChance) {
            rewards.add(TaskReward.resource(firstItem(FALLBACK_RARE_RESOURCE, drops.rare(), drops.uncommon()), 1, "rare"));
        }
        return new ExecutionOutcome.Harvesting(skill, skillLevel, efficiency, baseYield, rareChance, List.copyOf(rewards));
    }

    ExecutionOutcome.Crafting craft(CraftingData data, double multiplier) {
        double skillBonus = data.playerSkillLevel() * 0.02d;
        double stationBonus = data.craftingStation() == null ? 0.0d : sumBonuses(data.craftingStation().bonuses(), "quality");
        double successRate = clamp(0.7d + skillBonus + stationBonus * 0.01d, CRAFT_SUCCESS_FLOOR, CRAFT_SUCCESS_CEILING);
        double qualityBonus = skillBonus + stationBonus * 0.01d;
        double materialEfficiency = 1.0d + skillBonus * 0.5d;
        double experienceMultiplier = data.recipe().requiredLevel() * 0.1d;

        List<TaskReward> rewards = new ArrayList<>();
        rewards.add(TaskReward.experience((int) Math.floor(30.0d * multiplier * experienceMultiplier)));
        boolean succeeded = random.getAsDouble() < successRate;
        if (succeeded) {
            String rarity = qualityBonus > 0.5d ? "uncommon" : "common";
            for (ItemStack output : data.expectedOutputs()) {
                rewards.add(TaskReward.item(output.itemId(), output.quantity(), rarity));
            }
        }
        return new ExecutionOutcome.Crafting(successRate, qualityBonus, materialEfficiency, experienceMultiplier,
                succeeded, List.copyOf(rewards));
    }

    ExecutionOutcome.Combat fight(CombatData data, double multiplier) {
        int enemyLevel = data.enemy().level();
        double levelAdvantage = Math.max(0, data.playerLevel() - enemyLevel) * 0.1d;
        double equipmentTotal = 0.0d;
        for (Equipment piece : data.equipment()) {
            equipmentTotal += piece.stats().attack() + piece.stats().defense();
        }
        double winProbability = clamp(0.5d + levelAdvantage + equipmentTotal * 0.01d, COMBAT_WIN_FLOOR, COMBAT_WIN_CEILING);
        double experienceMultiplier = enemyLevel * 0.15d;
        double lootMultiplier = lootMultiplier(enemyLevel);

        List<TaskReward> rewards = new ArrayList<>();
        rewards.add(TaskReward.experience((int) Math.floor(35.0d * multiplier * experienceMultiplier)));
        boolean won = random.getAsDouble() < winProbability;
        if (won) {
            rewards.add(TaskReward.currency((int) Math.floor(15.0d * multiplier * lootMultiplier)));
            if (random.getAsDouble() < 0.3d * lootMultiplier) {
                List<DropEntry> loot = data.enemy().lootTable();
                if (loot.isEmpty()) {
                    rewards.add(TaskReward.item(FALLBACK_COMBAT_LOOT, 1, "common"));
                } else {
                    DropEntry first = loot.get(0);
                    rewards.add(TaskReward.item(first.itemId(), Math.max(1, first.quantity()),
                            first.rarity() == null ? "common" : first.rarity()));
                }
            }
        }
        return new ExecutionOutcome.Combat(winProbability, experienceMultiplier, lootMultiplier, won, List.copyOf(rewards));
    }

    static double lootMultiplier(int enemyLevel) {
        if (enemyLevel > 20) {
            return 2.0d;
        }
        if (enemyLevel > 10) {
            return 1.5d;
        }
        return 1.0d;
    }

    private static double sumBonuses(List<Bonus> bonuses, String type) {
        double total = 0.0d;
        for (Bonus bonus : bonuses) {
            if (bonus.is(type)) {
                total += bonus.value();
            }
        }
        return total;
    }

    @SafeVarargs
    private static String firstItem(String fallback, List<DropEntry>... tiers) {
        for (List<DropEntry> tier : tiers) {
            if (!tier.isEmpty() && tier.get(0).itemId() != null) {
                return tier.get(0).itemId();
            }
        }
        return fallback;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}

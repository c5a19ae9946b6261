package io.idlequeue.engine;

import io.idlequeue.model.TaskReward;
import io.idlequeue.model.TaskType;

import java.util.List;

/**
 * Result of running one task through {@link ActivityRewardEngine}: the intermediate factors plus the rolled rewards.
 */
public interface ExecutionOutcome {
    TaskType type();

    List<TaskReward> rewards();

    record Harvesting(
            String skill,
            int skillLevel,
            double efficiency,
            int baseYield,
            double rareChance,
            List<TaskReward> rewards
    ) implements ExecutionOutcome {
        @Override
        public TaskType type() {
            return TaskType.HARVESTING;
        }
    }

    record Crafting(
            double successRate,
            double qualityBonus,
            double materialEfficiency,
            double experienceMultiplier,
            boolean succeeded,
            List<TaskReward> rewards
    ) implements ExecutionOutcome {
        @Override
        public TaskType type() {
            return TaskType.CRAFTING;
        }
    }

    record Combat(
            double winProbability,
            double experienceMultiplier,
            double lootMultiplier,
            boolean won,
            List<TaskReward> rewards
    ) implements ExecutionOutcome {
        @Override
        public TaskType type() {
            return TaskType.COMBAT;
        }
    }
}

package io.idlequeue.model;

import java.util.Objects;

public record TaskReward(
        RewardType type,
        String itemId,
        int quantity,
        String rarity
) {
    public TaskReward {
        Objects.requireNonNull(type, "type");
        if (quantity < 0) {
            throw new IllegalArgumentException("Reward quantity must not be negative: " + quantity);
        }
        if (type.isInventoryItem() && (itemId == null || itemId.isBlank())) {
            throw new IllegalArgumentException("Reward of type " + type.wireName() + " requires an itemId");
        }
    }

    public static TaskReward experience(int quantity) {
        return new TaskReward(RewardType.EXPERIENCE, null, quantity, null);
    }

    public static TaskReward currency(int quantity) {
        return new TaskReward(RewardType.CURRENCY, null, quantity, null);
    }

    public static TaskReward resource(String itemId, int quantity, String rarity) {
        return new TaskReward(RewardType.RESOURCE, itemId, quantity, rarity);
    }

    public static TaskReward item(String itemId, int quantity, String rarity) {
        return new TaskReward(RewardType.ITEM, itemId, quantity, rarity);
    }
}

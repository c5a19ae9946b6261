package io.idlequeue.model;

/**
 * Player character as read from the store. Counters are only ever changed through relative updates.
 */
public record PlayerCharacter(
        String userId,
        String name,
        int level,
        long experience,
        long currency,
        CharacterStats stats,
        Specialization specialization,
        CurrentActivity currentActivity,
        long lastActiveAt
) {
    public PlayerCharacter {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        name = name == null ? userId : name;
        level = Math.max(1, level);
        stats = stats == null ? CharacterStats.defaults() : stats;
        specialization = specialization == null ? Specialization.zero() : specialization;
    }

    public static int levelForExperience(long experience) {
        return (int) (Math.max(0L, experience) / 1000L) + 1;
    }
}

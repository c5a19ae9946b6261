package io.idlequeue.model;

import java.util.List;
import java.util.Objects;

public record Task(
        String id,
        String name,
        TaskType type,
        long duration,
        long startTime,
        ActivityData activityData,
        double progress,
        boolean completed,
        List<TaskReward> rewards,
        int retryCount,
        int maxRetries,
        List<Prerequisite> prerequisites,
        List<ResourceRequirement> resourceRequirements
) {
    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(activityData, "activityData");
        if (activityData.taskType() != type) {
            throw new IllegalArgumentException(
                    "Activity data " + activityData.taskType().wireName() + " does not match task type " + type.wireName()
            );
        }
        if (duration < 0) {
            throw new IllegalArgumentException("Task duration must not be negative: " + duration);
        }
        name = name == null ? id : name;
        progress = completed ? 1.0d : clampProgress(progress);
        rewards = rewards == null ? List.of() : List.copyOf(rewards);
        retryCount = Math.max(0, retryCount);
        maxRetries = Math.max(0, maxRetries);
        prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
        resourceRequirements = resourceRequirements == null ? List.of() : List.copyOf(resourceRequirements);
    }

    public static Task create(String id, String name, long duration, ActivityData activityData, int maxRetries) {
        return new Task(id, name, activityData.taskType(), duration, 0L, activityData, 0.0d, false,
                List.of(), 0, maxRetries, List.of(), List.of());
    }

    public Task startedAt(long startTime) {
        return new Task(id, name, type, duration, startTime, activityData, 0.0d, false, rewards,
                retryCount, maxRetries, prerequisites, resourceRequirements);
    }

    /**
     * Copy with one more failed attempt recorded. The clock restarts at {@code restartAt}.
     */
    public Task failedAttempt(long restartAt) {
        return new Task(id, name, type, duration, restartAt, activityData, 0.0d, false, rewards,
                retryCount + 1, maxRetries, prerequisites, resourceRequirements);
    }

    public Task shiftedBy(long deltaMs) {
        return new Task(id, name, type, duration, startTime + deltaMs, activityData, progress, completed, rewards,
                retryCount, maxRetries, prerequisites, resourceRequirements);
    }

    public Task completedWith(List<TaskReward> earned) {
        return new Task(id, name, type, duration, startTime, activityData, 1.0d, true, earned,
                retryCount, maxRetries, prerequisites, resourceRequirements);
    }

    public Task withProgress(double value) {
        return new Task(id, name, type, duration, startTime, activityData, value, completed, rewards,
                retryCount, maxRetries, prerequisites, resourceRequirements);
    }

    public Task withMaxRetries(int value) {
        return new Task(id, name, type, duration, startTime, activityData, progress, completed, rewards,
                retryCount, value, prerequisites, resourceRequirements);
    }

    public Task withRequirements(List<Prerequisite> newPrerequisites, List<ResourceRequirement> newRequirements) {
        return new Task(id, name, type, duration, startTime, activityData, progress, completed, rewards,
                retryCount, maxRetries, newPrerequisites, newRequirements);
    }

    public <T extends ActivityData> T activityData(Class<T> variant) {
        if (!variant.isInstance(activityData)) {
            throw new IllegalStateException("Task " + id + " carries " + activityData.taskType().wireName()
                    + " data, not " + variant.getSimpleName());
        }
        return variant.cast(activityData);
    }

    public long elapsedAt(long nowMs) {
        return Math.max(0L, nowMs - startTime);
    }

    public double progressAt(long nowMs) {
        if (duration <= 0L) {
            return 1.0d;
        }
        return clampProgress((double) elapsedAt(nowMs) / (double) duration);
    }

    public long remainingAt(long nowMs) {
        return Math.max(0L, duration - elapsedAt(nowMs));
    }

    private static double clampProgress(double value) {
        if (Double.isNaN(value)) {
            return 0.0d;
        }
        return Math.max(0.0d, Math.min(1.0d, value));
    }
}

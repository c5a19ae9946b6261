package io.idlequeue.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-player queue. A queue is running exactly when it has a current task.
 */
public record TaskQueue(
        String playerId,
        Task currentTask,
        List<Task> queuedTasks,
        boolean running,
        boolean paused,
        Long pausedAt,
        long totalTasksCompleted,
        long totalTimeSpent,
        QueueConfig config,
        long version,
        String checksum,
        long createdAt,
        long lastUpdated,
        long lastSynced
) {
    public TaskQueue {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("playerId must not be blank");
        }
        if ((currentTask == null) == running) {
            throw new IllegalArgumentException(
                    "Queue " + playerId + " is " + (running ? "running without" : "idle with") + " a current task"
            );
        }
        queuedTasks = queuedTasks == null ? List.of() : List.copyOf(queuedTasks);
        config = config == null ? QueueConfig.defaults() : config;
        checksum = checksum == null ? "" : checksum;
        if (!paused) {
            pausedAt = null;
        }
    }

    public static TaskQueue empty(String playerId, QueueConfig config, long nowMs) {
        return new TaskQueue(playerId, null, List.of(), false, false, null, 0L, 0L,
                config, 0L, "", nowMs, nowMs, nowMs);
    }

    public int size() {
        return queuedTasks.size() + (currentTask == null ? 0 : 1);
    }

    public Optional<Task> nextQueued() {
        return queuedTasks.isEmpty() ? Optional.empty() : Optional.of(queuedTasks.get(0));
    }

    public boolean contains(String taskId) {
        if (currentTask != null && currentTask.id().equals(taskId)) {
            return true;
        }
        for (Task task : queuedTasks) {
            if (task.id().equals(taskId)) {
                return true;
            }
        }
        return false;
    }

    public TaskQueue withCurrentTask(Task task) {
        return new TaskQueue(playerId, task, queuedTasks, task != null, task != null && paused, pausedAt,
                totalTasksCompleted, totalTimeSpent, config, version, checksum, createdAt, lastUpdated, lastSynced);
    }

    public TaskQueue withQueuedTasks(List<Task> tasks) {
        return new TaskQueue(playerId, currentTask, tasks, running, paused, pausedAt,
                totalTasksCompleted, totalTimeSpent, config, version, checksum, createdAt, lastUpdated, lastSynced);
    }

    public TaskQueue enqueue(Task task) {
        List<Task> next = new ArrayList<>(queuedTasks);
        next.add(Objects.requireNonNull(task, "task"));
        return withQueuedTasks(next);
    }

    /**
     * Moves the head of the queued list into the current slot with its clock started at {@code nowMs},
     * or clears the current slot when nothing is queued. A paused queue stays paused from {@code nowMs}, since the
     * promoted task has not run before.
     */
    public TaskQueue promoteNext(long nowMs) {
        if (queuedTasks.isEmpty()) {
            return new TaskQueue(playerId, null, List.of(), false, false, null,
                    totalTasksCompleted, totalTimeSpent, config, version, checksum, createdAt, lastUpdated, lastSynced);
        }
        Task next = queuedTasks.get(0).startedAt(nowMs);
        List<Task> rest = List.copyOf(queuedTasks.subList(1, queuedTasks.size()));
        return new TaskQueue(playerId, next, rest, true, paused, paused ? Long.valueOf(nowMs) : null,
                totalTasksCompleted, totalTimeSpent, config, version, checksum, createdAt, lastUpdated, lastSynced);
    }

    public TaskQueue recordCompletion(long timeSpentMs) {
        return new TaskQueue(playerId, currentTask, queuedTasks, running, paused, pausedAt,
                totalTasksCompleted + 1L, totalTimeSpent + Math.max(0L, timeSpentMs), config,
                version, checksum, createdAt, lastUpdated, lastSynced);
    }

    public TaskQueue pause(long nowMs) {
        return new TaskQueue(playerId, currentTask, queuedTasks, running, true, nowMs,
                totalTasksCompleted, totalTimeSpent, config, version, checksum, createdAt, lastUpdated, lastSynced);
    }

    public TaskQueue resume() {
        return new TaskQueue(playerId, currentTask, queuedTasks, running, false, null,
                totalTasksCompleted, totalTimeSpent, config, version, checksum, createdAt, lastUpdated, lastSynced);
    }

    public TaskQueue cleared() {
        return new TaskQueue(playerId, null, List.of(), false, false, null,
                totalTasksCompleted, totalTimeSpent, config, version, checksum, createdAt, lastUpdated, lastSynced);
    }

    public TaskQueue syncedAt(long nowMs) {
        return new TaskQueue(playerId, currentTask, queuedTasks, running, paused, pausedAt,
                totalTasksCompleted, totalTimeSpent, config, version, checksum, createdAt, lastUpdated, nowMs);
    }

    public TaskQueue stamped(long newVersion, String newChecksum, long nowMs) {
        return new TaskQueue(playerId, currentTask, queuedTasks, running, paused, pausedAt,
                totalTasksCompleted, totalTimeSpent, config, newVersion, newChecksum, createdAt, nowMs, lastSynced);
    }
}

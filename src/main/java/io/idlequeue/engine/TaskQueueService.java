package io.idlequeue.engine;

import io.idlequeue.config.EngineSettings;
import io.idlequeue.model.DeltaType;
import io.idlequeue.model.Task;
import io.idlequeue.model.TaskProgress;
import io.idlequeue.model.TaskQueue;
import io.idlequeue.observability.AuditLogger;
import io.idlequeue.storage.TaskQueueStore;
import io.idlequeue.sync.PlayerNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Player-facing queue operations. Every mutation is a read, a pure transformation and a version-checked write,
 * repeated a few times if another writer interleaves.
 */
public final class TaskQueueService {
    private static final Logger log = LoggerFactory.getLogger(TaskQueueService.class);
    private static final int MAX_WRITE_ATTEMPTS = 3;

    private final TaskQueueStore queues;
    private final QueueScheduler scheduler;
    private final PlayerNotifier notifier;
    private final EngineSettings settings;
    private final Clock clock;
    private final AuditLogger audit;

    public TaskQueueService(
            TaskQueueStore queues,
            QueueScheduler scheduler,
            PlayerNotifier notifier,
            EngineSettings settings,
            Clock clock,
            AuditLogger audit
    ) {
        this.queues = queues;
        this.scheduler = scheduler;
        this.notifier = notifier;
        this.settings = settings;
        this.clock = clock;
        this.audit = audit;
    }

    public Optional<TaskQueue> getQueue(String playerId) {
        return queues.get(playerId);
    }

    public QueueStatus status(String playerId) {
        long now = clock.millis();
        TaskQueue queue = queues.get(playerId).orElse(null);
        if (queue == null) {
            return new QueueStatus(playerId, null, TaskProgress.idle(), 0, now);
        }
        return new QueueStatus(playerId, queue, progressOf(queue, now), queue.queuedTasks().size(), now);
    }

    /**
     * Creates the queue on first contact, advances it once and stamps the sync time.
     */
    public TaskQueue sync(String playerId) {
        long now = clock.millis();
        queues.createIfAbsent(TaskQueue.empty(playerId, settings.queueConfig(), now), now);
        ProcessOutcome outcome = scheduler.process(playerId);
        log.debug("Sync for player {} processed queue: {}", playerId, outcome);
        return mutate(playerId, q -> q.syncedAt(clock.millis()));
    }

    /**
     * Appends a task, starting it immediately when the queue is idle. Rejected when the queue is full.
     */
    public TaskQueue addTask(String playerId, Task task) {
        long now = clock.millis();
        TaskQueue created = queues.createIfAbsent(TaskQueue.empty(playerId, settings.queueConfig(), now), now);
        Task admitted = task.withMaxRetries(created.config().retryBudget(task.maxRetries()));
        TaskQueue saved = mutate(playerId, q -> {
            if (q.contains(task.id())) {
                throw new IllegalArgumentException("Task " + task.id() + " is already queued for " + playerId);
            }
            if (q.running() && q.queuedTasks().size() >= q.config().maxQueueSize()) {
                throw new QueueFullException(playerId, q.config().maxQueueSize());
            }
            return q.running()
                    ? q.enqueue(admitted)
                    : q.withCurrentTask(admitted.startedAt(clock.millis()));
        });
        long after = clock.millis();
        boolean started = saved.currentTask() != null && saved.currentTask().id().equals(task.id());
        if (started) {
            notifier.sendToPlayer(QueueEvents.taskStarted(saved, after));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task", admitted);
        data.put("started", started);
        notifier.sendDeltaUpdate(QueueEvents.delta(DeltaType.TASK_ADDED, saved, task.id(), data, after));
        notifier.sendToPlayer(QueueEvents.queueUpdated(saved, after));
        audit("queue.add", saved, task.id(), started ? "started" : "queued");
        return saved;
    }

    public TaskQueue removeTask(String playerId, String taskId) {
        TaskQueue saved = mutate(playerId, q -> {
            if (!q.contains(taskId)) {
                throw new IllegalArgumentException("Task " + taskId + " is not queued for " + playerId);
            }
            if (q.currentTask() != null && q.currentTask().id().equals(taskId)) {
                return q.promoteNext(clock.millis());
            }
            List<Task> rest = new ArrayList<>();
            for (Task task : q.queuedTasks()) {
                if (!task.id().equals(taskId)) {
                    rest.add(task);
                }
            }
            return q.withQueuedTasks(rest);
        });
        long now = clock.millis();
        notifier.sendDeltaUpdate(QueueEvents.delta(DeltaType.TASK_REMOVED, saved, taskId, Map.of(), now));
        notifier.sendToPlayer(QueueEvents.queueUpdated(saved, now));
        audit("queue.remove", saved, taskId, "removed");
        return saved;
    }

    /**
     * Drops the current and every queued task, leaving an idle queue with its lifetime counters intact.
     */
    public TaskQueue stopTasks(String playerId) {
        TaskQueue saved = mutate(playerId, TaskQueue::cleared);
        long now = clock.millis();
        notifier.sendDeltaUpdate(QueueEvents.stateChanged(saved, now));
        notifier.sendToPlayer(QueueEvents.queueUpdated(saved, now));
        audit("queue.stop", saved, null, "stopped");
        return saved;
    }

    public TaskQueue pause(String playerId) {
        TaskQueue saved = mutate(playerId, q -> {
            if (!q.running()) {
                throw new IllegalStateException("Queue for " + playerId + " has nothing running to pause");
            }
            return q.paused() ? q : q.pause(clock.millis());
        });
        long now = clock.millis();
        notifier.sendDeltaUpdate(QueueEvents.stateChanged(saved, now));
        notifier.sendToPlayer(QueueEvents.queueUpdated(saved, now));
        audit("queue.pause", saved, null, "paused");
        return saved;
    }

    /**
     * Resumes a paused queue. The current task's start time moves forward by the paused duration so no time is lost.
     */
    public TaskQueue resume(String playerId) {
        TaskQueue saved = mutate(playerId, q -> {
            if (!q.paused()) {
                return q;
            }
            long now = clock.millis();
            long pausedFor = q.pausedAt() == null ? 0L : Math.max(0L, now - q.pausedAt());
            Task current = q.currentTask();
            TaskQueue resumed = q.resume();
            if (current == null) {
                return resumed;
            }
            Task shifted = current.shiftedBy(pausedFor);
            return resumed.withCurrentTask(shifted);
        });
        long now = clock.millis();
        notifier.sendDeltaUpdate(QueueEvents.stateChanged(saved, now));
        notifier.sendToPlayer(QueueEvents.queueUpdated(saved, now));
        audit("queue.resume", saved, null, "resumed");
        return saved;
    }

    private TaskQueue mutate(String playerId, UnaryOperator<TaskQueue> change) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            TaskQueue current = queues.get(playerId)
                    .orElseThrow(() -> new IllegalArgumentException("No task queue for player " + playerId));
            TaskQueue next = change.apply(current);
            Optional<TaskQueue> saved = queues.save(next, current.version(), clock.millis());
            if (saved.isPresent()) {
                return saved.get();
            }
            log.debug("Version conflict writing queue for {} (attempt {}/{})", playerId, attempt, MAX_WRITE_ATTEMPTS);
        }
        throw new IllegalStateException("Queue for " + playerId + " kept changing, gave up after " + MAX_WRITE_ATTEMPTS + " attempts");
    }

    private static TaskProgress progressOf(TaskQueue queue, long now) {
        Task current = queue.currentTask();
        if (current == null) {
            return TaskProgress.idle();
        }
        long at = queue.paused() && queue.pausedAt() != null ? queue.pausedAt() : now;
        return new TaskProgress(current.id(), current.progressAt(at), current.remainingAt(at), queue.running(), queue.paused());
    }

    private void audit(String action, TaskQueue queue, String taskId, String result) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, queue.playerId(), taskId, result, Map.of("version", queue.version())));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit row {} for player {}", action, queue.playerId(), e);
        }
    }

    public record QueueStatus(String playerId, TaskQueue queue, TaskProgress progress, int queuedCount, long timestamp) {
    }
}

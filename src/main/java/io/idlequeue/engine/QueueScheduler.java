package io.idlequeue.engine;

import io.idlequeue.model.DeltaType;
import io.idlequeue.model.ItemStack;
import io.idlequeue.model.Notification;
import io.idlequeue.model.NotificationType;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.Task;
import io.idlequeue.model.TaskQueue;
import io.idlequeue.model.TaskReward;
import io.idlequeue.observability.AuditLogger;
import io.idlequeue.storage.CharacterDelta;
import io.idlequeue.storage.CharacterStore;
import io.idlequeue.storage.Database;
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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Advances every running queue by at most one completion per cycle. Driven by an external trigger.
 *
 * <p>A player is never processed twice at once inside this process, and every write is a compare-and-set on the
 * queue version, so a concurrent writer elsewhere makes this pass lose instead of clobbering its state.
 */
public final class QueueScheduler {
    private static final Logger log = LoggerFactory.getLogger(QueueScheduler.class);
    static final int DEFAULT_SCAN_LIMIT = 10_000;

    private final Database database;
    private final TaskQueueStore queues;
    private final CharacterStore characters;
    private final TaskValidator validator;
    private final ActivityRewardEngine rewards;
    private final PlayerNotifier notifier;
    private final Clock clock;
    private final AuditLogger audit;
    private final int scanLimit;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public QueueScheduler(
            Database database,
            TaskQueueStore queues,
            CharacterStore characters,
            TaskValidator validator,
            ActivityRewardEngine rewards,
            PlayerNotifier notifier,
            Clock clock,
            AuditLogger audit
    ) {
        this(database, queues, characters, validator, rewards, notifier, clock, audit, DEFAULT_SCAN_LIMIT);
    }

    public QueueScheduler(
            Database database,
            TaskQueueStore queues,
            CharacterStore characters,
            TaskValidator validator,
            ActivityRewardEngine rewards,
            PlayerNotifier notifier,
            Clock clock,
            AuditLogger audit,
            int scanLimit
    ) {
        this.database = database;
        this.queues = queues;
        this.characters = characters;
        this.validator = validator;
        this.rewards = rewards;
        this.notifier = notifier;
        this.clock = clock;
        this.audit = audit;
        this.scanLimit = Math.max(1, scanLimit);
    }

    public CycleOutcome runCycle() {
        long startedAt = clock.millis();
        List<TaskQueue> running;
        try {
            running = queues.listRunning(scanLimit);
        } catch (RuntimeException e) {
            log.warn("Scheduler cycle could not list running queues", e);
            return new CycleOutcome(0, 0, 0, 0, 0, 0, 0, 0, 1, startedAt, clock.millis());
        }
        int progressed = 0;
        int completed = 0;
        int retried = 0;
        int dropped = 0;
        int paused = 0;
        int conflicts = 0;
        int busy = 0;
        int failed = 0;
        for (TaskQueue queue : running) {
            try {
                ProcessOutcome outcome = processGuarded(queue);
                switch (outcome) {
                    case PROGRESSED -> progressed++;
                    case COMPLETED -> completed++;
                    case RETRIED -> retried++;
                    case DROPPED -> dropped++;
                    case PAUSED -> paused++;
                    case CONFLICT -> conflicts++;
                    case BUSY -> busy++;
                    case IDLE -> {
                    }
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("Failed to process queue for player {}", queue.playerId(), e);
            }
        }
        CycleOutcome outcome = new CycleOutcome(running.size(), progressed, completed, retried, dropped, paused,
                conflicts, busy, failed, startedAt, clock.millis());
        if (completed + retried + dropped + conflicts + failed > 0) {
            log.info("Scheduler cycle: {}", outcome);
        }
        return outcome;
    }

    /**
     * Processes one player's queue right now, as a sync request would.
     */
    public ProcessOutcome process(String playerId) {
        Optional<TaskQueue> queue = queues.get(playerId);
        if (queue.isEmpty()) {
            return ProcessOutcome.IDLE;
        }
        return processGuarded(queue.get());
    }

    private ProcessOutcome processGuarded(TaskQueue queue) {
        if (!inFlight.add(queue.playerId())) {
            log.debug("Queue for player {} is already being processed", queue.playerId());
            return ProcessOutcome.BUSY;
        }
        try {
            return processQueue(queue, clock.millis());
        } finally {
            inFlight.remove(queue.playerId());
        }
    }

    ProcessOutcome processQueue(TaskQueue queue, long now) {
        Task task = queue.currentTask();
        if (!queue.running() || task == null) {
            return ProcessOutcome.IDLE;
        }
        if (queue.paused()) {
            return ProcessOutcome.PAUSED;
        }
        if (task.elapsedAt(now) < task.duration()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("progress", task.progressAt(now));
            data.put("timeRemaining", task.remainingAt(now));
            notifier.sendToPlayer(Notification.of(NotificationType.TASK_PROGRESS, queue.playerId(), task.id(), data, now));
            return ProcessOutcome.PROGRESSED;
        }
        return attemptCompletion(queue, task, now);
    }

    private ProcessOutcome attemptCompletion(TaskQueue queue, Task task, long now) {
        PlayerCharacter character = characters.get(queue.playerId()).orElse(null);
        List<String> errors = new ArrayList<>();
        if (queue.config().validationEnabled()) {
            errors.addAll(validator.check(task, character).errors());
        } else if (character == null) {
            errors.add("Character not found for task " + task.id());
        }
        ExecutionOutcome outcome = null;
        if (errors.isEmpty()) {
            try {
                outcome = rewards.execute(task, character);
            } catch (RuntimeException e) {
                log.warn("Execution of task {} for player {} failed", task.id(), queue.playerId(), e);
                errors.add("Execution error: " + e.getMessage());
            }
        }
        if (outcome == null) {
            return handleFailure(queue, task, errors, now);
        }
        return complete(queue, task, outcome, now);
    }

    private ProcessOutcome complete(TaskQueue queue, Task task, ExecutionOutcome outcome, long now) {
        Task done = task.completedWith(outcome.rewards());
        TaskQueue next = queue.recordCompletion(task.duration()).promoteNext(now);
        CharacterDelta delta = toDelta(outcome.rewards());
        Optional<TaskQueue> written = database.inTransaction("complete task " + task.id(), c -> {
            Optional<TaskQueue> saved = queues.compareAndSet(c, next, queue.version(), queue.version() + 1L, now);
            if (saved.isPresent() && !characters.apply(c, queue.playerId(), delta, now)) {
                log.warn("Character {} vanished before rewards for task {} were applied", queue.playerId(), task.id());
            }
            return saved;
        });
        if (written.isEmpty()) {
            log.info("Queue for player {} moved on while completing task {}", queue.playerId(), task.id());
            return ProcessOutcome.CONFLICT;
        }
        TaskQueue saved = written.get();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task", done);
        data.put("rewards", outcome.rewards());
        data.put("nextTask", saved.currentTask());
        notifier.sendToPlayer(Notification.of(NotificationType.TASK_COMPLETED, saved.playerId(), task.id(), data, now));
        if (saved.currentTask() != null) {
            notifier.sendToPlayer(QueueEvents.taskStarted(saved, now));
        }
        notifier.sendToPlayer(QueueEvents.queueUpdated(saved, now));
        notifier.sendDeltaUpdate(QueueEvents.stateChanged(saved, now));
        audit("task.complete", saved, task, "completed", Map.of(
                "rewards", outcome.rewards().size(),
                "version", saved.version()
        ));
        log.info("Task {} completed for player {} with {} rewards", task.id(), saved.playerId(), outcome.rewards().size());
        return ProcessOutcome.COMPLETED;
    }

    private ProcessOutcome handleFailure(TaskQueue queue, Task task, List<String> errors, long now) {
        // retries already spent are compared before this failure is counted
        boolean willRetry = queue.config().retryEnabled() && task.retryCount() < task.maxRetries();
        Task attempted = task.failedAttempt(now);
        TaskQueue next = willRetry
                ? queue.withCurrentTask(attempted)
                : queue.promoteNext(now);
        Optional<TaskQueue> written = queues.save(next, queue.version(), now);
        if (written.isEmpty()) {
            log.info("Queue for player {} moved on while recording failure of task {}", queue.playerId(), task.id());
            return ProcessOutcome.CONFLICT;
        }
        TaskQueue saved = written.get();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("retryCount", attempted.retryCount());
        data.put("maxRetries", attempted.maxRetries());
        data.put("willRetry", willRetry);
        data.put("errors", List.copyOf(errors));
        notifier.sendToPlayer(Notification.of(NotificationType.TASK_FAILED, saved.playerId(), task.id(), data, now));
        if (!willRetry && saved.currentTask() != null) {
            notifier.sendToPlayer(QueueEvents.taskStarted(saved, now));
        }
        notifier.sendToPlayer(QueueEvents.queueUpdated(saved, now));
        notifier.sendDeltaUpdate(willRetry
                ? QueueEvents.delta(DeltaType.TASK_UPDATED, saved, task.id(), data, now)
                : QueueEvents.stateChanged(saved, now));
        audit(willRetry ? "task.retry" : "task.drop", saved, task, willRetry ? "retrying" : "dropped", Map.of(
                "retryCount", attempted.retryCount(),
                "errors", List.copyOf(errors)
        ));
        if (willRetry) {
            log.info("Task {} for player {} failed, retry {}/{}", task.id(), saved.playerId(),
                    attempted.retryCount(), attempted.maxRetries());
            return ProcessOutcome.RETRIED;
        }
        log.warn("Task {} for player {} dropped after {} attempts: {}", task.id(), saved.playerId(),
                attempted.retryCount(), errors);
        return ProcessOutcome.DROPPED;
    }

    static CharacterDelta toDelta(List<TaskReward> earned) {
        long experience = 0L;
        long currency = 0L;
        List<ItemStack> items = new ArrayList<>();
        for (TaskReward reward : earned) {
            switch (reward.type()) {
                case EXPERIENCE -> experience += reward.quantity();
                case CURRENCY -> currency += reward.quantity();
                case RESOURCE, ITEM -> items.add(new ItemStack(reward.itemId(), reward.quantity()));
            }
        }
        return CharacterDelta.of(experience, currency, items);
    }

    private void audit(String action, TaskQueue queue, Task task, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, queue.playerId(), task.id(), result, details));
        } catch (RuntimeException e) {
            log.warn("Failed to write audit row {} for task {}", action, task.id(), e);
        }
    }
}

package io.idlequeue.engine;

import io.idlequeue.Fixtures;
import io.idlequeue.MutableClock;
import io.idlequeue.RecordingNotifier;
import io.idlequeue.config.EngineSettings;
import io.idlequeue.config.IdleQueueConfig;
import io.idlequeue.model.DeltaType;
import io.idlequeue.model.NotificationType;
import io.idlequeue.model.Task;
import io.idlequeue.model.TaskQueue;
import io.idlequeue.observability.AuditLogger;
import io.idlequeue.storage.CharacterStore;
import io.idlequeue.storage.Database;
import io.idlequeue.storage.TaskQueueStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class TaskQueueServiceTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void firstTaskStartsImmediatelyAndLaterOnesQueue() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            Harness h = new Harness(root, EngineSettings.defaults());

            TaskQueue afterFirst = h.service.addTask("p1", Fixtures.harvestTask("h-1", 10_000L));
            Assertions.assertTrue(afterFirst.running());
            Assertions.assertEquals("h-1", afterFirst.currentTask().id());
            Assertions.assertEquals(T0, afterFirst.currentTask().startTime());
            Assertions.assertEquals(2L, afterFirst.version());

            h.clock.advance(100L);
            TaskQueue afterSecond = h.service.addTask("p1", Fixtures.craftTask("c-1", 10_000L));
            Assertions.assertEquals("h-1", afterSecond.currentTask().id());
            Assertions.assertEquals(1, afterSecond.queuedTasks().size());
            Assertions.assertEquals(3L, afterSecond.version());

            Assertions.assertEquals(1, h.notifier.ofType(NotificationType.TASK_STARTED).size());
            Assertions.assertEquals(2, h.notifier.ofType(NotificationType.QUEUE_UPDATED).size());
            Assertions.assertEquals(2, h.notifier.deltas.size());
            Assertions.assertEquals(DeltaType.TASK_ADDED, h.notifier.deltas.get(1).type());
            Assertions.assertEquals("c-1", h.notifier.deltas.get(1).taskId());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void rejectsDuplicatesAndFullQueues() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            EngineSettings small = new EngineSettings(2, true, 3, true, true, 90_000L, 1_800_000L, 1440,
                    86_400_000L, 3, 25L);
            Harness h = new Harness(root, small);
            h.service.addTask("p1", Fixtures.harvestTask("t-1", 10_000L));
            h.service.addTask("p1", Fixtures.harvestTask("t-2", 10_000L));
            h.service.addTask("p1", Fixtures.harvestTask("t-3", 10_000L));

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> h.service.addTask("p1", Fixtures.harvestTask("t-2", 10_000L)));
            QueueFullException full = Assertions.assertThrows(QueueFullException.class,
                    () -> h.service.addTask("p1", Fixtures.harvestTask("t-4", 10_000L)));
            Assertions.assertEquals(2, full.maxQueueSize());
            Assertions.assertEquals(3, h.queues.get("p1").orElseThrow().size());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void removingCurrentTaskPromotesNext() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            Harness h = new Harness(root, EngineSettings.defaults());
            h.service.addTask("p1", Fixtures.harvestTask("t-1", 10_000L));
            h.service.addTask("p1", Fixtures.harvestTask("t-2", 10_000L));
            h.service.addTask("p1", Fixtures.harvestTask("t-3", 10_000L));

            h.clock.advance(2_000L);
            TaskQueue removedQueued = h.service.removeTask("p1", "t-3");
            Assertions.assertEquals(1, removedQueued.queuedTasks().size());

            TaskQueue removedCurrent = h.service.removeTask("p1", "t-1");
            Assertions.assertEquals("t-2", removedCurrent.currentTask().id());
            Assertions.assertEquals(h.clock.millis(), removedCurrent.currentTask().startTime());
            Assertions.assertTrue(removedCurrent.queuedTasks().isEmpty());

            Assertions.assertThrows(IllegalArgumentException.class, () -> h.service.removeTask("p1", "t-9"));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void resumeShiftsStartTimeByPausedDuration() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            Harness h = new Harness(root, EngineSettings.defaults());
            h.service.addTask("p1", Fixtures.harvestTask("t-1", 10_000L));

            h.clock.advance(3_000L);
            TaskQueue paused = h.service.pause("p1");
            Assertions.assertTrue(paused.paused());
            Assertions.assertEquals(T0 + 3_000L, paused.pausedAt());

            h.clock.advance(5_000L);
            TaskQueueService.QueueStatus whilePaused = h.service.status("p1");
            Assertions.assertEquals(0.3d, whilePaused.progress().progress(), 1e-9);
            Assertions.assertTrue(whilePaused.progress().paused());

            TaskQueue resumed = h.service.resume("p1");
            Assertions.assertFalse(resumed.paused());
            Assertions.assertNull(resumed.pausedAt());
            Assertions.assertEquals(T0 + 5_000L, resumed.currentTask().startTime());
            Assertions.assertEquals(0.3d, h.service.status("p1").progress().progress(), 1e-9);
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void removingCurrentTaskWhilePausedDoesNotCarryOldPauseIntoNextTask() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            Harness h = new Harness(root, EngineSettings.defaults());
            h.service.addTask("p1", Fixtures.harvestTask("a", 10_000L));
            h.service.addTask("p1", Fixtures.harvestTask("b", 10_000L));
            h.service.pause("p1");

            h.clock.advance(60_000L);
            TaskQueue removed = h.service.removeTask("p1", "a");
            Assertions.assertTrue(removed.paused());
            Assertions.assertEquals(T0 + 60_000L, removed.pausedAt());
            Assertions.assertEquals(T0 + 60_000L, removed.currentTask().startTime());

            h.clock.advance(1_000L);
            TaskQueue resumed = h.service.resume("p1");
            Assertions.assertEquals("b", resumed.currentTask().id());
            Assertions.assertEquals(T0 + 61_000L, resumed.currentTask().startTime());
            Assertions.assertEquals(0.0d, h.service.status("p1").progress().progress(), 1e-9);

            h.clock.advance(5_000L);
            Assertions.assertEquals(0.5d, h.service.status("p1").progress().progress(), 1e-9);
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void addedTasksTakeTheQueueRetryBudget() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            Harness h = new Harness(root, EngineSettings.defaults());
            h.characters.put(Fixtures.character("p1", 1), T0);
            Task unset = Task.create("f-1", "Fight", 1_000L, Fixtures.combat(20, 1), 0);
            Task greedy = Task.create("h-1", "Dig", 1_000L, Fixtures.harvesting(), 9);

            h.service.addTask("p1", unset);
            TaskQueue queue = h.service.addTask("p1", greedy);
            Assertions.assertEquals(3, queue.currentTask().maxRetries());
            Assertions.assertEquals(3, queue.queuedTasks().get(0).maxRetries());

            h.clock.advance(1_000L);
            h.service.sync("p1");
            Task retried = h.queues.get("p1").orElseThrow().currentTask();
            Assertions.assertEquals("f-1", retried.id());
            Assertions.assertEquals(1, retried.retryCount());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void pauseRequiresARunningQueue() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            Harness h = new Harness(root, EngineSettings.defaults());
            h.service.sync("p1");
            Assertions.assertThrows(IllegalStateException.class, () -> h.service.pause("p1"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> h.service.pause("nobody"));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void stopClearsTasksButKeepsCounters() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            Harness h = new Harness(root, EngineSettings.defaults());
            h.characters.put(Fixtures.character("p1", 1), T0);
            h.service.addTask("p1", Fixtures.harvestTask("t-1", 1_000L));
            h.service.addTask("p1", Fixtures.harvestTask("t-2", 1_000L));
            h.clock.advance(1_000L);
            h.service.sync("p1");

            TaskQueue stopped = h.service.stopTasks("p1");

            Assertions.assertFalse(stopped.running());
            Assertions.assertNull(stopped.currentTask());
            Assertions.assertTrue(stopped.queuedTasks().isEmpty());
            Assertions.assertEquals(1L, stopped.totalTasksCompleted());
            Assertions.assertEquals(DeltaType.QUEUE_STATE_CHANGED,
                    h.notifier.deltas.get(h.notifier.deltas.size() - 1).type());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void syncCreatesQueueAndStampsSyncTime() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-service-");
        try {
            Harness h = new Harness(root, EngineSettings.defaults());
            Assertions.assertNull(h.service.status("p1").queue());
            Assertions.assertEquals(0, h.service.status("p1").queuedCount());

            h.clock.advance(42L);
            TaskQueue synced = h.service.sync("p1");

            Assertions.assertFalse(synced.running());
            Assertions.assertEquals(T0 + 42L, synced.lastSynced());
            Assertions.assertEquals(2L, synced.version());
            Assertions.assertTrue(h.service.getQueue("p1").isPresent());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    private static final class Harness {
        final MutableClock clock = new MutableClock(T0);
        final RecordingNotifier notifier = new RecordingNotifier();
        final TaskQueueStore queues;
        final CharacterStore characters;
        final TaskQueueService service;

        Harness(Path root, EngineSettings settings) {
            IdleQueueConfig config = IdleQueueConfig.fromRoot(root.toString());
            Database database = Fixtures.database(root);
            AuditLogger audit = new AuditLogger(config.auditFile(), clock);
            this.queues = new TaskQueueStore(database);
            this.characters = new CharacterStore(database);
            QueueScheduler scheduler = new QueueScheduler(database, queues, characters, new TaskValidator(),
                    new ActivityRewardEngine(Fixtures.draws(0.0, 0.99)), notifier, clock, audit);
            this.service = new TaskQueueService(queues, scheduler, notifier, settings, clock, audit);
        }
    }
}

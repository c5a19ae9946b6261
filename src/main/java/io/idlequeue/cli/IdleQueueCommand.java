package io.idlequeue.cli;

import io.idlequeue.config.IdleQueueConfig;
import io.idlequeue.engine.CycleOutcome;
import io.idlequeue.engine.OfflineProgressCalculator;
import io.idlequeue.engine.ProcessOutcome;
import io.idlequeue.engine.TaskQueueService;
import io.idlequeue.model.ClientConnection;
import io.idlequeue.model.ConflictType;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.ResolutionStrategy;
import io.idlequeue.model.Task;
import io.idlequeue.model.TaskQueue;
import io.idlequeue.runtime.IdleQueueRuntime;
import io.idlequeue.storage.ConnectionStore;
import io.idlequeue.sync.ConflictResolutionRequest;
import io.idlequeue.sync.HeartbeatRequest;
import io.idlequeue.sync.SyncCategory;
import io.idlequeue.sync.SyncRequest;
import io.idlequeue.sync.SyncResponse;
import io.idlequeue.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

@Command(
        name = "idlequeue",
        mixinStandardHelpOptions = true,
        description = "Idle-game task queue engine CLI",
        subcommands = {
                IdleQueueCommand.InitCommand.class,
                IdleQueueCommand.CharacterPutCommand.class,
                IdleQueueCommand.CharacterCommand.class,
                IdleQueueCommand.AddTaskCommand.class,
                IdleQueueCommand.RemoveTaskCommand.class,
                IdleQueueCommand.QueueCommand.class,
                IdleQueueCommand.SyncCommand.class,
                IdleQueueCommand.StopCommand.class,
                IdleQueueCommand.PauseCommand.class,
                IdleQueueCommand.ResumeCommand.class,
                IdleQueueCommand.TickCommand.class,
                IdleQueueCommand.CatchUpCommand.class,
                IdleQueueCommand.ConnectCommand.class,
                IdleQueueCommand.DisconnectCommand.class,
                IdleQueueCommand.HeartbeatCommand.class,
                IdleQueueCommand.ClientSyncCommand.class,
                IdleQueueCommand.CleanupConnectionsCommand.class,
                IdleQueueCommand.ConflictsCommand.class,
                IdleQueueCommand.ResolveConflictCommand.class,
                IdleQueueCommand.AuditTailCommand.class,
                IdleQueueCommand.AuditVerifyCommand.class
        }
)
public final class IdleQueueCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = IdleQueueConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | character-put | character | add-task | remove-task | queue | sync | stop | pause | resume | tick | catch-up | connect | disconnect | heartbeat | client-sync | cleanup-connections | conflicts | resolve-conflict | audit-tail | audit-verify");
    }

    IdleQueueRuntime runtime() {
        IdleQueueRuntime runtime = new IdleQueueRuntime(IdleQueueConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static long now() {
        return Clock.systemUTC().millis();
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Override
        public Integer call() {
            IdleQueueRuntime runtime = parent.runtime();
            System.out.println("Initialized idlequeue at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "character-put", description = "Create or replace a character from a JSON file")
    static final class CharacterPutCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--file"}, required = true, description = "Character JSON file path")
        String file;

        @Override
        public Integer call() throws Exception {
            IdleQueueRuntime runtime = parent.runtime();
            PlayerCharacter character = Jsons.mapper().readValue(Path.of(file).toFile(), PlayerCharacter.class);
            runtime.characters().put(character, now());
            System.out.println(Jsons.toJson(runtime.characters().get(character.userId()).orElse(character)));
            return 0;
        }
    }

    @Command(name = "character", description = "Show a character and its inventory")
    static final class CharacterCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            IdleQueueRuntime runtime = parent.runtime();
            Optional<PlayerCharacter> character = runtime.characters().get(player);
            if (character.isEmpty()) {
                System.err.println("Character not found: " + player);
                return 2;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("character", character.get());
            out.put("inventory", runtime.characters().inventory(player));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "add-task", description = "Queue a task read from a JSON file")
    static final class AddTaskCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Option(names = {"--file"}, required = true, description = "Task JSON file path")
        String file;

        @Override
        public Integer call() throws Exception {
            IdleQueueRuntime runtime = parent.runtime();
            Task task = Jsons.mapper().readValue(Path.of(file).toFile(), Task.class);
            TaskQueue queue = runtime.queueService().addTask(player, task);
            System.out.println(Jsons.toJson(queue));
            return 0;
        }
    }

    @Command(name = "remove-task", description = "Remove a task from a player's queue")
    static final class RemoveTaskCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Option(names = {"--task"}, required = true, description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().queueService().removeTask(player, taskId)));
            return 0;
        }
    }

    @Command(name = "queue", description = "Show queue status and current task progress")
    static final class QueueCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            TaskQueueService.QueueStatus status = parent.runtime().queueService().status(player);
            System.out.println(Jsons.toJson(status));
            return 0;
        }
    }

    @Command(name = "sync", description = "Create the queue if needed, advance it once and stamp the sync time")
    static final class SyncCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().queueService().sync(player)));
            return 0;
        }
    }

    @Command(name = "stop", description = "Drop the current and all queued tasks")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().queueService().stopTasks(player)));
            return 0;
        }
    }

    @Command(name = "pause", description = "Pause a running queue")
    static final class PauseCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().queueService().pause(player)));
            return 0;
        }
    }

    @Command(name = "resume", description = "Resume a paused queue")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().queueService().resume(player)));
            return 0;
        }
    }

    @Command(name = "tick", description = "Run scheduler cycles over every running queue")
    static final class TickCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, description = "Process only this player's queue")
        String player;

        @Option(names = {"--loops"}, defaultValue = "1", description = "Number of cycles to run")
        int loops;

        @Option(names = {"--interval-ms"}, defaultValue = "1000", description = "Pause between cycles")
        long intervalMs;

        @Override
        public Integer call() throws Exception {
            IdleQueueRuntime runtime = parent.runtime();
            if (player != null && !player.isBlank()) {
                ProcessOutcome outcome = runtime.scheduler().process(player);
                System.out.println(Jsons.toJson(Map.of("playerId", player, "outcome", outcome)));
                return 0;
            }
            int n = Math.max(1, loops);
            for (int i = 0; i < n; i++) {
                CycleOutcome outcome = runtime.scheduler().runCycle();
                System.out.println(Jsons.toJson(outcome));
                if (i + 1 < n) {
                    Thread.sleep(Math.max(0L, intervalMs));
                }
            }
            return 0;
        }
    }

    @Command(name = "catch-up", description = "Apply offline progress for a returning player")
    static final class CatchUpCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            OfflineProgressCalculator.OfflineResult result = parent.runtime().offline().calculate(player);
            System.out.println(Jsons.toJson(result));
            return 0;
        }
    }

    @Command(name = "connect", description = "Register a client connection")
    static final class ConnectCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--connection"}, required = true, description = "Connection id")
        String connectionId;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            Optional<ClientConnection> stored = parent.runtime().sync().storeConnection(connectionId, player);
            if (stored.isEmpty()) {
                System.err.println("Failed to store connection " + connectionId);
                return 1;
            }
            System.out.println(Jsons.toJson(stored.get()));
            return 0;
        }
    }

    @Command(name = "disconnect", description = "Remove a client connection")
    static final class DisconnectCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--connection"}, required = true, description = "Connection id")
        String connectionId;

        @Override
        public Integer call() {
            boolean removed = parent.runtime().sync().removeConnection(connectionId);
            System.out.println(Jsons.toJson(Map.of("connectionId", connectionId, "removed", removed)));
            return removed ? 0 : 2;
        }
    }

    @Command(name = "heartbeat", description = "Record a client heartbeat")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--connection"}, required = true, description = "Connection id")
        String connectionId;

        @Option(names = {"--queue-version"}, defaultValue = "0", description = "Queue version the client holds")
        long queueVersion;

        @Override
        public Integer call() {
            boolean ok = parent.runtime().sync().handleHeartbeat(connectionId, new HeartbeatRequest(now(), queueVersion));
            System.out.println(Jsons.toJson(Map.of("connectionId", connectionId, "recorded", ok)));
            return ok ? 0 : 2;
        }
    }

    @Command(name = "client-sync", description = "Answer a client sync request")
    static final class ClientSyncCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--connection"}, required = true, description = "Connection id")
        String connectionId;

        @Option(names = {"--queue-version"}, defaultValue = "0", description = "Queue version the client holds")
        long queueVersion;

        @Option(names = {"--since"}, defaultValue = "0", description = "Last sync timestamp in epoch millis")
        long since;

        @Option(names = {"--data"}, split = ",", description = "Categories: queue,progress,character,notifications")
        List<String> data;

        @Override
        public Integer call() {
            Set<SyncCategory> categories = new LinkedHashSet<>();
            if (data != null) {
                for (String raw : data) {
                    categories.add(SyncCategory.fromString(raw));
                }
            }
            Optional<SyncResponse> response = parent.runtime().sync()
                    .handleSyncRequest(connectionId, new SyncRequest(since, queueVersion, categories));
            if (response.isEmpty()) {
                System.err.println("Sync request failed for connection " + connectionId);
                return 1;
            }
            System.out.println(Jsons.toJson(response.get()));
            return 0;
        }
    }

    @Command(name = "cleanup-connections", description = "Mark stale connections unhealthy and delete expired ones")
    static final class CleanupConnectionsCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Override
        public Integer call() {
            ConnectionStore.StaleSweep sweep = parent.runtime().sync().cleanupStaleConnections();
            System.out.println(Jsons.toJson(sweep));
            return 0;
        }
    }

    @Command(name = "conflicts", description = "Detect queue version conflicts across a player's connections")
    static final class ConflictsCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--player"}, required = true, description = "Player id")
        String player;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().sync().detectConnectionConflicts(player)));
            return 0;
        }
    }

    @Command(name = "resolve-conflict", description = "Resolve a queue state conflict reported by a client")
    static final class ResolveConflictCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--connection"}, required = true, description = "Connection id")
        String connectionId;

        @Option(names = {"--conflict"}, required = true, description = "Conflict id")
        String conflictId;

        @Option(names = {"--type"}, defaultValue = "queue_state_changed", description = "Conflict type")
        String type;

        @Option(names = {"--resolution"}, description = "server_wins | client_wins | merge")
        String resolution;

        @Option(names = {"--server-value"}, description = "Server value as seen by the client")
        Long serverValue;

        @Option(names = {"--client-value"}, description = "Client value")
        Long clientValue;

        @Override
        public Integer call() {
            ConflictResolutionRequest request = new ConflictResolutionRequest(
                    conflictId,
                    ConflictType.fromString(type),
                    serverValue,
                    clientValue,
                    resolution == null ? null : ResolutionStrategy.fromString(resolution)
            );
            Optional<TaskQueue> resolved = parent.runtime().sync().handleConflictResolution(connectionId, request);
            if (resolved.isEmpty()) {
                System.err.println("Conflict " + conflictId + " could not be resolved");
                return 1;
            }
            System.out.println(Jsons.toJson(resolved.get()));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show the latest audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().audit().tail(limit)));
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        IdleQueueCommand parent;

        @Override
        public Integer call() {
            int broken = parent.runtime().audit().verify();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("valid", broken == 0);
            out.put("firstBrokenLine", broken);
            System.out.println(Jsons.toJson(out));
            return broken == 0 ? 0 : 3;
        }
    }
}

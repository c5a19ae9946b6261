package io.idlequeue.sync;

import io.idlequeue.config.EngineSettings;
import io.idlequeue.model.ClientConnection;
import io.idlequeue.model.Conflict;
import io.idlequeue.model.ConflictType;
import io.idlequeue.model.DeltaUpdate;
import io.idlequeue.model.Notification;
import io.idlequeue.model.NotificationType;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.ResolutionStrategy;
import io.idlequeue.model.Task;
import io.idlequeue.model.TaskProgress;
import io.idlequeue.model.TaskQueue;
import io.idlequeue.notify.ConnectionGoneException;
import io.idlequeue.notify.NotificationChannel;
import io.idlequeue.notify.NotificationDeliveryException;
import io.idlequeue.observability.AuditLogger;
import io.idlequeue.storage.CharacterStore;
import io.idlequeue.storage.ConnectionStore;
import io.idlequeue.storage.NotificationStore;
import io.idlequeue.storage.TaskQueueStore;
import io.idlequeue.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keeps every connection a player has open in step with the stored queue.
 *
 * <p>Every public operation logs and swallows its own failures so a broken connection or a store hiccup never
 * propagates into the caller's request or scheduler cycle.
 *
 * <p>Fan-out sends to one connection after another, so the channel is expected to return quickly.
 */
public final class SyncProtocol implements PlayerNotifier {
    private static final Logger log = LoggerFactory.getLogger(SyncProtocol.class);

    private final ConnectionStore connections;
    private final NotificationStore pending;
    private final TaskQueueStore queues;
    private final CharacterStore characters;
    private final NotificationChannel channel;
    private final EngineSettings settings;
    private final Clock clock;
    private final AuditLogger audit;
    private final Map<ConflictType, ResolutionStrategy> strategies;

    public SyncProtocol(
            ConnectionStore connections,
            NotificationStore pending,
            TaskQueueStore queues,
            CharacterStore characters,
            NotificationChannel channel,
            EngineSettings settings,
            Clock clock,
            AuditLogger audit
    ) {
        this(connections, pending, queues, characters, channel, settings, clock, audit, defaultStrategies());
    }

    public SyncProtocol(
            ConnectionStore connections,
            NotificationStore pending,
            TaskQueueStore queues,
            CharacterStore characters,
            NotificationChannel channel,
            EngineSettings settings,
            Clock clock,
            AuditLogger audit,
            Map<ConflictType, ResolutionStrategy> strategies
    ) {
        this.connections = connections;
        this.pending = pending;
        this.queues = queues;
        this.characters = characters;
        this.channel = channel;
        this.settings = settings;
        this.clock = clock;
        this.audit = audit;
        this.strategies = new EnumMap<>(defaultStrategies());
        if (strategies != null) {
            this.strategies.putAll(strategies);
        }
    }

    public static Map<ConflictType, ResolutionStrategy> defaultStrategies() {
        Map<ConflictType, ResolutionStrategy> out = new EnumMap<>(ConflictType.class);
        out.put(ConflictType.QUEUE_STATE_CHANGED, ResolutionStrategy.SERVER_WINS);
        out.put(ConflictType.TASK_MODIFIED, ResolutionStrategy.MERGE);
        out.put(ConflictType.TASK_ADDED, ResolutionStrategy.CLIENT_WINS);
        out.put(ConflictType.TASK_REMOVED, ResolutionStrategy.SERVER_WINS);
        return out;
    }

    public Optional<ClientConnection> storeConnection(String connectionId, String playerId) {
        try {
            ClientConnection connection = ClientConnection.open(connectionId, playerId, clock.millis());
            connections.put(connection);
            log.info("Connection {} opened for player {}", connectionId, playerId);
            return Optional.of(connection);
        } catch (RuntimeException e) {
            log.warn("Failed to store connection {} for player {}", connectionId, playerId, e);
            return Optional.empty();
        }
    }

    public boolean removeConnection(String connectionId) {
        try {
            boolean removed = connections.delete(connectionId);
            if (removed) {
                log.info("Connection {} closed", connectionId);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("Failed to remove connection {}", connectionId, e);
            return false;
        }
    }

    public boolean handleHeartbeat(String connectionId, HeartbeatRequest request) {
        try {
            long now = clock.millis();
            if (!connections.recordHeartbeat(connectionId, request.queueVersion(), now)) {
                log.warn("Heartbeat from unknown connection {}", connectionId);
                return false;
            }
            Optional<ClientConnection> connection = connections.get(connectionId);
            if (connection.isEmpty()) {
                return false;
            }
            long serverVersion = queues.version(connection.get().playerId());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("serverTime", now);
            data.put("clientTime", request.timestamp());
            data.put("clientVersion", request.queueVersion());
            data.put("serverVersion", serverVersion);
            data.put("inSync", serverVersion == request.queueVersion());
            Notification reply = Notification.of(NotificationType.HEARTBEAT_RESPONSE, connection.get().playerId(), null, data, now);
            deliver(connectionId, reply);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to handle heartbeat from {}", connectionId, e);
            return false;
        }
    }

    public ConnectionStore.StaleSweep cleanupStaleConnections() {
        try {
            long now = clock.millis();
            ConnectionStore.StaleSweep sweep = connections.sweepStale(
                    now - settings.heartbeatStaleMs(),
                    now - settings.connectionExpireMs()
            );
            int purged = pending.purgeExpired(now);
            if (sweep.markedUnhealthy() > 0 || sweep.deleted() > 0 || purged > 0) {
                log.info("Connection sweep: {} marked unhealthy, {} deleted, {} expired notifications purged",
                        sweep.markedUnhealthy(), sweep.deleted(), purged);
            }
            return sweep;
        } catch (RuntimeException e) {
            log.warn("Failed to clean up stale connections", e);
            return new ConnectionStore.StaleSweep(0, 0);
        }
    }

    @Override
    public int sendToPlayer(Notification notification) {
        return sendToPlayer(notification, null);
    }

    /**
     * Fans the notification out to every connection of its player except {@code excludeConnectionId}.
     * A player with no connections at all gets the notification stored for the next sync. Returns the number
     * of connections it reached.
     */
    public int sendToPlayer(Notification notification, String excludeConnectionId) {
        try {
            List<ClientConnection> targets = connections.listByPlayer(notification.playerId());
            if (targets.isEmpty()) {
                long now = clock.millis();
                pending.store(notification, now, now + settings.pendingNotificationTtlMs());
                log.debug("Player {} has no connections, stored {} for later", notification.playerId(), notification.type().wireName());
                return 0;
            }
            int delivered = 0;
            for (ClientConnection target : targets) {
                if (target.connectionId().equals(excludeConnectionId)) {
                    continue;
                }
                if (deliver(target.connectionId(), notification)) {
                    delivered++;
                }
            }
            return delivered;
        } catch (RuntimeException e) {
            log.warn("Failed to send {} to player {}", notification.type().wireName(), notification.playerId(), e);
            return 0;
        }
    }

    @Override
    public int sendDeltaUpdate(DeltaUpdate delta) {
        return sendToPlayer(deltaNotification(delta), null);
    }

    /**
     * Relays a delta produced by one client to the player's other connections. The origin never receives its own delta.
     */
    public int handleDeltaUpdate(String connectionId, DeltaUpdate delta) {
        try {
            Optional<ClientConnection> origin = connections.get(connectionId);
            if (origin.isEmpty()) {
                log.warn("Delta update from unknown connection {}", connectionId);
                return 0;
            }
            if (delta == null || delta.type() == null || delta.timestamp() <= 0L
                    || !origin.get().playerId().equals(delta.playerId())) {
                log.warn("Rejected invalid delta update from connection {}", connectionId);
                return 0;
            }
            connections.touch(connectionId, clock.millis());
            if (delta.version() > origin.get().queueVersion()) {
                connections.updateQueueVersion(connectionId, delta.version());
            }
            return sendToPlayer(deltaNotification(delta), connectionId);
        } catch (RuntimeException e) {
            log.warn("Failed to handle delta update from {}", connectionId, e);
            return 0;
        }
    }

    public Optional<SyncResponse> handleSyncRequest(String connectionId, SyncRequest request) {
        try {
            Optional<ClientConnection> connection = connections.get(connectionId);
            if (connection.isEmpty()) {
                log.warn("Sync request from unknown connection {}", connectionId);
                return Optional.empty();
            }
            long now = clock.millis();
            String playerId = connection.get().playerId();
            connections.touch(connectionId, now);
            Set<SyncCategory> wanted = request.requestedData().isEmpty() ? SyncCategory.all() : request.requestedData();

            Optional<TaskQueue> queue = queues.get(playerId);
            long serverVersion = queue.map(TaskQueue::version).orElse(0L);
            String checksum = queue.map(TaskQueue::checksum).orElse("");
            boolean fullSync = request.queueVersion() != serverVersion;

            TaskQueue queueSnapshot = wanted.contains(SyncCategory.QUEUE) && fullSync ? queue.orElse(null) : null;
            TaskProgress progress = wanted.contains(SyncCategory.PROGRESS)
                    ? queue.map(q -> progressOf(q, now)).orElse(TaskProgress.idle())
                    : null;
            PlayerCharacter character = wanted.contains(SyncCategory.CHARACTER)
                    ? characters.get(playerId).orElse(null)
                    : null;
            List<Notification> held = wanted.contains(SyncCategory.NOTIFICATIONS)
                    ? pending.drain(playerId, now)
                    : List.of();

            SyncResponse response = new SyncResponse(queueSnapshot, progress, character, held,
                    serverVersion, checksum, fullSync, now);
            connections.updateQueueVersion(connectionId, serverVersion);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("response", response);
            deliver(connectionId, Notification.of(NotificationType.SYNC_RESPONSE, playerId, null, data, now));
            return Optional.of(response);
        } catch (RuntimeException e) {
            log.warn("Failed to handle sync request from {}", connectionId, e);
            return Optional.empty();
        }
    }

    /**
     * One queue_state_changed conflict when the player's connections report different queue versions.
     */
    public List<Conflict> detectConnectionConflicts(String playerId) {
        try {
            TreeSet<Long> versions = new TreeSet<>();
            for (ClientConnection connection : connections.listByPlayer(playerId)) {
                versions.add(connection.queueVersion());
            }
            if (versions.size() <= 1) {
                return List.of();
            }
            Conflict conflict = Conflict.detected(ConflictType.QUEUE_STATE_CHANGED, versions.last(), versions.first(), clock.millis());
            log.info("Player {} has divergent connection versions {}", playerId, versions);
            return List.of(conflict);
        } catch (RuntimeException e) {
            log.warn("Failed to detect conflicts for player {}", playerId, e);
            return List.of();
        }
    }

    public Optional<TaskQueue> handleConflictResolution(String connectionId, ConflictResolutionRequest request) {
        try {
            Optional<ClientConnection> connection = connections.get(connectionId);
            if (connection.isEmpty()) {
                log.warn("Conflict resolution from unknown connection {}", connectionId);
                return Optional.empty();
            }
            String playerId = connection.get().playerId();
            Optional<TaskQueue> stored = queues.get(playerId);
            if (stored.isEmpty()) {
                log.warn("Conflict resolution for player {} without a queue", playerId);
                return Optional.empty();
            }
            ResolutionStrategy strategy = request.resolution() != null
                    ? request.resolution()
                    : strategies.get(request.type());
            TaskQueue current = stored.get();
            TaskQueue resolved = resolve(current, request, strategy);

            long maxVersion = current.version();
            List<ClientConnection> peers = connections.listByPlayer(playerId);
            for (ClientConnection peer : peers) {
                maxVersion = Math.max(maxVersion, peer.queueVersion());
            }
            if (request.type() == ConflictType.QUEUE_STATE_CHANGED) {
                maxVersion = Math.max(maxVersion, asVersion(request.serverValue()));
                maxVersion = Math.max(maxVersion, asVersion(request.clientValue()));
            }
            long now = clock.millis();
            Optional<TaskQueue> written = queues.compareAndSet(resolved, current.version(), maxVersion + 1L, now);
            if (written.isEmpty()) {
                log.warn("Queue for player {} changed while resolving conflict {}", playerId, request.conflictId());
                return Optional.empty();
            }
            TaskQueue result = written.get();
            connections.updateQueueVersion(connectionId, result.version());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("conflictId", request.conflictId());
            data.put("conflictType", request.type().wireName());
            data.put("resolution", strategy.wireName());
            data.put("version", result.version());
            data.put("checksum", result.checksum());
            data.put("queue", result);
            sendToPlayer(Notification.of(NotificationType.CONFLICT_RESOLUTION, playerId, null, data, now), connectionId);
            if (audit != null) {
                audit.log(AuditLogger.AuditEvent.of("conflict.resolve", playerId, null, strategy.wireName(), Map.of(
                        "conflictId", String.valueOf(request.conflictId()),
                        "type", request.type().wireName(),
                        "version", result.version()
                )));
            }
            return Optional.of(result);
        } catch (RuntimeException e) {
            log.warn("Failed to resolve conflict {} from {}", request.conflictId(), connectionId, e);
            return Optional.empty();
        }
    }

    public List<Notification> pendingNotifications(String playerId) {
        try {
            return pending.drain(playerId, clock.millis());
        } catch (RuntimeException e) {
            log.warn("Failed to drain pending notifications for {}", playerId, e);
            return List.of();
        }
    }

    TaskQueue resolve(TaskQueue current, ConflictResolutionRequest request, ResolutionStrategy strategy) {
        if (request.type() == ConflictType.QUEUE_STATE_CHANGED || strategy == ResolutionStrategy.SERVER_WINS) {
            return current;
        }
        return switch (request.type()) {
            case TASK_MODIFIED -> {
                Task client = asTask(request.clientValue());
                Task server = request.serverValue() == null ? findTask(current, client.id()) : asTask(request.serverValue());
                Task winner = strategy == ResolutionStrategy.MERGE && server != null
                        ? TaskMerger.merge(server, client)
                        : client;
                yield replaceTask(current, winner);
            }
            case TASK_ADDED -> {
                Task client = asTask(request.clientValue());
                client = client.withMaxRetries(current.config().retryBudget(client.maxRetries()));
                if (current.contains(client.id()) || current.queuedTasks().size() >= current.config().maxQueueSize()) {
                    yield current;
                }
                yield current.running()
                        ? current.enqueue(client)
                        : current.withCurrentTask(client.startedAt(clock.millis()));
            }
            case TASK_REMOVED -> {
                String taskId = asTask(request.serverValue() == null ? request.clientValue() : request.serverValue()).id();
                yield removeTask(current, taskId, clock.millis());
            }
            case QUEUE_STATE_CHANGED -> current;
        };
    }

    private TaskProgress progressOf(TaskQueue queue, long now) {
        Task current = queue.currentTask();
        if (current == null) {
            return TaskProgress.idle();
        }
        long at = queue.paused() && queue.pausedAt() != null ? queue.pausedAt() : now;
        return new TaskProgress(current.id(), current.progressAt(at), current.remainingAt(at), queue.running(), queue.paused());
    }

    private boolean deliver(String connectionId, Notification notification) {
        try {
            channel.send(connectionId, Jsons.toCompactJson(notification));
            return true;
        } catch (ConnectionGoneException e) {
            log.info("Connection {} is gone, removing it", connectionId);
            try {
                connections.delete(connectionId);
            } catch (RuntimeException deleteFailure) {
                log.warn("Failed to remove gone connection {}", connectionId, deleteFailure);
            }
            return false;
        } catch (NotificationDeliveryException e) {
            log.warn("Failed to deliver {} to connection {}", notification.type().wireName(), connectionId, e);
            return false;
        } catch (RuntimeException e) {
            log.warn("Unexpected error delivering {} to connection {}", notification.type().wireName(), connectionId, e);
            return false;
        }
    }

    private static Notification deltaNotification(DeltaUpdate delta) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("delta", delta);
        return Notification.of(NotificationType.DELTA_UPDATE, delta.playerId(), delta.taskId(), data, delta.timestamp());
    }

    private static Task asTask(Object value) {
        if (value instanceof Task) {
            return (Task) value;
        }
        return Jsons.mapper().convertValue(value, Task.class);
    }

    private static long asVersion(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    private static Task findTask(TaskQueue queue, String taskId) {
        if (queue.currentTask() != null && queue.currentTask().id().equals(taskId)) {
            return queue.currentTask();
        }
        for (Task task : queue.queuedTasks()) {
            if (task.id().equals(taskId)) {
                return task;
            }
        }
        return null;
    }

    private static TaskQueue replaceTask(TaskQueue queue, Task replacement) {
        if (queue.currentTask() != null && queue.currentTask().id().equals(replacement.id())) {
            return queue.withCurrentTask(replacement);
        }
        List<Task> next = new ArrayList<>();
        for (Task task : queue.queuedTasks()) {
            next.add(task.id().equals(replacement.id()) ? replacement : task);
        }
        return queue.withQueuedTasks(next);
    }

    static TaskQueue removeTask(TaskQueue queue, String taskId, long nowMs) {
        if (queue.currentTask() != null && queue.currentTask().id().equals(taskId)) {
            return queue.promoteNext(nowMs);
        }
        List<Task> next = new ArrayList<>();
        for (Task task : queue.queuedTasks()) {
            if (!task.id().equals(taskId)) {
                next.add(task);
            }
        }
        return queue.withQueuedTasks(next);
    }
}

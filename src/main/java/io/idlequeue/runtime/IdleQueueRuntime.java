package io.idlequeue.runtime;

import io.idlequeue.config.EngineSettings;
import io.idlequeue.config.IdleQueueConfig;
import io.idlequeue.engine.ActivityRewardEngine;
import io.idlequeue.engine.OfflineProgressCalculator;
import io.idlequeue.engine.QueueScheduler;
import io.idlequeue.engine.TaskQueueService;
import io.idlequeue.engine.TaskValidator;
import io.idlequeue.model.DeltaUpdate;
import io.idlequeue.model.Notification;
import io.idlequeue.notify.FileOutboxChannel;
import io.idlequeue.observability.AuditLogger;
import io.idlequeue.storage.CharacterStore;
import io.idlequeue.storage.ConnectionStore;
import io.idlequeue.storage.Database;
import io.idlequeue.storage.NotificationStore;
import io.idlequeue.storage.TaskQueueStore;
import io.idlequeue.sync.PlayerNotifier;
import io.idlequeue.sync.SyncProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Wires the stores, engine and sync protocol over one data root.
 */
public final class IdleQueueRuntime {
    private static final Logger log = LoggerFactory.getLogger(IdleQueueRuntime.class);

    private final IdleQueueConfig config;
    private final EngineSettings settings;
    private final Database database;
    private final TaskQueueStore queues;
    private final CharacterStore characters;
    private final ConnectionStore connections;
    private final FileOutboxChannel outbox;
    private final AuditLogger audit;
    private final SyncProtocol sync;
    private final QueueScheduler scheduler;
    private final TaskQueueService queueService;
    private final OfflineProgressCalculator offline;

    public IdleQueueRuntime(IdleQueueConfig config) {
        this(config, EngineSettings.load(config), Clock.systemUTC());
    }

    public IdleQueueRuntime(IdleQueueConfig config, EngineSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config, settings.storeRetryAttempts(), settings.storeRetryBaseBackoffMs());
        this.queues = new TaskQueueStore(database);
        this.characters = new CharacterStore(database);
        this.connections = new ConnectionStore(database);
        this.outbox = new FileOutboxChannel(config.outboxRoot());
        this.audit = new AuditLogger(config.auditFile(), clock);
        this.sync = new SyncProtocol(connections, new NotificationStore(database), queues, characters,
                outbox, settings, clock, audit);
        PlayerNotifier notifier = settings.syncEnabled() ? sync : silent();
        this.scheduler = new QueueScheduler(database, queues, characters, new TaskValidator(),
                new ActivityRewardEngine(), notifier, clock, audit);
        this.queueService = new TaskQueueService(queues, scheduler, notifier, settings, clock, audit);
        this.offline = new OfflineProgressCalculator(characters, settings, clock, audit);
    }

    public void init() {
        database.init();
        log.debug("Runtime ready at {}", config.rootDir());
    }

    public IdleQueueConfig config() {
        return config;
    }

    public EngineSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public TaskQueueStore queues() {
        return queues;
    }

    public CharacterStore characters() {
        return characters;
    }

    public ConnectionStore connections() {
        return connections;
    }

    public FileOutboxChannel outbox() {
        return outbox;
    }

    public AuditLogger audit() {
        return audit;
    }

    public SyncProtocol sync() {
        return sync;
    }

    public QueueScheduler scheduler() {
        return scheduler;
    }

    public TaskQueueService queueService() {
        return queueService;
    }

    public OfflineProgressCalculator offline() {
        return offline;
    }

    private static PlayerNotifier silent() {
        return new PlayerNotifier() {
            @Override
            public int sendToPlayer(Notification notification) {
                return 0;
            }

            @Override
            public int sendDeltaUpdate(DeltaUpdate delta) {
                return 0;
            }
        };
    }
}

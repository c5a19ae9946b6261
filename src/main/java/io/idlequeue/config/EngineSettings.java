package io.idlequeue.config;

import io.idlequeue.model.QueueConfig;
import io.idlequeue.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code idlequeue-settings.json}. Missing or out-of-range values fall back to defaults.
 */
public record EngineSettings(
        int maxQueueSize,
        boolean retryEnabled,
        int maxRetries,
        boolean validationEnabled,
        boolean syncEnabled,
        long heartbeatStaleMs,
        long connectionExpireMs,
        int offlineCapMinutes,
        long pendingNotificationTtlMs,
        int storeRetryAttempts,
        long storeRetryBaseBackoffMs
) {
    private static final Logger log = LoggerFactory.getLogger(EngineSettings.class);

    public static final long DEFAULT_HEARTBEAT_STALE_MS = 90_000L;
    public static final long DEFAULT_CONNECTION_EXPIRE_MS = 30L * 60L * 1000L;
    public static final int DEFAULT_OFFLINE_CAP_MINUTES = 24 * 60;
    public static final long DEFAULT_PENDING_NOTIFICATION_TTL_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_STORE_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_STORE_RETRY_BASE_BACKOFF_MS = 25L;

    public static EngineSettings defaults() {
        return new EngineSettings(
                QueueConfig.DEFAULT_MAX_QUEUE_SIZE,
                true,
                QueueConfig.DEFAULT_MAX_RETRIES,
                true,
                true,
                DEFAULT_HEARTBEAT_STALE_MS,
                DEFAULT_CONNECTION_EXPIRE_MS,
                DEFAULT_OFFLINE_CAP_MINUTES,
                DEFAULT_PENDING_NOTIFICATION_TTL_MS,
                DEFAULT_STORE_RETRY_ATTEMPTS,
                DEFAULT_STORE_RETRY_BASE_BACKOFF_MS
        );
    }

    public static EngineSettings load(IdleQueueConfig config) {
        return load(config.settingsFile());
    }

    public static EngineSettings load(Path file) {
        EngineSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (Exception e) {
            log.warn("Ignoring unreadable settings file {}, using defaults", file, e);
            return defaults;
        }
    }

    static EngineSettings fromFile(SettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxQueueSize = sanitizeInt(file.maxQueueSize(), defaults.maxQueueSize(), 1);
        boolean retryEnabled = sanitizeBoolean(file.retryEnabled(), defaults.retryEnabled());
        int maxRetries = sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0);
        boolean validationEnabled = sanitizeBoolean(file.validationEnabled(), defaults.validationEnabled());
        boolean syncEnabled = sanitizeBoolean(file.syncEnabled(), defaults.syncEnabled());
        long heartbeatStale = sanitizeLong(file.heartbeatStaleMs(), defaults.heartbeatStaleMs(), 1_000L);
        long connectionExpire = sanitizeLong(file.connectionExpireMs(), defaults.connectionExpireMs(), heartbeatStale);
        if (connectionExpire < heartbeatStale) {
            connectionExpire = heartbeatStale;
        }
        int offlineCap = sanitizeInt(file.offlineCapMinutes(), defaults.offlineCapMinutes(), 1);
        long pendingTtl = sanitizeLong(file.pendingNotificationTtlMs(), defaults.pendingNotificationTtlMs(), 1_000L);
        int retryAttempts = sanitizeInt(file.storeRetryAttempts(), defaults.storeRetryAttempts(), 1);
        long retryBackoff = sanitizeLong(file.storeRetryBaseBackoffMs(), defaults.storeRetryBaseBackoffMs(), 1L);
        return new EngineSettings(
                maxQueueSize,
                retryEnabled,
                maxRetries,
                validationEnabled,
                syncEnabled,
                heartbeatStale,
                connectionExpire,
                offlineCap,
                pendingTtl,
                retryAttempts,
                retryBackoff
        );
    }

    public QueueConfig queueConfig() {
        return new QueueConfig(maxQueueSize, retryEnabled, maxRetries, validationEnabled, syncEnabled);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            Integer maxQueueSize,
            Boolean retryEnabled,
            Integer maxRetries,
            Boolean validationEnabled,
            Boolean syncEnabled,
            Long heartbeatStaleMs,
            Long connectionExpireMs,
            Integer offlineCapMinutes,
            Long pendingNotificationTtlMs,
            Integer storeRetryAttempts,
            Long storeRetryBaseBackoffMs
    ) {
    }
}

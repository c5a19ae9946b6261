package io.idlequeue.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class IdleQueueConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "idlequeue-settings.json";

    private final Path rootDir;

    public IdleQueueConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static IdleQueueConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new IdleQueueConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("idlequeue.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path outboxRoot() {
        return rootDir.resolve("outbox");
    }
}

package io.idlequeue.config;

import io.idlequeue.Fixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class EngineSettingsTest {

    @Test
    void missingFileYieldsDefaults() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-settings-");
        try {
            EngineSettings settings = EngineSettings.load(IdleQueueConfig.fromRoot(root.toString()));
            Assertions.assertEquals(EngineSettings.defaults(), settings);
            Assertions.assertEquals(50, settings.maxQueueSize());
            Assertions.assertEquals(1440, settings.offlineCapMinutes());
            Assertions.assertEquals(90_000L, settings.heartbeatStaleMs());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void fileOverridesAreClampedToSaneMinimums() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-settings-");
        try {
            IdleQueueConfig config = IdleQueueConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), """
                    {
                      "maxQueueSize": 0,
                      "retryEnabled": false,
                      "maxRetries": -2,
                      "heartbeatStaleMs": 120000,
                      "connectionExpireMs": 5000,
                      "offlineCapMinutes": 60,
                      "somethingElse": true
                    }
                    """, StandardCharsets.UTF_8);

            EngineSettings settings = EngineSettings.load(config);

            Assertions.assertEquals(1, settings.maxQueueSize());
            Assertions.assertFalse(settings.retryEnabled());
            Assertions.assertEquals(0, settings.maxRetries());
            Assertions.assertEquals(120_000L, settings.heartbeatStaleMs());
            Assertions.assertEquals(120_000L, settings.connectionExpireMs());
            Assertions.assertEquals(60, settings.offlineCapMinutes());
            Assertions.assertTrue(settings.validationEnabled());
            Assertions.assertFalse(settings.queueConfig().retryEnabled());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-settings-");
        try {
            IdleQueueConfig config = IdleQueueConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{ not json", StandardCharsets.UTF_8);
            Assertions.assertEquals(EngineSettings.defaults(), EngineSettings.load(config));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }
}

package io.idlequeue.storage;

import io.idlequeue.Fixtures;
import io.idlequeue.model.Notification;
import io.idlequeue.model.NotificationType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class NotificationStoreTest {
    private static final long T0 = 1_700_000_000_000L;

    @Test
    void drainReturnsLiveNotificationsInOrderAndEmptiesTheMailbox() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-pending-");
        try {
            NotificationStore store = new NotificationStore(Fixtures.database(root));
            store.store(Notification.of(NotificationType.TASK_STARTED, "p1", "t-1", Map.of(), T0), T0, T0 + 1_000L);
            store.store(Notification.of(NotificationType.TASK_COMPLETED, "p1", "t-1", Map.of("experience", 26), T0), T0, T0 + 10_000L);
            store.store(Notification.of(NotificationType.QUEUE_UPDATED, "p2", null, Map.of(), T0), T0, T0 + 10_000L);

            Assertions.assertEquals(1, store.count("p1", T0 + 5_000L));

            List<Notification> drained = store.drain("p1", T0 + 5_000L);
            Assertions.assertEquals(1, drained.size());
            Assertions.assertEquals(NotificationType.TASK_COMPLETED, drained.get(0).type());
            Assertions.assertEquals(26, ((Number) drained.get(0).data().get("experience")).intValue());
            Assertions.assertTrue(store.drain("p1", T0 + 5_000L).isEmpty());
            Assertions.assertEquals(1, store.count("p2", T0 + 5_000L));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void purgeRemovesOnlyExpiredRows() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-pending-");
        try {
            NotificationStore store = new NotificationStore(Fixtures.database(root));
            store.store(Notification.of(NotificationType.TASK_STARTED, "p1", "t-1", Map.of(), T0), T0, T0 + 1_000L);
            store.store(Notification.of(NotificationType.TASK_STARTED, "p1", "t-2", Map.of(), T0), T0, T0 + 9_000L);

            Assertions.assertEquals(1, store.purgeExpired(T0 + 1_000L));
            Assertions.assertEquals(1, store.count("p1", T0 + 1_000L));
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }
}

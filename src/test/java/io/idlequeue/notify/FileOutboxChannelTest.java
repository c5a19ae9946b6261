package io.idlequeue.notify;

import io.idlequeue.Fixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class FileOutboxChannelTest {

    @Test
    void appendsOneLinePerPayload() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-outbox-");
        try {
            FileOutboxChannel channel = new FileOutboxChannel(root.resolve("outbox"));
            channel.send("conn/1", "{\"type\":\"task_started\"}");
            channel.send("conn/1", "{\"type\":\n\"queue_updated\"}");

            List<String> lines = channel.read("conn/1");
            Assertions.assertEquals(2, lines.size());
            Assertions.assertEquals("{\"type\": \"queue_updated\"}", lines.get(1));
            Assertions.assertEquals("conn_1.jsonl", channel.outboxFile("conn/1").getFileName().toString());
            Assertions.assertTrue(channel.read("other").isEmpty());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }

    @Test
    void closedConnectionRejectsFurtherSends() throws Exception {
        Path root = Files.createTempDirectory("idlequeue-test-outbox-");
        try {
            FileOutboxChannel channel = new FileOutboxChannel(root.resolve("outbox"));
            channel.close("c-1");

            ConnectionGoneException gone = Assertions.assertThrows(ConnectionGoneException.class,
                    () -> channel.send("c-1", "{}"));
            Assertions.assertEquals("c-1", gone.connectionId());
            Assertions.assertTrue(channel.read("c-1").isEmpty());
        } finally {
            Fixtures.deleteRecursively(root);
        }
    }
}

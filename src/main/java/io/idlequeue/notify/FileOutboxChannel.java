package io.idlequeue.notify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Appends each payload as one line to {@code outbox/<connectionId>.jsonl}. A {@code <connectionId>.closed}
 * marker next to it means the client went away.
 */
public final class FileOutboxChannel implements NotificationChannel {
    private final Path outboxRoot;

    public FileOutboxChannel(Path outboxRoot) {
        this.outboxRoot = outboxRoot;
    }

    @Override
    public void send(String connectionId, String payload) throws NotificationDeliveryException {
        String safeId = safeFileName(connectionId);
        if (Files.exists(outboxRoot.resolve(safeId + ".closed"))) {
            throw new ConnectionGoneException(connectionId);
        }
        String line = payload.replace('\n', ' ').replace('\r', ' ') + System.lineSeparator();
        try {
            Files.createDirectories(outboxRoot);
            Files.writeString(outboxFile(connectionId), line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new NotificationDeliveryException(connectionId, "Failed to write outbox for " + connectionId, e);
        }
    }

    public List<String> read(String connectionId) {
        Path file = outboxFile(connectionId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read outbox: " + file, e);
        }
    }

    public void close(String connectionId) {
        try {
            Files.createDirectories(outboxRoot);
            Path marker = outboxRoot.resolve(safeFileName(connectionId) + ".closed");
            if (!Files.exists(marker)) {
                Files.createFile(marker);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to close outbox for " + connectionId, e);
        }
    }

    public Path outboxFile(String connectionId) {
        return outboxRoot.resolve(safeFileName(connectionId) + ".jsonl");
    }

    private static String safeFileName(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9') || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '_');
        }
        return sb.toString();
    }
}

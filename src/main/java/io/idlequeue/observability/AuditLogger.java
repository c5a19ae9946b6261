package io.idlequeue.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.idlequeue.util.Hashing;
import io.idlequeue.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row so edits are detectable.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("player_id", event.playerId());
        row.put("task_id", event.taskId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public List<JsonNode> tail(int limit) {
        if (!Files.exists(auditFile)) {
            return List.of();
        }
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            List<JsonNode> out = new ArrayList<>();
            int from = Math.max(0, lines.size() - Math.max(1, limit));
            for (String line : lines.subList(from, lines.size())) {
                if (!line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    /**
     * Recomputes every row hash and checks the prev_hash links. Returns the 1-based line of the first broken row,
     * or 0 when the chain is intact.
     */
    @SuppressWarnings("unchecked")
    public int verify() {
        if (!Files.exists(auditFile)) {
            return 0;
        }
        try {
            String expectedPrev = "";
            int lineNo = 0;
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    return lineNo;
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    return lineNo;
                }
                expectedPrev = recomputed;
            }
            return 0;
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            if (!Files.exists(auditFile)) {
                return "";
            }
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String playerId,
            String taskId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String playerId, String taskId, String result, Map<String, Object> details) {
            return new AuditEvent(action, "engine", playerId, taskId, result, details == null ? Map.of() : details);
        }
    }
}

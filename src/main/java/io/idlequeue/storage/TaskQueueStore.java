package io.idlequeue.storage;

import io.idlequeue.model.TaskQueue;
import io.idlequeue.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Queues are stored whole as JSON with the version, checksum and running flag mirrored into columns.
 * Every write goes through a compare-and-set on the version column and stamps a fresh version and checksum.
 */
public final class TaskQueueStore {
    private final Database database;

    public TaskQueueStore(Database database) {
        this.database = database;
    }

    public Optional<TaskQueue> get(String playerId) {
        return database.withConnection("load task queue " + playerId, c -> get(c, playerId));
    }

    public Optional<TaskQueue> get(Connection c, String playerId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT body FROM task_queues WHERE player_id=?")) {
            ps.setString(1, playerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.fromJson(rs.getString("body"), TaskQueue.class));
            }
        }
    }

    /**
     * Inserts a brand new queue at version 1 unless one already exists. Returns whichever queue is stored afterwards.
     */
    public TaskQueue createIfAbsent(TaskQueue queue, long nowMs) {
        return database.inTransaction("create task queue " + queue.playerId(), c -> {
            Optional<TaskQueue> existing = get(c, queue.playerId());
            if (existing.isPresent()) {
                return existing.get();
            }
            TaskQueue stamped = stamp(queue, 1L, nowMs);
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO task_queues(player_id,body,is_running,is_paused,version,checksum,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?)")) {
                ps.setString(1, stamped.playerId());
                ps.setString(2, Jsons.toCompactJson(stamped));
                ps.setInt(3, stamped.running() ? 1 : 0);
                ps.setInt(4, stamped.paused() ? 1 : 0);
                ps.setLong(5, stamped.version());
                ps.setString(6, stamped.checksum());
                ps.setLong(7, stamped.createdAt());
                ps.setLong(8, nowMs);
                ps.executeUpdate();
            }
            return stamped;
        });
    }

    /**
     * Writes {@code next} at {@code expectedVersion + 1}. Empty when another writer got there first.
     */
    public Optional<TaskQueue> save(TaskQueue next, long expectedVersion, long nowMs) {
        return compareAndSet(next, expectedVersion, expectedVersion + 1L, nowMs);
    }

    public Optional<TaskQueue> compareAndSet(TaskQueue next, long expectedVersion, long newVersion, long nowMs) {
        return database.withConnection("save task queue " + next.playerId(),
                c -> compareAndSet(c, next, expectedVersion, newVersion, nowMs));
    }

    public Optional<TaskQueue> compareAndSet(Connection c, TaskQueue next, long expectedVersion, long newVersion, long nowMs)
            throws SQLException {
        if (newVersion <= expectedVersion) {
            throw new IllegalArgumentException("Queue version must increase, expected=" + expectedVersion + ", new=" + newVersion);
        }
        TaskQueue stamped = stamp(next, newVersion, nowMs);
        try (PreparedStatement ps = c.prepareStatement(
                "UPDATE task_queues SET body=?,is_running=?,is_paused=?,version=?,checksum=?,updated_at_ms=? WHERE player_id=? AND version=?")) {
            ps.setString(1, Jsons.toCompactJson(stamped));
            ps.setInt(2, stamped.running() ? 1 : 0);
            ps.setInt(3, stamped.paused() ? 1 : 0);
            ps.setLong(4, stamped.version());
            ps.setString(5, stamped.checksum());
            ps.setLong(6, nowMs);
            ps.setString(7, stamped.playerId());
            ps.setLong(8, expectedVersion);
            return ps.executeUpdate() == 1 ? Optional.of(stamped) : Optional.empty();
        }
    }

    public List<TaskQueue> listRunning(int limit) {
        String sql = "SELECT body FROM task_queues WHERE is_running=1 ORDER BY player_id LIMIT ?";
        return database.withConnection("list running task queues", c -> {
            List<TaskQueue> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(Jsons.fromJson(rs.getString("body"), TaskQueue.class));
                    }
                }
            }
            return out;
        });
    }

    public long version(String playerId) {
        return database.withConnection("read task queue version " + playerId, c -> {
            try (PreparedStatement ps = c.prepareStatement("SELECT version FROM task_queues WHERE player_id=?")) {
                ps.setString(1, playerId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong("version") : 0L;
                }
            }
        });
    }

    private static TaskQueue stamp(TaskQueue queue, long version, long nowMs) {
        TaskQueue versioned = queue.stamped(version, "", nowMs);
        return versioned.stamped(version, QueueChecksums.checksum(versioned), nowMs);
    }
}

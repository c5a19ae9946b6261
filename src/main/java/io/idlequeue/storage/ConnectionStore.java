package io.idlequeue.storage;

import io.idlequeue.model.ClientConnection;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class ConnectionStore {
    private final Database database;

    public ConnectionStore(Database database) {
        this.database = database;
    }

    public void put(ClientConnection connection) {
        String sql = """
                INSERT INTO connections(connection_id,player_id,connected_at_ms,last_ping_ms,last_heartbeat_ms,queue_version,is_healthy)
                VALUES(?,?,?,?,?,?,?)
                ON CONFLICT(connection_id) DO UPDATE SET
                    player_id=excluded.player_id,
                    connected_at_ms=excluded.connected_at_ms,
                    last_ping_ms=excluded.last_ping_ms,
                    last_heartbeat_ms=excluded.last_heartbeat_ms,
                    queue_version=excluded.queue_version,
                    is_healthy=excluded.is_healthy
                """;
        database.withConnection("store connection " + connection.connectionId(), c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, connection.connectionId());
                ps.setString(2, connection.playerId());
                ps.setLong(3, connection.connectedAt());
                ps.setLong(4, connection.lastPing());
                ps.setLong(5, connection.lastHeartbeat());
                ps.setLong(6, connection.queueVersion());
                ps.setInt(7, connection.healthy() ? 1 : 0);
                return ps.executeUpdate();
            }
        });
    }

    public Optional<ClientConnection> get(String connectionId) {
        String sql = "SELECT * FROM connections WHERE connection_id=?";
        return database.withConnection("load connection " + connectionId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, connectionId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.empty();
                }
            }
        });
    }

    public List<ClientConnection> listByPlayer(String playerId) {
        String sql = "SELECT * FROM connections WHERE player_id=? ORDER BY connected_at_ms, connection_id";
        return database.withConnection("list connections " + playerId, c -> {
            List<ClientConnection> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, playerId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(map(rs));
                    }
                }
            }
            return out;
        });
    }

    public boolean delete(String connectionId) {
        return database.withConnection("delete connection " + connectionId, c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM connections WHERE connection_id=?")) {
                ps.setString(1, connectionId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public boolean recordHeartbeat(String connectionId, long queueVersion, long nowMs) {
        String sql = "UPDATE connections SET last_heartbeat_ms=?,queue_version=?,is_healthy=1 WHERE connection_id=?";
        return database.withConnection("heartbeat connection " + connectionId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setLong(1, nowMs);
                ps.setLong(2, queueVersion);
                ps.setString(3, connectionId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public boolean touch(String connectionId, long nowMs) {
        return database.withConnection("ping connection " + connectionId, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE connections SET last_ping_ms=? WHERE connection_id=?")) {
                ps.setLong(1, nowMs);
                ps.setString(2, connectionId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    public boolean updateQueueVersion(String connectionId, long queueVersion) {
        return database.withConnection("update connection version " + connectionId, c -> {
            try (PreparedStatement ps = c.prepareStatement("UPDATE connections SET queue_version=? WHERE connection_id=?")) {
                ps.setLong(1, queueVersion);
                ps.setString(2, connectionId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Marks connections whose last heartbeat is older than {@code heartbeatBeforeMs} unhealthy and deletes those
     * with no ping or heartbeat since {@code expireBeforeMs}, in one transaction.
     */
    public StaleSweep sweepStale(long heartbeatBeforeMs, long expireBeforeMs) {
        String markUnhealthy = "UPDATE connections SET is_healthy=0 WHERE is_healthy=1 AND last_heartbeat_ms<?";
        String deleteExpired = "DELETE FROM connections WHERE MAX(last_ping_ms,last_heartbeat_ms)<?";
        return database.inTransaction("sweep stale connections", c -> {
            int deleted;
            try (PreparedStatement ps = c.prepareStatement(deleteExpired)) {
                ps.setLong(1, expireBeforeMs);
                deleted = ps.executeUpdate();
            }
            int unhealthy;
            try (PreparedStatement ps = c.prepareStatement(markUnhealthy)) {
                ps.setLong(1, heartbeatBeforeMs);
                unhealthy = ps.executeUpdate();
            }
            return new StaleSweep(unhealthy, deleted);
        });
    }

    private static ClientConnection map(ResultSet rs) throws SQLException {
        return new ClientConnection(
                rs.getString("connection_id"),
                rs.getString("player_id"),
                rs.getLong("connected_at_ms"),
                rs.getLong("last_ping_ms"),
                rs.getLong("last_heartbeat_ms"),
                rs.getLong("queue_version"),
                rs.getInt("is_healthy") == 1
        );
    }

    public record StaleSweep(int markedUnhealthy, int deleted) {
    }
}

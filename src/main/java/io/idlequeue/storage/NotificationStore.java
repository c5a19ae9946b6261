package io.idlequeue.storage;

import io.idlequeue.model.Notification;
import io.idlequeue.util.Jsons;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Notifications held for players with no open connection. Rows past their expiry are never returned.
 */
public final class NotificationStore {
    private final Database database;

    public NotificationStore(Database database) {
        this.database = database;
    }

    public void store(Notification notification, long nowMs, long expiresAtMs) {
        String sql = "INSERT INTO pending_notifications(player_id,message_id,body,created_at_ms,expires_at_ms) VALUES(?,?,?,?,?)";
        database.withConnection("store pending notification " + notification.messageId(), c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, notification.playerId());
                ps.setString(2, notification.messageId());
                ps.setString(3, Jsons.toCompactJson(notification));
                ps.setLong(4, nowMs);
                ps.setLong(5, expiresAtMs);
                return ps.executeUpdate();
            }
        });
    }

    public List<Notification> drain(String playerId, long nowMs) {
        String select = "SELECT body FROM pending_notifications WHERE player_id=? AND expires_at_ms>? ORDER BY id";
        String delete = "DELETE FROM pending_notifications WHERE player_id=?";
        return database.inTransaction("drain pending notifications " + playerId, c -> {
            List<Notification> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(select)) {
                ps.setString(1, playerId);
                ps.setLong(2, nowMs);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(Jsons.fromJson(rs.getString("body"), Notification.class));
                    }
                }
            }
            try (PreparedStatement ps = c.prepareStatement(delete)) {
                ps.setString(1, playerId);
                ps.executeUpdate();
            }
            return out;
        });
    }

    public int count(String playerId, long nowMs) {
        String sql = "SELECT COUNT(1) FROM pending_notifications WHERE player_id=? AND expires_at_ms>?";
        return database.withConnection("count pending notifications " + playerId, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, playerId);
                ps.setLong(2, nowMs);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getInt(1) : 0;
                }
            }
        });
    }

    public int purgeExpired(long nowMs) {
        return database.withConnection("purge expired notifications", c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM pending_notifications WHERE expires_at_ms<=?")) {
                ps.setLong(1, nowMs);
                return ps.executeUpdate();
            }
        });
    }
}

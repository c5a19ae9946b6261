package io.idlequeue.storage;

import io.idlequeue.model.CharacterStats;
import io.idlequeue.model.CurrentActivity;
import io.idlequeue.model.InventoryItem;
import io.idlequeue.model.ItemStack;
import io.idlequeue.model.PlayerCharacter;
import io.idlequeue.model.Specialization;
import io.idlequeue.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class CharacterStore {
    private final Database database;

    public CharacterStore(Database database) {
        this.database = database;
    }

    public void put(PlayerCharacter character, long nowMs) {
        String sql = """
                INSERT INTO characters(user_id,name,level,experience,currency,stats,specialization,current_activity,last_active_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(user_id) DO UPDATE SET
                    name=excluded.name,
                    level=excluded.level,
                    experience=excluded.experience,
                    currency=excluded.currency,
                    stats=excluded.stats,
                    specialization=excluded.specialization,
                    current_activity=excluded.current_activity,
                    last_active_at_ms=excluded.last_active_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                """;
        database.withConnection("put character " + character.userId(), c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, character.userId());
                ps.setString(2, character.name());
                ps.setInt(3, character.level());
                ps.setLong(4, character.experience());
                ps.setLong(5, character.currency());
                ps.setString(6, Jsons.toCompactJson(character.stats()));
                ps.setString(7, Jsons.toCompactJson(character.specialization()));
                ps.setString(8, character.currentActivity() == null ? null : Jsons.toCompactJson(character.currentActivity()));
                ps.setLong(9, character.lastActiveAt());
                ps.setLong(10, nowMs);
                return ps.executeUpdate();
            }
        });
    }

    public Optional<PlayerCharacter> get(String userId) {
        return database.withConnection("load character " + userId, c -> get(c, userId));
    }

    public Optional<PlayerCharacter> get(Connection c, String userId) throws SQLException {
        String sql = """
                SELECT user_id,name,level,experience,currency,stats,specialization,current_activity,last_active_at_ms
                FROM characters WHERE user_id=?
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String activity = rs.getString("current_activity");
                return Optional.of(new PlayerCharacter(
                        rs.getString("user_id"),
                        rs.getString("name"),
                        rs.getInt("level"),
                        rs.getLong("experience"),
                        rs.getLong("currency"),
                        Jsons.fromJson(rs.getString("stats"), CharacterStats.class),
                        Jsons.fromJson(rs.getString("specialization"), Specialization.class),
                        activity == null ? null : Jsons.fromJson(activity, CurrentActivity.class),
                        rs.getLong("last_active_at_ms")
                ));
            }
        }
    }

    public boolean apply(String userId, CharacterDelta delta, long nowMs) {
        return database.inTransaction("apply character delta " + userId, c -> apply(c, userId, delta, nowMs));
    }

    /**
     * Applies the delta as relative updates on {@code c}. Level only ever moves up, derived from the new experience total.
     * Returns false when the character does not exist.
     */
    public boolean apply(Connection c, String userId, CharacterDelta delta, long nowMs) throws SQLException {
        String counters = """
                UPDATE characters SET
                    experience = experience + ?,
                    currency = currency + ?,
                    level = MAX(level, (experience + ?) / 1000 + 1),
                    last_active_at_ms = COALESCE(?, last_active_at_ms),
                    updated_at_ms = ?
                WHERE user_id=?
                """;
        try (PreparedStatement ps = c.prepareStatement(counters)) {
            ps.setLong(1, delta.experience());
            ps.setLong(2, delta.currency());
            ps.setLong(3, delta.experience());
            if (delta.lastActiveAt() == null) {
                ps.setNull(4, Types.INTEGER);
            } else {
                ps.setLong(4, delta.lastActiveAt());
            }
            ps.setLong(5, nowMs);
            ps.setString(6, userId);
            if (ps.executeUpdate() == 0) {
                return false;
            }
        }
        if (!delta.skills().isEmpty()) {
            String skillSql = "UPDATE characters SET stats = json_set(stats, ?, COALESCE(json_extract(stats, ?), 0) + ?) WHERE user_id=?";
            try (PreparedStatement ps = c.prepareStatement(skillSql)) {
                for (CharacterDelta.SkillGain gain : delta.skills()) {
                    String path = "$." + gain.category().field() + "." + jsonKey(gain.skill());
                    ps.setString(1, path);
                    ps.setString(2, path);
                    ps.setInt(3, gain.amount());
                    ps.setString(4, userId);
                    ps.executeUpdate();
                }
            }
        }
        Specialization gained = delta.specialization();
        if (gained.hasProgress()) {
            String specSql = """
                    UPDATE characters SET specialization = json_set(specialization,
                        '$.tankProgress', COALESCE(json_extract(specialization, '$.tankProgress'), 0) + ?,
                        '$.healerProgress', COALESCE(json_extract(specialization, '$.healerProgress'), 0) + ?,
                        '$.dpsProgress', COALESCE(json_extract(specialization, '$.dpsProgress'), 0) + ?)
                    WHERE user_id=?
                    """;
            try (PreparedStatement ps = c.prepareStatement(specSql)) {
                ps.setInt(1, gained.tankProgress());
                ps.setInt(2, gained.healerProgress());
                ps.setInt(3, gained.dpsProgress());
                ps.setString(4, userId);
                ps.executeUpdate();
            }
        }
        for (ItemStack item : delta.items()) {
            addInventory(c, userId, item.itemId(), item.quantity(), nowMs);
        }
        return true;
    }

    public List<InventoryItem> inventory(String userId) {
        String sql = "SELECT item_id,quantity,updated_at_ms FROM inventory WHERE user_id=? ORDER BY item_id";
        return database.withConnection("list inventory " + userId, c -> {
            List<InventoryItem> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new InventoryItem(rs.getString("item_id"), rs.getLong("quantity"), rs.getLong("updated_at_ms")));
                    }
                }
            }
            return out;
        });
    }

    private void addInventory(Connection c, String userId, String itemId, int quantity, long nowMs) throws SQLException {
        if (itemId == null || itemId.isBlank() || quantity <= 0) {
            return;
        }
        String sql = """
                INSERT INTO inventory(user_id,item_id,quantity,updated_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(user_id,item_id) DO UPDATE SET
                    quantity = quantity + excluded.quantity,
                    updated_at_ms = excluded.updated_at_ms
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, userId);
            ps.setString(2, itemId);
            ps.setInt(3, quantity);
            ps.setLong(4, nowMs);
            ps.executeUpdate();
        }
    }

    private static String jsonKey(String skill) {
        return "\"" + skill.replace("\"", "") + "\"";
    }
}

package ru.challenges.bot.service;

import ru.challenges.bot.db.Database;
import ru.challenges.bot.db.SqlErrors;
import ru.challenges.bot.model.MatchTypeRole;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

public final class MatchTypeRoleService {
    private final Database db;

    public MatchTypeRoleService(Database db) {
        this.db = db;
    }

    /**
     * @throws MatchTypeRoleExistsException if the role is already registered for this guild and match type
     */
    public MatchTypeRole create(long guildId, String matchType, long roleId) {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO match_type_roles(guild_id, match_type, role_id) VALUES(?,?,?)",
                    Statement.RETURN_GENERATED_KEYS
            )) {
                ps.setLong(1, guildId);
                ps.setString(2, matchType);
                ps.setLong(3, roleId);
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) throw new SQLException("No id returned");
                    MatchTypeRole r = new MatchTypeRole();
                    r.id = keys.getLong(1);
                    r.guildId = guildId;
                    r.matchType = matchType;
                    r.roleId = roleId;
                    return r;
                }
            }
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e)) throw new MatchTypeRoleExistsException(guildId, matchType, roleId, e);
            throw SqlErrors.translate("Create match type role", e);
        }
    }

    public boolean delete(long id) {
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM match_type_roles WHERE id=?")) {
                ps.setLong(1, id);
                return ps.executeUpdate() > 0;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("Delete match type role " + id, e);
        }
    }

    public List<MatchTypeRole> listAll() {
        List<MatchTypeRole> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM match_type_roles ORDER BY id")) {
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("List match type roles", e);
        }
        return out;
    }

    public List<MatchTypeRole> listForGuild(long guildId) {
        List<MatchTypeRole> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM match_type_roles WHERE guild_id=? ORDER BY id")) {
                ps.setLong(1, guildId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("List match type roles of guild " + guildId, e);
        }
        return out;
    }

    public List<MatchTypeRole> listFor(long guildId, String matchType) {
        List<MatchTypeRole> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT * FROM match_type_roles WHERE guild_id=? AND match_type=? ORDER BY id"
            )) {
                ps.setLong(1, guildId);
                ps.setString(2, matchType);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("List roles for '" + matchType + "' in guild " + guildId, e);
        }
        return out;
    }

    private static MatchTypeRole map(ResultSet rs) throws SQLException {
        MatchTypeRole r = new MatchTypeRole();
        r.id = rs.getLong("id");
        r.guildId = rs.getLong("guild_id");
        r.matchType = rs.getString("match_type");
        r.roleId = rs.getLong("role_id");
        return r;
    }
}

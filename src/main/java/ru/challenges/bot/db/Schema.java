package ru.challenges.bot.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class Schema {
    private static final Logger log = LoggerFactory.getLogger(Schema.class);

    public static final String CHALLENGES = "challenges";
    public static final String MATCH_TYPE_ROLES = "match_type_roles";
    public static final String IDX_CHALLENGE_GUILD = "idx_challenge_guild_id";
    public static final String IDX_MATCH_TYPE_ROLES_GUILD_TYPE = "idx_match_type_roles_guild_id_and_match_type";

    private static final Map<String, List<String>> EXPECTED_COLUMNS = new LinkedHashMap<>();

    static {
        EXPECTED_COLUMNS.put(CHALLENGES, List.of(
                "id", "created", "guild_id", "text_channel_id", "message_id",
                "challenge_type", "responding_member_id", "responded_at"));
        EXPECTED_COLUMNS.put(MATCH_TYPE_ROLES, List.of("id", "guild_id", "match_type", "role_id"));
    }

    private Schema() {}

    /**
     * Creates both tables and their indexes when absent. Safe to run on every start.
     *
     * @throws SchemaConflictException if a table of the same name exists with a different shape
     * @throws SQLException if the database cannot be opened or written
     */
    public static void migrate(Database db) throws SQLException {
        try (Connection c = db.getConnection()) {
            try (Statement st = c.createStatement()) {

                execute(st, "CREATE TABLE IF NOT EXISTS challenges (" +
                        "id INTEGER PRIMARY KEY," +
                        "created TEXT NOT NULL," +
                        "guild_id BIGINT NOT NULL," +
                        "text_channel_id BIGINT NOT NULL," +
                        "message_id BIGINT NOT NULL UNIQUE," +
                        "challenge_type TEXT NOT NULL," +
                        "responding_member_id BIGINT NULL DEFAULT NULL," +
                        "responded_at TEXT NULL DEFAULT NULL," +
                        "CHECK ((responding_member_id IS NULL) = (responded_at IS NULL))" +
                        ");");

                execute(st, "CREATE INDEX IF NOT EXISTS " + IDX_CHALLENGE_GUILD + " ON challenges(guild_id);");

                execute(st, "CREATE TABLE IF NOT EXISTS match_type_roles (" +
                        "id INTEGER PRIMARY KEY," +
                        "guild_id BIGINT NOT NULL," +
                        "match_type TEXT NOT NULL," +
                        "role_id BIGINT NOT NULL," +
                        "UNIQUE(guild_id, match_type, role_id)" +
                        ");");

                execute(st, "CREATE INDEX IF NOT EXISTS " + IDX_MATCH_TYPE_ROLES_GUILD_TYPE +
                        " ON match_type_roles(guild_id, match_type);");
            }

            for (Map.Entry<String, List<String>> e : EXPECTED_COLUMNS.entrySet()) {
                verifyColumns(c, e.getKey(), e.getValue());
            }
            verifyUnique(c, CHALLENGES, List.of("message_id"));
            verifyUnique(c, MATCH_TYPE_ROLES, List.of("guild_id", "match_type", "role_id"));
            verifyIndex(c, IDX_CHALLENGE_GUILD, CHALLENGES, List.of("guild_id"));
            verifyIndex(c, IDX_MATCH_TYPE_ROLES_GUILD_TYPE, MATCH_TYPE_ROLES, List.of("guild_id", "match_type"));
        }
        log.info("Schema ready: tables {}", EXPECTED_COLUMNS.keySet());
    }

    private static void execute(Statement st, String sql) throws SQLException {
        try {
            st.execute(sql);
        } catch (SQLException e) {
            String m = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
            if (m.contains("no such column") || m.contains("already exists")) {
                throw new SchemaConflictException("Incompatible object blocks schema creation: " + e.getMessage(), e);
            }
            throw e;
        }
    }

    private static void verifyColumns(Connection c, String table, List<String> expected) throws SQLException {
        Set<String> actual = new HashSet<>();
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) actual.add(rs.getString("name").toLowerCase(Locale.ROOT));
        }
        if (actual.isEmpty()) {
            throw new SchemaConflictException("Table " + table + " was not created");
        }
        for (String col : expected) {
            if (!actual.contains(col)) {
                throw new SchemaConflictException("Table " + table + " exists without column " + col);
            }
        }
    }

    private static void verifyUnique(Connection c, String table, List<String> columns) throws SQLException {
        List<String> uniqueIndexes = new ArrayList<>();
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA index_list(" + table + ")")) {
            while (rs.next()) {
                if (rs.getInt("unique") == 1) uniqueIndexes.add(rs.getString("name"));
            }
        }
        for (String index : uniqueIndexes) {
            if (indexColumns(c, index).equals(columns)) return;
        }
        throw new SchemaConflictException("Table " + table + " exists without a unique index on " + columns);
    }

    private static void verifyIndex(Connection c, String index, String table, List<String> columns) throws SQLException {
        String owner = null;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT tbl_name FROM sqlite_master WHERE type='index' AND name=?")) {
            ps.setString(1, index);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) owner = rs.getString(1);
            }
        }
        if (owner == null) {
            throw new SchemaConflictException("Index " + index + " was not created");
        }
        if (!owner.equalsIgnoreCase(table)) {
            throw new SchemaConflictException("Index " + index + " exists on table " + owner + " instead of " + table);
        }
        List<String> actual = indexColumns(c, index);
        if (!actual.equals(columns)) {
            throw new SchemaConflictException("Index " + index + " covers " + actual + " instead of " + columns);
        }
    }

    // Column names in key order.
    private static List<String> indexColumns(Connection c, String index) throws SQLException {
        List<String> cols = new ArrayList<>();
        try (Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA index_info(\"" + index.replace("\"", "\"\"") + "\")")) {
            while (rs.next()) {
                String name = rs.getString("name");
                cols.add(name == null ? "" : name.toLowerCase(Locale.ROOT));
            }
        }
        return cols;
    }
}

package ru.challenges.bot.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.challenges.bot.config.Config;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Schema")
class SchemaTest {

    @TempDir
    Path dir;

    private Database db;

    @BeforeEach
    void setUp() throws Exception {
        db = new Database(Config.forDatabase(dir.resolve("schema.db")));
    }

    @Test
    @DisplayName("creates both tables and both named indexes")
    void createsTablesAndIndexes() throws Exception {
        Schema.migrate(db);

        assertThat(count("type='table' AND name='challenges'")).isEqualTo(1);
        assertThat(count("type='table' AND name='match_type_roles'")).isEqualTo(1);
        assertThat(count("type='index' AND name='" + Schema.IDX_CHALLENGE_GUILD + "'")).isEqualTo(1);
        assertThat(count("type='index' AND name='" + Schema.IDX_MATCH_TYPE_ROLES_GUILD_TYPE + "'")).isEqualTo(1);
    }

    @Test
    @DisplayName("running twice is harmless and leaves no duplicates or rows")
    void isIdempotent() throws Exception {
        Schema.migrate(db);
        int objectsAfterFirst = count("name NOT LIKE 'sqlite_%'");

        assertThatCode(() -> Schema.migrate(db)).doesNotThrowAnyException();

        assertThat(count("name NOT LIKE 'sqlite_%'")).isEqualTo(objectsAfterFirst).isEqualTo(4);
        assertThat(rows("challenges")).isZero();
        assertThat(rows("match_type_roles")).isZero();
    }

    @Test
    @DisplayName("a foreign challenges table without guild_id is reported as a conflict")
    void conflictingChallengesTable() throws Exception {
        exec("CREATE TABLE challenges (id INTEGER PRIMARY KEY, note TEXT)");

        assertThatThrownBy(() -> Schema.migrate(db))
                .isInstanceOf(SchemaConflictException.class)
                .hasMessageContaining("guild_id");
    }

    @Test
    @DisplayName("a match_type_roles table missing role_id is reported as a conflict")
    void conflictingRolesTable() throws Exception {
        exec("CREATE TABLE match_type_roles (id INTEGER PRIMARY KEY, guild_id BIGINT, match_type TEXT)");

        assertThatThrownBy(() -> Schema.migrate(db))
                .isInstanceOf(SchemaConflictException.class)
                .hasMessageContaining("role_id");
    }

    @Test
    @DisplayName("a challenges table whose message_id is not unique is reported as a conflict")
    void challengesWithoutUniqueMessageId() throws Exception {
        exec("CREATE TABLE challenges (id INTEGER PRIMARY KEY, created TEXT NOT NULL, guild_id BIGINT NOT NULL, " +
                "text_channel_id BIGINT NOT NULL, message_id BIGINT NOT NULL, challenge_type TEXT NOT NULL, " +
                "responding_member_id BIGINT NULL, responded_at TEXT NULL)");

        assertThatThrownBy(() -> Schema.migrate(db))
                .isInstanceOf(SchemaConflictException.class)
                .hasMessageContaining("challenges")
                .hasMessageContaining("message_id");
    }

    @Test
    @DisplayName("a match_type_roles table without the unique triple is reported as a conflict")
    void rolesWithoutUniqueTriple() throws Exception {
        exec("CREATE TABLE match_type_roles (id INTEGER PRIMARY KEY, guild_id BIGINT NOT NULL, " +
                "match_type TEXT NOT NULL, role_id BIGINT NOT NULL)");

        assertThatThrownBy(() -> Schema.migrate(db))
                .isInstanceOf(SchemaConflictException.class)
                .hasMessageContaining("role_id");
    }

    @Test
    @DisplayName("the guild index name taken by another table is reported as a conflict")
    void guildIndexOnOtherTable() throws Exception {
        exec("CREATE TABLE other (guild_id BIGINT)");
        exec("CREATE INDEX " + Schema.IDX_CHALLENGE_GUILD + " ON other(guild_id)");

        assertThatThrownBy(() -> Schema.migrate(db))
                .isInstanceOf(SchemaConflictException.class)
                .hasMessageContaining(Schema.IDX_CHALLENGE_GUILD)
                .hasMessageContaining("other");
    }

    @Test
    @DisplayName("the role index over the wrong columns is reported as a conflict")
    void roleIndexOnWrongColumns() throws Exception {
        exec("CREATE TABLE match_type_roles (id INTEGER PRIMARY KEY, guild_id BIGINT NOT NULL, " +
                "match_type TEXT NOT NULL, role_id BIGINT NOT NULL, UNIQUE(guild_id, match_type, role_id))");
        exec("CREATE INDEX " + Schema.IDX_MATCH_TYPE_ROLES_GUILD_TYPE + " ON match_type_roles(role_id)");

        assertThatThrownBy(() -> Schema.migrate(db))
                .isInstanceOf(SchemaConflictException.class)
                .hasMessageContaining(Schema.IDX_MATCH_TYPE_ROLES_GUILD_TYPE);
    }

    @Test
    @DisplayName("a response member without a response time is rejected by the store")
    void responsePairIsChecked() throws Exception {
        Schema.migrate(db);

        assertThatThrownBy(() -> exec("INSERT INTO challenges(created, guild_id, text_channel_id, message_id, challenge_type, responding_member_id) " +
                "VALUES('2024-01-01T00:00:00Z', 1, 2, 3, 'solo', 42)"))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("CHECK constraint failed");
    }

    private void exec(String sql) throws SQLException {
        try (Connection c = db.getConnection(); Statement st = c.createStatement()) {
            st.execute(sql);
        }
    }

    private int count(String where) throws SQLException {
        return scalar("SELECT COUNT(*) FROM sqlite_master WHERE " + where);
    }

    private int rows(String table) throws SQLException {
        return scalar("SELECT COUNT(*) FROM " + table);
    }

    private int scalar(String sql) throws SQLException {
        try (Connection c = db.getConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}

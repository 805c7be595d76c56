package ru.challenges.bot.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.challenges.bot.config.Config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final Config cfg;
    private final String jdbcUrl;

    public Database(Config cfg) throws IOException {
        this.cfg = Objects.requireNonNull(cfg);
        Path parent = cfg.dbPath().toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.jdbcUrl = "jdbc:sqlite:" + cfg.dbPath().toAbsolutePath();
    }

    public Connection getConnection() throws SQLException {
        Connection c = DriverManager.getConnection(jdbcUrl);
        // WAL lets readers proceed while a response is being written.
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL;");
            st.execute("PRAGMA busy_timeout=5000;");
        } catch (SQLException e) {
            log.warn("Could not apply connection pragmas on {}: {}", jdbcUrl, e.getMessage());
        }
        return c;
    }

    public Config config() {
        return cfg;
    }
}

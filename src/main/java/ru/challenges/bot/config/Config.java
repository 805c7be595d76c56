package ru.challenges.bot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;

public final class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private final Path dbPath;
    private final ZoneId zoneId;

    // Reports
    private final int historyDays;
    private final int maxMessageLen;

    private Config(
            Path dbPath,
            ZoneId zoneId,
            int historyDays,
            int maxMessageLen
    ) {
        this.dbPath = Objects.requireNonNull(dbPath);
        this.zoneId = Objects.requireNonNull(zoneId);
        this.historyDays = historyDays;
        this.maxMessageLen = maxMessageLen;
    }

    public static Config load() {
        String dbPath = get("DB_PATH", "./data/challenges.db");
        String tz = get("BOT_TIMEZONE", "UTC");

        int historyDays = getInt("HISTORY_DAYS", 3);
        int maxLen = getInt("MAX_MESSAGE_LEN", 2000);

        return new Config(
                Path.of(dbPath),
                ZoneId.of(tz),
                historyDays,
                maxLen
        );
    }

    /** Defaults pointed at the given database file. */
    public static Config forDatabase(Path dbPath) {
        return new Config(dbPath, ZoneId.of("UTC"), 3, 2000);
    }

    private static String get(String key, String def) {
        String env = System.getenv(key);
        if (env != null && !env.isBlank()) return env;
        String prop = System.getProperty(key);
        if (prop != null && !prop.isBlank()) return prop;
        return def;
    }

    private static int getInt(String key, int def) {
        String v = get(key, "");
        if (v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}, using {}", key, v, def);
            return def;
        }
    }

    public Path dbPath() { return dbPath; }
    public ZoneId zoneId() { return zoneId; }

    public int historyDays() { return historyDays; }
    public int maxMessageLen() { return maxMessageLen; }
}

package ru.challenges.bot.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigTest {

    @Test
    void forDatabaseUsesDefaults() {
        Config cfg = Config.forDatabase(Path.of("x.db"));

        assertThat(cfg.dbPath()).isEqualTo(Path.of("x.db"));
        assertThat(cfg.zoneId()).isEqualTo(ZoneId.of("UTC"));
        assertThat(cfg.historyDays()).isEqualTo(3);
        assertThat(cfg.maxMessageLen()).isEqualTo(2000);
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("MAX_MESSAGE_LEN", "500");
        System.setProperty("HISTORY_DAYS", "not-a-number");
        try {
            Config cfg = Config.load();
            if (System.getenv("MAX_MESSAGE_LEN") == null) {
                assertThat(cfg.maxMessageLen()).isEqualTo(500);
            }
            if (System.getenv("HISTORY_DAYS") == null) {
                assertThat(cfg.historyDays()).isEqualTo(3);
            }
        } finally {
            System.clearProperty("MAX_MESSAGE_LEN");
            System.clearProperty("HISTORY_DAYS");
        }
    }
}

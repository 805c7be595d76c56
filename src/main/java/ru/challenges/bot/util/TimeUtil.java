package ru.challenges.bot.util;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

public final class TimeUtil {
    private TimeUtil() {}

    public static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE; // yyyy-MM-dd
    // Fixed width so stored text sorts in time order.
    public static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    private static final long[] PERIOD_SECONDS = {
            60L * 60 * 24 * 365,
            60L * 60 * 24 * 30,
            60L * 60 * 24,
            60L * 60,
            60L,
            1L
    };
    private static final String[] PERIOD_NAMES = {"year", "month", "day", "hour", "minute", "second"};

    /** Current instant, millisecond precision, so stored text stays short. */
    public static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    /** UTC, millisecond precision: {@code 2024-01-01T00:05:00.000Z}. */
    public static String fmt(Instant t) {
        return STAMP.format(t);
    }

    /**
     * Reads instants written as {@code ...Z}, with an explicit offset, or in SQLite's
     * native {@code yyyy-MM-dd HH:mm:ss} form, which carries no offset and is UTC.
     */
    public static Instant parseInstant(String iso) {
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(iso.trim().replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        }
    }

    public static String utcDate(Instant t) {
        return LocalDate.ofInstant(t, ZoneOffset.UTC).format(DATE);
    }

    /** "1 hour, 2 minutes, 5 seconds". Negative durations are treated as zero. */
    public static String humanDuration(Duration d) {
        long seconds = Math.max(0, d.getSeconds());
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < PERIOD_SECONDS.length; i++) {
            if (seconds >= PERIOD_SECONDS[i]) {
                long value = seconds / PERIOD_SECONDS[i];
                seconds = seconds % PERIOD_SECONDS[i];
                parts.add(value + " " + PERIOD_NAMES[i] + (value > 1 ? "s" : ""));
            }
        }
        if (parts.isEmpty()) return "0 seconds";
        return String.join(", ", parts);
    }
}

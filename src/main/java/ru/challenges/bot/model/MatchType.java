package ru.challenges.bot.model;

import java.util.Locale;
import java.util.Optional;

public enum MatchType {
    SOLO("solo", "Solo"),
    SOLO_ULTRA("solo ultra", "Solo Ultra");

    private final String dbValue;
    private final String label;

    MatchType(String dbValue, String label) {
        this.dbValue = dbValue;
        this.label = label;
    }

    public String dbValue() { return dbValue; }
    public String label() { return label; }

    /** Accepts the stored value, the label or the constant name, in any case. */
    public static Optional<MatchType> parse(String v) {
        if (v == null) return Optional.empty();
        String s = v.trim().toLowerCase(Locale.ROOT).replace('_', ' ');
        for (MatchType t : values()) {
            if (t.dbValue.equals(s)) return Optional.of(t);
        }
        return Optional.empty();
    }
}

package ru.challenges.bot.db;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Maps SQLite constraint failures onto {@link DataAccessException} subtypes.
 * sqlite-jdbc reports every constraint under the same vendor code, so the
 * message text is what tells them apart.
 */
public final class SqlErrors {
    private SqlErrors() {}

    public static boolean isUniqueViolation(SQLException e) {
        return message(e).contains("unique constraint failed");
    }

    public static boolean isNotNullViolation(SQLException e) {
        return message(e).contains("not null constraint failed");
    }

    public static DataAccessException translate(String action, SQLException e) {
        if (isUniqueViolation(e)) {
            return new UniqueConstraintException(action + ": " + e.getMessage(), e);
        }
        if (isNotNullViolation(e)) {
            return new NotNullConstraintException(action + ": " + e.getMessage(), e);
        }
        return new DataAccessException(action + ": " + e.getMessage(), e);
    }

    private static String message(SQLException e) {
        String m = e.getMessage();
        return m == null ? "" : m.toLowerCase(Locale.ROOT);
    }
}

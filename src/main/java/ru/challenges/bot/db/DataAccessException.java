package ru.challenges.bot.db;

/**
 * Unchecked wrapper for storage failures. Subclasses name the constraint or
 * state that was violated so callers can react without inspecting SQL text.
 */
public class DataAccessException extends RuntimeException {

    public DataAccessException(String message) {
        super(message);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}

package ru.challenges.bot.db;

/** An object with one of our table or index names exists but has the wrong shape. */
public class SchemaConflictException extends DataAccessException {

    public SchemaConflictException(String message) {
        super(message);
    }

    public SchemaConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

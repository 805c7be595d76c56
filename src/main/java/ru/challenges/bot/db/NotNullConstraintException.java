package ru.challenges.bot.db;

public class NotNullConstraintException extends DataAccessException {

    public NotNullConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}

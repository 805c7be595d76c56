package ru.challenges.bot.db;

public class UniqueConstraintException extends DataAccessException {

    public UniqueConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}

package ru.challenges.bot.service;

import ru.challenges.bot.db.UniqueConstraintException;

public class DuplicateChallengeException extends UniqueConstraintException {

    public DuplicateChallengeException(long messageId, Throwable cause) {
        super("Challenge already registered for message " + messageId, cause);
    }
}

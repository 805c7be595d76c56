package ru.challenges.bot.service;

import ru.challenges.bot.db.DataAccessException;

/** A challenge takes exactly one response; a second one is rejected. */
public class ChallengeAlreadyRespondedException extends DataAccessException {

    public ChallengeAlreadyRespondedException(String message) {
        super(message);
    }
}

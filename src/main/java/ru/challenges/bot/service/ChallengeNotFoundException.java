package ru.challenges.bot.service;

import ru.challenges.bot.db.DataAccessException;

public class ChallengeNotFoundException extends DataAccessException {

    public ChallengeNotFoundException(String message) {
        super(message);
    }
}

package ru.challenges.bot.service;

import ru.challenges.bot.db.UniqueConstraintException;

public class MatchTypeRoleExistsException extends UniqueConstraintException {

    public MatchTypeRoleExistsException(long guildId, String matchType, long roleId, Throwable cause) {
        super("Role " + roleId + " is already registered for '" + matchType + "' in guild " + guildId, cause);
    }
}

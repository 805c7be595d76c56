package ru.challenges.bot.model;

public final class MatchTypeRole {
    public long id;
    public long guildId;
    public String matchType;
    public long roleId;
}

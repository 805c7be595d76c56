package ru.challenges.bot.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public final class Challenge {
    public long id;
    public Instant created;
    public long guildId;
    public long textChannelId;
    public long messageId;
    public String challengeType; // lower-case, e.g. "solo ultra"
    public ChallengeResponse response; // null while open

    public boolean isOpen() {
        return response == null;
    }

    public Optional<Duration> elapsed() {
        if (response == null) return Optional.empty();
        return Optional.of(Duration.between(created, response.respondedAt()));
    }
}

package ru.challenges.bot.model;

import java.time.Instant;
import java.util.Objects;

/** The member who accepted a challenge and when. Both halves are always set together. */
public record ChallengeResponse(long memberId, Instant respondedAt) {
    public ChallengeResponse {
        Objects.requireNonNull(respondedAt, "respondedAt");
    }
}

package ru.challenges.bot.service;

import ru.challenges.bot.config.Config;
import ru.challenges.bot.model.Challenge;
import ru.challenges.bot.util.TextChunker;
import ru.challenges.bot.util.TimeUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ReportService {

    private final Config cfg;
    private final ChallengeService challenges;
    private final ChallengeTracker tracker;

    public ReportService(Config cfg, ChallengeService challenges, ChallengeTracker tracker) {
        this.cfg = cfg;
        this.challenges = challenges;
        this.tracker = tracker;
    }

    public record Report(String title, List<String> pages) {}

    public Report openMatches(long guildId, Instant now) {
        List<String> lines = new ArrayList<>();
        for (Challenge c : tracker.openChallenges(guildId)) {
            String elapsed = TimeUtil.humanDuration(Duration.between(c.created, now));
            lines.add("[" + capitalize(c.challengeType) + "] message " + c.messageId +
                    " in channel " + c.textChannelId + ": " + elapsed);
        }
        String body = lines.isEmpty() ? "No Open matches" : String.join("\n", lines);
        return new Report("Open Matches", TextChunker.pages(body, cfg.maxMessageLen()));
    }

    public Report history(long guildId, int days, Instant now) {
        List<Challenge> done = challenges.listCompletedInLastDays(guildId, days, now);
        Duration total = Duration.ZERO;
        List<String> lines = new ArrayList<>();
        for (Challenge c : done) {
            Duration elapsed = c.elapsed().orElse(Duration.ZERO);
            total = total.plus(elapsed);
            lines.add(TimeUtil.utcDate(c.created) + "/" + capitalize(c.challengeType) + "/" +
                    c.response.memberId() + ": " + TimeUtil.humanDuration(elapsed));
        }
        String average = done.isEmpty() ? "(No Average)" : TimeUtil.humanDuration(total.dividedBy(done.size()));
        String title = done.size() + " Completed Challenges over " + days + " days Avg: " + average;
        String body = lines.isEmpty() ? "No History" : String.join("\n", lines);
        return new Report(title, TextChunker.pages(body, cfg.maxMessageLen()));
    }

    static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}

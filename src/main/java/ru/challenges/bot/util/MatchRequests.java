package ru.challenges.bot.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Recognises the match-request and acceptance messages posted in guild channels. */
public final class MatchRequests {
    private MatchRequests() {}

    private static final String REQUEST_MARKER = "new match request received!";
    private static final Pattern MATCH_TYPE = Pattern.compile("Type: .* (Solo Ultra|Solo)");

    public static boolean isMatchRequest(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(REQUEST_MARKER);
    }

    /** The match type named in a request, lower-cased as it is stored. */
    public static Optional<String> matchType(String text) {
        if (text == null) return Optional.empty();
        Matcher m = MATCH_TYPE.matcher(text);
        if (!m.find()) return Optional.empty();
        return Optional.of(m.group(1).toLowerCase(Locale.ROOT));
    }

    public static boolean isAcceptance(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains("accept");
    }
}

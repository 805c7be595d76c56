package ru.challenges.bot.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import ru.challenges.bot.model.Challenge;
import ru.challenges.bot.model.MatchTypeRole;

import java.util.List;

public final class JsonUtils {
    private JsonUtils() {}

    public static final Gson GSON = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    public static JsonObject obj() {
        return new JsonObject();
    }

    // Ids go out as strings: 64-bit snowflakes lose precision as JSON numbers in most readers.
    public static JsonObject toJson(Challenge c) {
        JsonObject o = new JsonObject();
        o.addProperty("id", c.id);
        o.addProperty("created", TimeUtil.fmt(c.created));
        o.addProperty("guildId", Long.toString(c.guildId));
        o.addProperty("textChannelId", Long.toString(c.textChannelId));
        o.addProperty("messageId", Long.toString(c.messageId));
        o.addProperty("challengeType", c.challengeType);
        if (c.response != null) {
            o.addProperty("respondingMemberId", Long.toString(c.response.memberId()));
            o.addProperty("respondedAt", TimeUtil.fmt(c.response.respondedAt()));
        }
        return o;
    }

    public static JsonObject toJson(MatchTypeRole r) {
        JsonObject o = new JsonObject();
        o.addProperty("id", r.id);
        o.addProperty("guildId", Long.toString(r.guildId));
        o.addProperty("matchType", r.matchType);
        o.addProperty("roleId", Long.toString(r.roleId));
        return o;
    }

    public static JsonArray challenges(List<Challenge> list) {
        JsonArray a = new JsonArray();
        for (Challenge c : list) a.add(toJson(c));
        return a;
    }

    public static JsonArray roles(List<MatchTypeRole> list) {
        JsonArray a = new JsonArray();
        for (MatchTypeRole r : list) a.add(toJson(r));
        return a;
    }
}

package ru.challenges.bot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.challenges.bot.model.Challenge;
import ru.challenges.bot.model.MatchTypeRole;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps open challenges and role mappings in memory so message handling does not
 * hit the database on every message. The database stays the source of truth and
 * {@link #load()} rebuilds the cache after a restart.
 */
public final class ChallengeTracker {
    private static final Logger log = LoggerFactory.getLogger(ChallengeTracker.class);

    public enum RoleToggle { ADDED, REMOVED }

    private final ChallengeService challenges;
    private final MatchTypeRoleService roles;

    private final Map<Long, Challenge> byMessage = new ConcurrentHashMap<>();
    private final Map<Long, List<MatchTypeRole>> rolesByGuild = new ConcurrentHashMap<>();

    public ChallengeTracker(ChallengeService challenges, MatchTypeRoleService roles) {
        this.challenges = challenges;
        this.roles = roles;
    }

    public void load() {
        byMessage.clear();
        rolesByGuild.clear();
        for (Challenge c : challenges.listAll(true)) byMessage.put(c.messageId, c);
        for (MatchTypeRole r : roles.listAll()) guildRoles(r.guildId).add(r);
        log.info("Loaded {} open challenges and role mappings for {} guilds", byMessage.size(), rolesByGuild.size());
    }

    public Challenge register(long guildId, long textChannelId, long messageId, String challengeType) {
        Challenge c = challenges.insert(guildId, textChannelId, messageId, challengeType);
        byMessage.put(c.messageId, c);
        return c;
    }

    public Challenge answer(long messageId, long memberId) {
        Challenge updated = challenges.respond(messageId, memberId);
        byMessage.put(updated.messageId, updated);
        return updated;
    }

    /** Cached challenge for the message, falling back to the database. */
    public Optional<Challenge> lookup(long messageId) {
        Challenge cached = byMessage.get(messageId);
        if (cached != null) return Optional.of(cached);
        Optional<Challenge> stored = challenges.findByMessageId(messageId);
        stored.ifPresent(c -> byMessage.put(c.messageId, c));
        return stored;
    }

    /** Drops a challenge from the cache only; the stored row is untouched. */
    public void forget(long messageId) {
        byMessage.remove(messageId);
    }

    public List<Challenge> openChallenges(long guildId) {
        List<Challenge> out = new ArrayList<>();
        for (Challenge c : byMessage.values()) {
            if (c.guildId == guildId && c.isOpen()) out.add(c);
        }
        out.sort(Comparator.comparing((Challenge c) -> c.created).thenComparingLong(c -> c.id));
        return out;
    }

    public MatchTypeRole addRole(long guildId, String matchType, long roleId) {
        MatchTypeRole r = roles.create(guildId, matchType, roleId);
        guildRoles(guildId).add(r);
        log.debug("Role {} added for '{}' in guild {}", roleId, matchType, guildId);
        return r;
    }

    public void removeRole(long guildId, long mappingId) {
        roles.delete(mappingId);
        guildRoles(guildId).removeIf(r -> r.id == mappingId);
        log.debug("Role mapping {} removed in guild {}", mappingId, guildId);
    }

    /** Adds the role for the match type, or removes it when it is already registered. */
    public RoleToggle toggleRole(long guildId, String matchType, long roleId) {
        for (MatchTypeRole r : guildRoles(guildId)) {
            if (r.roleId == roleId && r.matchType.equals(matchType)) {
                removeRole(guildId, r.id);
                return RoleToggle.REMOVED;
            }
        }
        addRole(guildId, matchType, roleId);
        return RoleToggle.ADDED;
    }

    /** Role ids to ping for the match type; every role of the guild when {@code matchType} is null. */
    public List<Long> roleIds(long guildId, String matchType) {
        List<Long> out = new ArrayList<>();
        for (MatchTypeRole r : rolesByGuild.getOrDefault(guildId, List.of())) {
            if (matchType == null || r.matchType.equals(matchType)) out.add(r.roleId);
        }
        return out;
    }

    public void onRoleDeleted(long guildId, long roleId) {
        for (MatchTypeRole r : new ArrayList<>(rolesByGuild.getOrDefault(guildId, List.of()))) {
            if (r.roleId == roleId) removeRole(guildId, r.id);
        }
    }

    /** Removes mappings whose role is gone from the guild, e.g. deleted while the bot was offline. */
    public int pruneMissingRoles(long guildId, Set<Long> existingRoleIds) {
        int removed = 0;
        for (MatchTypeRole r : new ArrayList<>(rolesByGuild.getOrDefault(guildId, List.of()))) {
            if (!existingRoleIds.contains(r.roleId)) {
                removeRole(guildId, r.id);
                removed++;
            }
        }
        return removed;
    }

    private List<MatchTypeRole> guildRoles(long guildId) {
        return rolesByGuild.computeIfAbsent(guildId, k -> new CopyOnWriteArrayList<>());
    }
}

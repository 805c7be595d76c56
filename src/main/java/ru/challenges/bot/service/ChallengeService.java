package ru.challenges.bot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.challenges.bot.db.Database;
import ru.challenges.bot.db.SqlErrors;
import ru.challenges.bot.model.Challenge;
import ru.challenges.bot.model.ChallengeResponse;
import ru.challenges.bot.util.TimeUtil;

import java.sql.*;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class ChallengeService {
    private static final Logger log = LoggerFactory.getLogger(ChallengeService.class);

    private final Database db;

    public ChallengeService(Database db) {
        this.db = db;
    }

    public Challenge insert(long guildId, long textChannelId, long messageId, String challengeType) {
        return insert(guildId, textChannelId, messageId, challengeType, TimeUtil.now());
    }

    /**
     * Registers a new, unanswered challenge.
     *
     * @throws DuplicateChallengeException if a challenge already exists for {@code messageId}
     * @throws ru.challenges.bot.db.NotNullConstraintException if {@code challengeType} or {@code created} is null
     */
    public Challenge insert(long guildId, long textChannelId, long messageId, String challengeType, Instant created) {
        String type = challengeType == null ? null : challengeType.trim().toLowerCase(Locale.ROOT);
        String createdIso = created == null ? null : TimeUtil.fmt(created);
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "INSERT INTO challenges(created, guild_id, text_channel_id, message_id, challenge_type) VALUES(?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS
            )) {
                ps.setString(1, createdIso);
                ps.setLong(2, guildId);
                ps.setLong(3, textChannelId);
                ps.setLong(4, messageId);
                ps.setString(5, type);
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    if (!keys.next()) throw new SQLException("No id returned");
                    Challenge ch = new Challenge();
                    ch.id = keys.getLong(1);
                    ch.created = created;
                    ch.guildId = guildId;
                    ch.textChannelId = textChannelId;
                    ch.messageId = messageId;
                    ch.challengeType = type;
                    log.debug("Challenge {} registered for message {} in guild {}", ch.id, messageId, guildId);
                    return ch;
                }
            }
        } catch (SQLException e) {
            if (SqlErrors.isUniqueViolation(e)) throw new DuplicateChallengeException(messageId, e);
            throw SqlErrors.translate("Insert challenge for message " + messageId, e);
        }
    }

    public Challenge respond(long messageId, long memberId) {
        return respond(messageId, memberId, TimeUtil.now());
    }

    /**
     * Records the member who accepted the challenge posted as {@code messageId}.
     *
     * @throws ChallengeNotFoundException if no challenge exists for the message
     * @throws ChallengeAlreadyRespondedException if the challenge was already answered
     */
    public Challenge respond(long messageId, long memberId, Instant respondedAt) {
        return respondWhere("message_id", messageId, memberId, respondedAt);
    }

    public Challenge respondById(long id, long memberId, Instant respondedAt) {
        return respondWhere("id", id, memberId, respondedAt);
    }

    public Optional<Challenge> findById(long id) {
        return findOne("id", id);
    }

    public Optional<Challenge> findByMessageId(long messageId) {
        return findOne("message_id", messageId);
    }

    public List<Challenge> listAll(boolean unrespondedOnly) {
        String sql = unrespondedOnly
                ? "SELECT * FROM challenges WHERE responded_at IS NULL ORDER BY id"
                : "SELECT * FROM challenges ORDER BY id";
        List<Challenge> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("List challenges", e);
        }
        return out;
    }

    public List<Challenge> listByGuild(long guildId) {
        List<Challenge> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM challenges WHERE guild_id=? ORDER BY id")) {
                ps.setLong(1, guildId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("List challenges of guild " + guildId, e);
        }
        return out;
    }

    /**
     * Answered challenges created on a UTC date between {@code now - days} and {@code now}, inclusive.
     *
     * @param guildId guild to scope to, or null for every guild
     */
    public List<Challenge> listCompletedInLastDays(Long guildId, int days, Instant now) {
        String from = TimeUtil.utcDate(now.minus(days, ChronoUnit.DAYS));
        String to = TimeUtil.utcDate(now);
        String sql = "SELECT * FROM challenges WHERE substr(created,1,10) BETWEEN ? AND ? AND responded_at IS NOT NULL" +
                (guildId == null ? "" : " AND guild_id=?") +
                " ORDER BY id";
        List<Challenge> out = new ArrayList<>();
        try (Connection c = db.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, from);
                ps.setString(2, to);
                if (guildId != null) ps.setLong(3, guildId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) out.add(map(rs));
                }
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("List completed challenges", e);
        }
        // Sorted here: rows written as SQLite-native text do not compare with ISO text.
        out.sort(Comparator.comparing((Challenge ch) -> ch.created).thenComparingLong(ch -> ch.id));
        return out;
    }

    // --- internals ---
    private Challenge respondWhere(String column, long key, long memberId, Instant respondedAt) {
        if (respondedAt == null) throw new IllegalArgumentException("respondedAt is required");
        try (Connection c = db.getConnection()) {
            int updated;
            // Conditional update: only the first responder wins.
            try (PreparedStatement ps = c.prepareStatement(
                    "UPDATE challenges SET responding_member_id=?, responded_at=? " +
                            "WHERE " + column + "=? AND responding_member_id IS NULL"
            )) {
                ps.setLong(1, memberId);
                ps.setString(2, TimeUtil.fmt(respondedAt));
                ps.setLong(3, key);
                updated = ps.executeUpdate();
            }
            Optional<Challenge> row = findOne(c, column, key);
            if (row.isEmpty()) {
                throw new ChallengeNotFoundException("No challenge with " + column + "=" + key);
            }
            if (updated == 0) {
                throw new ChallengeAlreadyRespondedException(
                        "Challenge " + row.get().id + " was already answered by member " + row.get().response.memberId());
            }
            log.debug("Challenge {} answered by member {}", row.get().id, memberId);
            return row.get();
        } catch (SQLException e) {
            throw SqlErrors.translate("Respond to challenge " + column + "=" + key, e);
        }
    }

    private Optional<Challenge> findOne(String column, long key) {
        try (Connection c = db.getConnection()) {
            return findOne(c, column, key);
        } catch (SQLException e) {
            throw SqlErrors.translate("Find challenge " + column + "=" + key, e);
        }
    }

    private static Optional<Challenge> findOne(Connection c, String column, long key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM challenges WHERE " + column + "=?")) {
            ps.setLong(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        }
    }

    private static Challenge map(ResultSet rs) throws SQLException {
        Challenge c = new Challenge();
        c.id = rs.getLong("id");
        c.created = TimeUtil.parseInstant(rs.getString("created"));
        c.guildId = rs.getLong("guild_id");
        c.textChannelId = rs.getLong("text_channel_id");
        c.messageId = rs.getLong("message_id");
        c.challengeType = rs.getString("challenge_type");
        long member = rs.getLong("responding_member_id");
        boolean noMember = rs.wasNull();
        String respondedAt = rs.getString("responded_at");
        if (!noMember && respondedAt != null) {
            c.response = new ChallengeResponse(member, TimeUtil.parseInstant(respondedAt));
        }
        return c;
    }
}

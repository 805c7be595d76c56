package ru.challenges.bot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.challenges.bot.config.Config;
import ru.challenges.bot.db.Database;
import ru.challenges.bot.db.Schema;
import ru.challenges.bot.model.Challenge;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChallengeTracker")
class ChallengeTrackerTest {

    private static final long GUILD = 1000;

    @TempDir
    Path dir;

    private ChallengeService challenges;
    private MatchTypeRoleService roles;
    private ChallengeTracker tracker;

    @BeforeEach
    void setUp() throws Exception {
        Database db = new Database(Config.forDatabase(dir.resolve("tracker.db")));
        Schema.migrate(db);
        challenges = new ChallengeService(db);
        roles = new MatchTypeRoleService(db);
        tracker = new ChallengeTracker(challenges, roles);
    }

    @Test
    @DisplayName("load restores open challenges oldest first and skips answered ones")
    void loadRestoresOpenChallenges() {
        Instant t0 = Instant.parse("2024-05-01T10:00:00Z");
        challenges.insert(GUILD, 1, 30, "solo", t0.plusSeconds(120));
        challenges.insert(GUILD, 1, 10, "solo", t0);
        challenges.insert(GUILD, 1, 20, "solo", t0.plusSeconds(60));
        challenges.insert(GUILD + 1, 1, 40, "solo", t0);
        challenges.respond(20, 5, t0.plusSeconds(90));

        tracker.load();

        assertThat(tracker.openChallenges(GUILD)).extracting(c -> c.messageId).containsExactly(10L, 30L);
        assertThat(tracker.openChallenges(GUILD + 1)).extracting(c -> c.messageId).containsExactly(40L);
    }

    @Test
    @DisplayName("an answered challenge leaves the open list but stays resolvable")
    void answerClosesChallenge() {
        tracker.register(GUILD, 1, 10, "Solo");

        Challenge answered = tracker.answer(10, 77);

        assertThat(answered.isOpen()).isFalse();
        assertThat(tracker.openChallenges(GUILD)).isEmpty();
        assertThat(tracker.lookup(10).orElseThrow().response.memberId()).isEqualTo(77L);
    }

    @Test
    @DisplayName("lookup falls back to the database for challenges missing from the cache")
    void lookupFallsBackToStore() {
        challenges.insert(GUILD, 1, 10, "solo");

        assertThat(tracker.lookup(10)).isPresent();
        assertThat(tracker.openChallenges(GUILD)).hasSize(1);
        assertThat(tracker.lookup(11)).isEmpty();

        tracker.forget(10);
        assertThat(tracker.openChallenges(GUILD)).isEmpty();
        assertThat(challenges.findByMessageId(10)).isPresent();
    }

    @Test
    @DisplayName("toggling a role adds it, toggling again removes it")
    void toggleRole() {
        assertThat(tracker.toggleRole(GUILD, "solo", 500)).isEqualTo(ChallengeTracker.RoleToggle.ADDED);
        assertThat(tracker.roleIds(GUILD, "solo")).containsExactly(500L);
        assertThat(roles.listFor(GUILD, "solo")).hasSize(1);

        assertThat(tracker.toggleRole(GUILD, "solo", 500)).isEqualTo(ChallengeTracker.RoleToggle.REMOVED);
        assertThat(tracker.roleIds(GUILD, "solo")).isEmpty();
        assertThat(roles.listFor(GUILD, "solo")).isEmpty();
    }

    @Test
    @DisplayName("role ids can be listed per match type or for the whole guild")
    void roleIdsByMatchType() {
        roles.create(GUILD, "solo", 1);
        roles.create(GUILD, "solo ultra", 2);
        roles.create(GUILD + 1, "solo", 3);
        tracker.load();

        assertThat(tracker.roleIds(GUILD, "solo")).containsExactly(1L);
        assertThat(tracker.roleIds(GUILD, null)).containsExactlyInAnyOrder(1L, 2L);
        assertThat(tracker.roleIds(GUILD + 2, null)).isEmpty();
    }

    @Test
    @DisplayName("deleting a guild role drops its mappings for every match type")
    void onRoleDeleted() {
        tracker.addRole(GUILD, "solo", 1);
        tracker.addRole(GUILD, "solo ultra", 1);
        tracker.addRole(GUILD, "solo", 2);

        tracker.onRoleDeleted(GUILD, 1);

        assertThat(tracker.roleIds(GUILD, null)).containsExactly(2L);
        assertThat(roles.listForGuild(GUILD)).extracting(r -> r.roleId).containsExactly(2L);
    }

    @Test
    @DisplayName("pruning keeps only roles that still exist in the guild")
    void pruneMissingRoles() {
        tracker.addRole(GUILD, "solo", 1);
        tracker.addRole(GUILD, "solo", 2);
        tracker.addRole(GUILD, "solo ultra", 3);

        int removed = tracker.pruneMissingRoles(GUILD, Set.of(2L));

        assertThat(removed).isEqualTo(2);
        assertThat(tracker.roleIds(GUILD, null)).containsExactly(2L);
        assertThat(roles.listAll()).hasSize(1);
    }
}

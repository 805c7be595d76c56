package ru.challenges.bot;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.challenges.bot.config.Config;
import ru.challenges.bot.db.DataAccessException;
import ru.challenges.bot.db.Database;
import ru.challenges.bot.db.Schema;
import ru.challenges.bot.model.MatchType;
import ru.challenges.bot.service.*;
import ru.challenges.bot.util.JsonUtils;
import ru.challenges.bot.util.MatchRequests;
import ru.challenges.bot.util.TimeUtil;

import java.io.File;
import java.io.PrintStream;
import java.time.Instant;
import java.util.Optional;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final String USAGE = String.join("\n",
            "usage: challenge-bot <command> [args]",
            "  init",
            "  register <guildId> <channelId> <messageId> <challengeType>",
            "  respond <messageId> <memberId>",
            "  parse <messageText>",
            "  open <guildId>",
            "  history <guildId> [days]",
            "  roles <guildId> [matchType]",
            "  set-role <guildId> <matchType> <roleId>",
            "  export <guildId> [days]");

    private App() {}

    public static void main(String[] args) throws Exception {
        Config cfg = Config.load();
        log.info("Using database {}", cfg.dbPath().toAbsolutePath());
        System.exit(run(args, cfg, System.out, System.err));
    }

    /** Runs one admin command and returns the process exit status. */
    static int run(String[] args, Config cfg, PrintStream out, PrintStream err) throws Exception {
        if (args.length == 0) {
            err.println(USAGE);
            return 2;
        }

        Instant now = TimeUtil.now();
        JsonObject result = JsonUtils.obj();
        try {
            Database db = new Database(cfg);
            Schema.migrate(db);

            // --- Services ---
            ChallengeService challengeService = new ChallengeService(db);
            MatchTypeRoleService roleService = new MatchTypeRoleService(db);
            ChallengeTracker tracker = new ChallengeTracker(challengeService, roleService);
            ReportService reports = new ReportService(cfg, challengeService, tracker);
            ExcelService excel = new ExcelService(cfg, challengeService);

            switch (args[0]) {
                case "init" -> {
                    JsonArray tables = new JsonArray();
                    tables.add(Schema.CHALLENGES);
                    tables.add(Schema.MATCH_TYPE_ROLES);
                    result.add("tables", tables);
                }
                case "register" -> {
                    long guildId = Long.parseLong(arg(args, 1));
                    long channelId = Long.parseLong(arg(args, 2));
                    long messageId = Long.parseLong(arg(args, 3));
                    result.add("challenge", JsonUtils.toJson(
                            challengeService.insert(guildId, channelId, messageId, arg(args, 4))));
                }
                case "respond" -> {
                    long messageId = Long.parseLong(arg(args, 1));
                    long memberId = Long.parseLong(arg(args, 2));
                    result.add("challenge", JsonUtils.toJson(challengeService.respond(messageId, memberId, now)));
                }
                case "parse" -> {
                    String text = arg(args, 1);
                    result.addProperty("matchRequest", MatchRequests.isMatchRequest(text));
                    MatchRequests.matchType(text).ifPresent(t -> result.addProperty("matchType", t));
                    result.addProperty("acceptance", MatchRequests.isAcceptance(text));
                }
                case "open" -> {
                    long guildId = Long.parseLong(arg(args, 1));
                    tracker.load();
                    putReport(result, reports.openMatches(guildId, now));
                    result.add("challenges", JsonUtils.challenges(tracker.openChallenges(guildId)));
                }
                case "history" -> {
                    long guildId = Long.parseLong(arg(args, 1));
                    int days = args.length > 2 ? Integer.parseInt(args[2]) : cfg.historyDays();
                    putReport(result, reports.history(guildId, days, now));
                }
                case "roles" -> {
                    long guildId = Long.parseLong(arg(args, 1));
                    result.add("roles", JsonUtils.roles(args.length > 2
                            ? roleService.listFor(guildId, matchType(args[2]))
                            : roleService.listForGuild(guildId)));
                }
                case "set-role" -> {
                    long guildId = Long.parseLong(arg(args, 1));
                    String matchType = matchType(arg(args, 2));
                    long roleId = Long.parseLong(arg(args, 3));
                    tracker.load();
                    result.addProperty("result", tracker.toggleRole(guildId, matchType, roleId).name());
                }
                case "export" -> {
                    long guildId = Long.parseLong(arg(args, 1));
                    int days = args.length > 2 ? Integer.parseInt(args[2]) : cfg.historyDays();
                    File file = excel.buildHistoryExcel(guildId, days, now);
                    result.addProperty("file", file.getAbsolutePath());
                }
                default -> {
                    err.println("unknown command: " + args[0]);
                    err.println(USAGE);
                    return 2;
                }
            }
        } catch (DataAccessException e) {
            log.error("{} failed: {}", args[0], e.getMessage());
            err.println(e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            // NumberFormatException is an IllegalArgumentException
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }

        out.println(JsonUtils.GSON.toJson(result));
        return 0;
    }

    private static String arg(String[] args, int i) {
        if (i >= args.length) throw new IndexOutOfBoundsException("missing argument #" + i + " for " + args[0]);
        return args[i];
    }

    private static String matchType(String raw) {
        Optional<MatchType> t = MatchType.parse(raw);
        if (t.isEmpty()) throw new IllegalArgumentException("unknown match type: " + raw);
        return t.get().dbValue();
    }

    private static void putReport(JsonObject result, ReportService.Report report) {
        result.addProperty("title", report.title());
        JsonArray pages = new JsonArray();
        report.pages().forEach(pages::add);
        result.add("pages", pages);
    }
}

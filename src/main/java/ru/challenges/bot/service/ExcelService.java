package ru.challenges.bot.service;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.challenges.bot.config.Config;
import ru.challenges.bot.model.Challenge;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;

public final class ExcelService {
    private static final Logger log = LoggerFactory.getLogger(ExcelService.class);

    public static final String SHEET = "History";
    static final String[] HEADER = {
            "Created", "Type", "Channel", "Message", "Member", "Responded at", "Response (s)"
    };

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Config cfg;
    private final ChallengeService challenges;

    public ExcelService(Config cfg, ChallengeService challenges) {
        this.cfg = cfg;
        this.challenges = challenges;
    }

    /** Completed challenges of the guild over the last {@code days} days as an .xlsx temp file. */
    public File buildHistoryExcel(long guildId, int days, Instant now) {
        List<Challenge> done = challenges.listCompletedInLastDays(guildId, days, now);
        File tmp;
        try {
            tmp = File.createTempFile("challenges_", "_guild_" + guildId + "_history.xlsx");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create history export for guild " + guildId, e);
        }
        write(tmp, done);
        return tmp;
    }

    /** Writes the history workbook to {@code target}; removes {@code target} when writing fails. */
    void write(File target, List<Challenge> done) {
        DateTimeFormatter stamp = STAMP.withZone(cfg.zoneId());
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet(SHEET);

            int r = 0;
            Row header = sheet.createRow(r++);
            for (int i = 0; i < HEADER.length; i++) header.createCell(i).setCellValue(HEADER[i]);

            for (Challenge c : done) {
                Row row = sheet.createRow(r++);
                int cc = 0;
                row.createCell(cc++).setCellValue(stamp.format(c.created));
                row.createCell(cc++).setCellValue(c.challengeType);
                // Snowflake ids exceed double precision, keep them as text.
                row.createCell(cc++).setCellValue(Long.toString(c.textChannelId));
                row.createCell(cc++).setCellValue(Long.toString(c.messageId));
                row.createCell(cc++).setCellValue(Long.toString(c.response.memberId()));
                row.createCell(cc++).setCellValue(stamp.format(c.response.respondedAt()));
                row.createCell(cc++).setCellValue(c.elapsed().orElse(Duration.ZERO).getSeconds());
            }

            for (int i = 0; i < HEADER.length; i++) sheet.setColumnWidth(i, 22 * 256);

            try (FileOutputStream fos = new FileOutputStream(target)) {
                wb.write(fos);
            }
        } catch (IOException e) {
            if (target.exists() && !target.delete()) {
                log.warn("Could not remove partial export {}", target.getAbsolutePath());
            }
            throw new UncheckedIOException("Could not write history export " + target.getName(), e);
        }
    }
}

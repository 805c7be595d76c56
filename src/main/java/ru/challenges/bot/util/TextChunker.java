package ru.challenges.bot.util;

import java.util.ArrayList;
import java.util.List;

public final class TextChunker {

    private TextChunker() {}

    /**
     * Splits report text into pages of at most {@code maxLen} characters,
     * breaking between lines. A single line longer than a page is cut hard.
     */
    public static List<String> pages(String text, int maxLen) {
        if (maxLen <= 0) throw new IllegalArgumentException("maxLen must be positive: " + maxLen);
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        if (text.length() <= maxLen) {
            out.add(text);
            return out;
        }
        StringBuilder page = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            while (line.length() > maxLen) {
                flush(page, out);
                out.add(line.substring(0, maxLen));
                line = line.substring(maxLen);
            }
            int needed = page.length() == 0 ? line.length() : page.length() + 1 + line.length();
            if (needed > maxLen) flush(page, out);
            if (page.length() > 0) page.append('\n');
            page.append(line);
        }
        flush(page, out);
        return out;
    }

    private static void flush(StringBuilder page, List<String> out) {
        if (page.length() > 0) out.add(page.toString());
        page.setLength(0);
    }
}

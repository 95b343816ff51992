package com.boardsync.crawl.jobs;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Removes decoration from extracted text while leaving the wording untouched.
 */
@Component
public class JobTextCleaner {
    private static final Pattern DECORATIVE = Pattern.compile(
        "[\\p{So}\\p{Cs}\\x{FE0E}\\x{FE0F}\\x{200D}\\x{20E3}\\x{2B50}\\x{2728}]"
    );
    private static final Pattern BULLET = Pattern.compile("(?m)^[ \\t]*(?:[•●▪◦·‣∙■□➢➤►▶✓✔]|\\*|-|–|—)[ \\t]*");
    private static final Pattern SPACES = Pattern.compile("[ \\t\\x{00A0}]+");
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    public String clean(String value) {
        if (value == null) {
            return null;
        }
        String text = value.replace("\r\n", "\n").replace('\r', '\n');
        text = DECORATIVE.matcher(text).replaceAll("");
        text = BULLET.matcher(text).replaceAll("- ");
        text = SPACES.matcher(text).replaceAll(" ");
        StringBuilder out = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            String trimmed = line.trim();
            if ("-".equals(trimmed)) {
                continue;
            }
            out.append(trimmed).append('\n');
        }
        String collapsed = BLANK_LINES.matcher(out.toString()).replaceAll("\n\n").trim();
        return collapsed.isEmpty() ? null : collapsed;
    }
}

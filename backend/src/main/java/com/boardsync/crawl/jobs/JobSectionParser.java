package com.boardsync.crawl.jobs;

import com.boardsync.crawl.model.JobFields;
import com.boardsync.crawl.model.SalaryRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Splits plain posting text into sections by recognizing header lines, including the emoji-led headers some
 * ATS templates use (e.g. "🚀 What you'll do").
 */
@Component
public class JobSectionParser {
    private static final int MAX_HEADER_LENGTH = 80;
    private static final Pattern LEADING_DECORATION = Pattern.compile("^[\\p{So}\\p{Cs}\\x{FE0F}\\x{200D}\\s#*:|>-]+");
    private static final Pattern TRAILING_DECORATION = Pattern.compile("[\\p{So}\\p{Cs}\\x{FE0F}\\x{200D}\\s:*!?.-]+$");
    private static final Pattern EMOJI_LEAD = Pattern.compile("^[\\p{So}\\p{Cs}]");

    enum Section {
        ABOUT_JOB,
        QUALIFICATIONS,
        BENEFITS,
        ABOUT_COMPANY
    }

    // Checked in insertion order; the broad job-description phrases come last.
    private static final Map<Section, List<String>> HEADERS = new LinkedHashMap<>();

    static {
        HEADERS.put(Section.QUALIFICATIONS, List.of(
            "requirements", "qualifications", "minimum qualifications", "preferred qualifications",
            "basic qualifications", "what you need", "what you'll need", "what you will need", "you have",
            "you might be a fit", "who you are", "what we're looking for", "what we are looking for",
            "required skills", "skills", "about you", "you bring", "you may be a good fit"
        ));
        HEADERS.put(Section.BENEFITS, List.of(
            "benefits", "what we offer", "perks", "compensation", "total rewards", "package", "why join us",
            "what's in it for you"
        ));
        HEADERS.put(Section.ABOUT_COMPANY, List.of(
            "about us", "about the company", "who we are", "our mission", "company overview"
        ));
        HEADERS.put(Section.ABOUT_JOB, List.of(
            "responsibilities", "what you'll do", "what you will do", "what you'll be doing", "you will",
            "duties", "role description", "job description", "about the role", "the role", "about this role",
            "your role", "the opportunity", "in this role", "day to day"
        ));
    }

    private static final List<String> REMOTE = List.of("100% remote", "fully remote", "remote-first", "remote first", "work from anywhere");
    private static final List<String> HYBRID = List.of("hybrid");
    private static final List<String> ONSITE = List.of("on-site", "onsite", "in-office", "office-based", "in office");

    private final SalaryParser salaryParser;

    public JobSectionParser(SalaryParser salaryParser) {
        this.salaryParser = salaryParser;
    }

    public JobFields parse(String text) {
        if (text == null || text.isBlank()) {
            return JobFields.empty();
        }
        Map<Section, List<String>> sections = new EnumMap<>(Section.class);
        Section current = Section.ABOUT_JOB;
        for (String rawLine : text.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            Optional<Section> header = headerOf(line);
            if (header.isPresent()) {
                current = header.get();
                continue;
            }
            sections.computeIfAbsent(current, ignored -> new ArrayList<>()).add(line);
        }

        String salary = salaryParser.parse(text).map(SalaryRange::display).orElse(null);
        return new JobFields(
            null,
            null,
            join(sections.get(Section.ABOUT_COMPANY)),
            null,
            null,
            null,
            join(sections.get(Section.ABOUT_JOB)),
            join(sections.get(Section.QUALIFICATIONS)),
            join(sections.get(Section.BENEFITS)),
            salary,
            detectWorkEnvironment(text),
            null
        );
    }

    Optional<Section> headerOf(String line) {
        if (line.length() > MAX_HEADER_LENGTH) {
            return Optional.empty();
        }
        boolean emojiLed = EMOJI_LEAD.matcher(line).find();
        boolean colonTerminated = line.endsWith(":");
        String label = TRAILING_DECORATION.matcher(LEADING_DECORATION.matcher(line).replaceAll("")).replaceAll("")
            .toLowerCase(Locale.ROOT)
            .replace('’', '\'');
        if (label.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<Section, List<String>> entry : HEADERS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (label.equals(keyword)) {
                    return Optional.of(entry.getKey());
                }
                if ((emojiLed || colonTerminated) && label.contains(keyword)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        if (label.startsWith("about ") && label.split("\\s+").length <= 3 && !label.contains("you")) {
            return Optional.of(Section.ABOUT_COMPANY);
        }
        return Optional.empty();
    }

    public String detectWorkEnvironment(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (REMOTE.stream().anyMatch(lower::contains)) {
            return "Remote";
        }
        if (HYBRID.stream().anyMatch(lower::contains)) {
            return "Hybrid";
        }
        if (ONSITE.stream().anyMatch(lower::contains)) {
            return "Onsite";
        }
        return null;
    }

    private String join(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return null;
        }
        return String.join("\n", lines);
    }
}

package com.boardsync.crawl.jobs;

import com.boardsync.crawl.model.SalaryPeriod;
import com.boardsync.crawl.model.SalaryRange;
import org.springframework.stereotype.Component;

import java.text.NumberFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class SalaryParser {
    private static final Pattern RANGE_K = Pattern.compile("(?i)\\$(\\d{1,3}(?:\\.\\d)?)K\\s*[-–—]\\s*\\$?(\\d{1,3}(?:\\.\\d)?)K");
    private static final Pattern RANGE = Pattern.compile("\\$(\\d{1,3}(?:,\\d{3})+|\\d{2,7}(?:\\.\\d{2})?)\\s*(?:[-–—]|to)\\s*\\$?(\\d{1,3}(?:,\\d{3})+|\\d{2,7}(?:\\.\\d{2})?)");
    private static final Pattern SINGLE_K = Pattern.compile("(?i)\\$(\\d{1,3}(?:\\.\\d)?)K\\b");
    private static final Pattern SINGLE = Pattern.compile("\\$(\\d{1,3}(?:,\\d{3})+|\\d{2,7}(?:\\.\\d{2})?)");

    private static final List<String> HOURLY = List.of("per hour", "hourly", "/hour", "/hr", "an hour", "per hr");
    private static final List<String> MONTHLY = List.of("per month", "monthly", "/month", "/mo");
    private static final List<String> YEARLY = List.of("per year", "annually", "annual", "yearly", "/year", "/yr", "per annum");

    public Optional<SalaryRange> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        SalaryPeriod period = detectPeriod(value);

        Matcher matcher = RANGE_K.matcher(value);
        if (matcher.find()) {
            return Optional.of(range(thousands(matcher.group(1)), thousands(matcher.group(2)), period));
        }
        matcher = RANGE.matcher(value);
        if (matcher.find()) {
            return Optional.of(range(number(matcher.group(1)), number(matcher.group(2)), period));
        }
        matcher = SINGLE_K.matcher(value);
        if (matcher.find()) {
            return Optional.of(single(thousands(matcher.group(1)), period));
        }
        matcher = SINGLE.matcher(value);
        if (matcher.find()) {
            return Optional.of(single(number(matcher.group(1)), period));
        }
        return Optional.empty();
    }

    SalaryPeriod detectPeriod(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (HOURLY.stream().anyMatch(lower::contains)) {
            return SalaryPeriod.HOURLY;
        }
        if (MONTHLY.stream().anyMatch(lower::contains)) {
            return SalaryPeriod.MONTHLY;
        }
        if (YEARLY.stream().anyMatch(lower::contains)) {
            return SalaryPeriod.YEARLY;
        }
        return SalaryPeriod.UNKNOWN;
    }

    private SalaryRange range(long min, long max, SalaryPeriod period) {
        SalaryPeriod resolved = resolvePeriod(period, max);
        return new SalaryRange(format(min) + " - " + format(max), min, max, resolved);
    }

    private SalaryRange single(long amount, SalaryPeriod period) {
        return new SalaryRange(format(amount), amount, null, resolvePeriod(period, amount));
    }

    // Amounts under 500 without a stated period are wage rates.
    private SalaryPeriod resolvePeriod(SalaryPeriod period, long amount) {
        if (period != SalaryPeriod.UNKNOWN) {
            return period;
        }
        return amount < 500 ? SalaryPeriod.HOURLY : SalaryPeriod.YEARLY;
    }

    private long thousands(String raw) {
        return Math.round(Double.parseDouble(raw) * 1000);
    }

    private long number(String raw) {
        return Math.round(Double.parseDouble(raw.replace(",", "")));
    }

    private String format(long amount) {
        return "$" + NumberFormat.getIntegerInstance(Locale.US).format(amount);
    }
}

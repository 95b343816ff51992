package com.boardsync.crawl.ats;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives an employer display name from the tenant slug of a hosted ATS URL.
 */
@Component
public class CompanyNameResolver {
    private static final Pattern GREENHOUSE = Pattern.compile("(?i)^https?://(?:boards|job-boards)\\.greenhouse\\.io/([A-Za-z0-9._-]+)");
    private static final Pattern LEVER = Pattern.compile("(?i)^https?://jobs\\.lever\\.co/([A-Za-z0-9._-]+)");
    private static final Pattern ASHBY = Pattern.compile("(?i)^https?://jobs\\.ashbyhq\\.com/([A-Za-z0-9._%-]+)");
    private static final Pattern WORKDAY = Pattern.compile("(?i)^https?://([A-Za-z0-9-]+)\\.wd\\d+\\.myworkdayjobs\\.com");
    private static final Pattern SMARTRECRUITERS = Pattern.compile("(?i)^https?://jobs\\.smartrecruiters\\.com/([A-Za-z0-9._-]+)");
    private static final Pattern WORKABLE = Pattern.compile("(?i)^https?://apply\\.workable\\.com/([A-Za-z0-9._-]+)");
    private static final Pattern[] PATTERNS = {GREENHOUSE, LEVER, ASHBY, WORKDAY, SMARTRECRUITERS, WORKABLE};

    public Optional<String> fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(trimmed);
            if (matcher.find()) {
                String slug = matcher.group(1).replace("%20", " ");
                if ("embed".equalsIgnoreCase(slug)) {
                    continue;
                }
                return Optional.of(titleCase(slug));
            }
        }
        return Optional.empty();
    }

    static String titleCase(String slug) {
        return Arrays.stream(slug.replace('-', ' ').replace('_', ' ').trim().split("\\s+"))
            .filter(word -> !word.isBlank())
            .map(word -> word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1))
            .collect(Collectors.joining(" "));
    }
}

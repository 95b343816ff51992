package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

@Component
public class AtsDetector {
    public AtsType detect(String url) {
        if (url == null || url.isBlank()) {
            return AtsType.GENERIC;
        }
        String host = extractHost(url);
        if (host == null) {
            return AtsType.GENERIC;
        }

        if (host.endsWith("myworkdayjobs.com") || host.contains("workdayjobs")) {
            return AtsType.WORKDAY;
        }
        if (host.endsWith("greenhouse.io") || host.equals("grnh.se")) {
            return AtsType.GREENHOUSE;
        }
        if (host.equals("jobs.lever.co") || host.equals("apply.lever.co")) {
            return AtsType.LEVER;
        }
        if (host.equals("jobs.ashbyhq.com")) {
            return AtsType.ASHBY;
        }
        if (host.endsWith("smartrecruiters.com")) {
            return AtsType.SMARTRECRUITERS;
        }
        if (host.endsWith("workable.com")) {
            return AtsType.WORKABLE;
        }
        if (url.toLowerCase(Locale.ROOT).contains("gh_jid=")) {
            return AtsType.GREENHOUSE;
        }
        return AtsType.GENERIC;
    }

    public AtsType detectFromHtml(String html) {
        if (html == null || html.isBlank()) {
            return AtsType.GENERIC;
        }
        String lower = html.toLowerCase(Locale.ROOT);
        if (lower.contains("myworkdayjobs.com") || lower.contains("/wday/cxs/")) {
            return AtsType.WORKDAY;
        }
        if (lower.contains("boards.greenhouse.io") || lower.contains("job-boards.greenhouse.io")) {
            return AtsType.GREENHOUSE;
        }
        if (lower.contains("jobs.lever.co")) {
            return AtsType.LEVER;
        }
        if (lower.contains("jobs.ashbyhq.com")) {
            return AtsType.ASHBY;
        }
        if (lower.contains("jobs.smartrecruiters.com")) {
            return AtsType.SMARTRECRUITERS;
        }
        if (lower.contains("apply.workable.com")) {
            return AtsType.WORKABLE;
        }
        return AtsType.GENERIC;
    }

    public AtsType detect(String url, String html) {
        AtsType byUrl = detect(url);
        if (byUrl != AtsType.GENERIC) {
            return byUrl;
        }
        return detectFromHtml(html);
    }

    private String extractHost(String url) {
        try {
            URI uri = new URI(url.trim());
            if (uri.getHost() != null) {
                return uri.getHost().toLowerCase(Locale.ROOT);
            }
            URI withHttps = new URI("https://" + url.trim());
            return withHttps.getHost() == null ? null : withHttps.getHost().toLowerCase(Locale.ROOT);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}

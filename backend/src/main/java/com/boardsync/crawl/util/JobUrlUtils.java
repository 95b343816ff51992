package com.boardsync.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class JobUrlUtils {
    private static final Set<String> TRACKING_PARAMS = Set.of(
        "utm_source",
        "utm_medium",
        "utm_campaign",
        "utm_content",
        "utm_term",
        "ref",
        "source",
        "campaign",
        "gh_src",
        "lever-source",
        "lever-origin",
        "lever-via"
    );

    private JobUrlUtils() {
    }

    /**
     * Identity form of a posting URL: lowercase scheme and host, no fragment, no tracking parameters and no
     * trailing slash. Returns the trimmed input unchanged when it cannot be parsed as an absolute http(s) URL.
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return trimmed;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return trimmed;
        }

        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1 && !isDefaultPort(scheme, uri.getPort())) {
            out.append(':').append(uri.getPort());
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (!"/".equals(path)) {
            out.append(path);
        }
        String query = stripTracking(uri.getRawQuery());
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.startsWith("#") || trimmed.toLowerCase(Locale.ROOT).startsWith("javascript:")
            || trimmed.toLowerCase(Locale.ROOT).startsWith("mailto:")) {
            return null;
        }
        URI base = safeUri(baseUrl);
        try {
            URI resolved = base == null ? new URI(trimmed) : base.resolve(trimmed);
            return resolved.getHost() == null ? null : resolved.toString();
        } catch (URISyntaxException | IllegalArgumentException ignored) {
            return null;
        }
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String stripTracking(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = (eq < 0 ? pair : pair.substring(0, eq)).toLowerCase(Locale.ROOT);
            // lever-source%5B%5D=LinkedIn
            if (name.endsWith("%5b%5d")) {
                name = name.substring(0, name.length() - 6);
            }
            if (!TRACKING_PARAMS.contains(name)) {
                kept.add(pair);
            }
        }
        return String.join("&", kept);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}

package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizes individual job-posting URLs on the hosted ATS platforms.
 */
final class AtsJobLinks {
    private static final Pattern GREENHOUSE_PATH = Pattern.compile("^/[A-Za-z0-9._-]+/jobs/\\d+/?$");
    private static final Pattern GREENHOUSE_JID = Pattern.compile("(?:^|&)gh_jid=\\d+");
    private static final Pattern UUID_PATH = Pattern.compile("^/[A-Za-z0-9._-]+/[0-9a-fA-F-]{36}/?$");
    private static final Pattern SMARTRECRUITERS_PATH = Pattern.compile("^/[A-Za-z0-9._-]+/\\d+[A-Za-z0-9-]*/?$");
    private static final Pattern WORKABLE_PATH = Pattern.compile("^/[A-Za-z0-9._-]+/j/[A-Za-z0-9]+/?$");
    private static final Pattern SITE_JOB_PATH = Pattern.compile("(?i)^/(?:[a-z0-9_-]+/)*(?:jobs?|careers?|positions?|openings?)/[^/]+.*$");

    private AtsJobLinks() {
    }

    static AtsType hostedJobLink(URI uri) {
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        String path = uri.getPath() == null ? "" : uri.getPath();
        String query = uri.getQuery() == null ? "" : uri.getQuery();
        if (host.endsWith("greenhouse.io") && GREENHOUSE_PATH.matcher(path).matches()) {
            return AtsType.GREENHOUSE;
        }
        if (GREENHOUSE_JID.matcher(query).find()) {
            return AtsType.GREENHOUSE;
        }
        if (host.equals("jobs.lever.co") && UUID_PATH.matcher(path).matches()) {
            return AtsType.LEVER;
        }
        if (host.equals("jobs.ashbyhq.com") && UUID_PATH.matcher(path).matches()) {
            return AtsType.ASHBY;
        }
        if (host.endsWith("myworkdayjobs.com") && path.contains("/job/")) {
            return AtsType.WORKDAY;
        }
        if (host.equals("jobs.smartrecruiters.com") && SMARTRECRUITERS_PATH.matcher(path).matches()) {
            return AtsType.SMARTRECRUITERS;
        }
        if (host.equals("apply.workable.com") && WORKABLE_PATH.matcher(path).matches()) {
            return AtsType.WORKABLE;
        }
        return null;
    }

    static boolean isSiteJobLink(URI uri, URI listing) {
        if (uri == null || listing == null || uri.getHost() == null || listing.getHost() == null) {
            return false;
        }
        if (!uri.getHost().equalsIgnoreCase(listing.getHost())) {
            return false;
        }
        String path = uri.getPath() == null ? "" : uri.getPath();
        String listingPath = listing.getPath() == null ? "" : listing.getPath();
        if (trimSlash(path).equalsIgnoreCase(trimSlash(listingPath))) {
            return false;
        }
        return SITE_JOB_PATH.matcher(path).matches();
    }

    private static String trimSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}

package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import com.boardsync.crawl.model.JobFields;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Per-platform behaviour of one applicant tracking system.
 */
public interface AtsPlatform {
    AtsType type();

    /**
     * Job-posting links found on a rendered listing page, absolute and in document order. May contain duplicates.
     */
    List<String> collectUrls(Document listing, String listingUrl);

    /**
     * Selector-based field extraction for a rendered job page. Returns {@link JobFields#empty()} when nothing matched.
     */
    JobFields extractFallbackFields(Document page, String url);
}

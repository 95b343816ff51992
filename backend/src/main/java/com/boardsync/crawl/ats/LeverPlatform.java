package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class LeverPlatform extends AbstractAtsPlatform {
    @Override
    public AtsType type() {
        return AtsType.LEVER;
    }

    @Override
    protected String rewriteLink(String href) {
        // Apply pages carry the same posting under a suffix.
        if (href.endsWith("/apply")) {
            return href.substring(0, href.length() - "/apply".length());
        }
        return href;
    }

    @Override
    protected List<String> titleSelectors() {
        return List.of(".posting-headline h2", ".posting-header h2", "h2");
    }

    @Override
    protected List<String> locationSelectors() {
        return List.of(".posting-categories .location", ".sort-by-location", ".location");
    }

    @Override
    protected List<String> employmentTypeSelectors() {
        return List.of(".posting-categories .commitment", ".sort-by-commitment");
    }

    @Override
    protected List<String> descriptionSelectors() {
        return List.of(".section-wrapper.page-full-width", ".posting-page .content", ".content");
    }
}

package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GreenhousePlatform extends AbstractAtsPlatform {
    @Override
    public AtsType type() {
        return AtsType.GREENHOUSE;
    }

    @Override
    protected List<String> titleSelectors() {
        return List.of("h1.app-title", ".job__title h1", "h1.section-header", "h1");
    }

    @Override
    protected List<String> locationSelectors() {
        return List.of("#header .location", ".job__location", "div.location", ".location");
    }

    @Override
    protected List<String> descriptionSelectors() {
        return List.of("#content", ".job__description", "#app_body", "main");
    }

    @Override
    protected List<String> companySelectors() {
        return List.of("#header .company-name", ".company-name", "meta[property=og:site_name]");
    }
}

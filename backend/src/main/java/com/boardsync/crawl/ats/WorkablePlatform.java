package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class WorkablePlatform extends AbstractAtsPlatform {
    @Override
    public AtsType type() {
        return AtsType.WORKABLE;
    }

    @Override
    protected List<String> titleSelectors() {
        return List.of("[data-ui=job-title]", "h1");
    }

    @Override
    protected List<String> locationSelectors() {
        return List.of("[data-ui=job-location]", "[data-ui=overview-location]");
    }

    @Override
    protected List<String> employmentTypeSelectors() {
        return List.of("[data-ui=job-type]", "[data-ui=overview-employment-type]");
    }

    @Override
    protected List<String> descriptionSelectors() {
        return List.of("[data-ui=job-description]", "section[data-ui]", "main");
    }
}

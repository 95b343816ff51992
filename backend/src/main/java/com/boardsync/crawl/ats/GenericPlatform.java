package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GenericPlatform extends AbstractAtsPlatform {
    @Override
    public AtsType type() {
        return AtsType.GENERIC;
    }

    @Override
    protected List<String> titleSelectors() {
        return List.of("h1", "meta[property=og:title]", "title");
    }

    @Override
    protected List<String> locationSelectors() {
        return List.of("[itemprop=jobLocation]", "[class*=job-location]", "[class*=location]");
    }

    @Override
    protected List<String> employmentTypeSelectors() {
        return List.of("[itemprop=employmentType]", "[class*=employment-type]", "[class*=commitment]");
    }

    @Override
    protected List<String> descriptionSelectors() {
        return List.of("[itemprop=description]", "[class*=job-description]", "article", "main");
    }
}

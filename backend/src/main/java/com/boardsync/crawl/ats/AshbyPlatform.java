package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AshbyPlatform extends AbstractAtsPlatform {
    @Override
    public AtsType type() {
        return AtsType.ASHBY;
    }

    @Override
    protected List<String> titleSelectors() {
        return List.of("h1[class*=title]", "h1", "meta[property=og:title]");
    }

    @Override
    protected List<String> locationSelectors() {
        return List.of("[class*=_location]", "[class*=location]");
    }

    @Override
    protected List<String> employmentTypeSelectors() {
        return List.of("[class*=employmentType]", "[class*=_employment]");
    }

    @Override
    protected List<String> descriptionSelectors() {
        return List.of("[class*=_descriptionText]", "[class*=description]", "main");
    }
}

package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SmartRecruitersPlatform extends AbstractAtsPlatform {
    @Override
    public AtsType type() {
        return AtsType.SMARTRECRUITERS;
    }

    @Override
    protected List<String> titleSelectors() {
        return List.of("h1.job-title", "h1[itemprop=title]", "h1");
    }

    @Override
    protected List<String> locationSelectors() {
        return List.of("spl-job-location", "[itemprop=jobLocation]", ".job-location");
    }

    @Override
    protected List<String> employmentTypeSelectors() {
        return List.of("[itemprop=employmentType]", ".job-details li");
    }

    @Override
    protected List<String> descriptionSelectors() {
        return List.of(".job-sections", "[itemprop=description]", "main");
    }

    @Override
    protected List<String> companySelectors() {
        return List.of("[itemprop=hiringOrganization] [itemprop=name]", "meta[property=og:site_name]");
    }
}

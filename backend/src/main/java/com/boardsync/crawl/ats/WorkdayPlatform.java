package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;

@Component
public class WorkdayPlatform extends AbstractAtsPlatform {
    @Override
    public AtsType type() {
        return AtsType.WORKDAY;
    }

    @Override
    protected boolean isJobLink(URI link, URI listing) {
        // Workday boards link sideways to other tenants' marketing pages; only postings count.
        String path = link.getPath() == null ? "" : link.getPath();
        return path.contains("/job/") && super.isJobLink(link, listing);
    }

    @Override
    protected List<String> titleSelectors() {
        return List.of("[data-automation-id=jobPostingHeader]", "h2[data-automation-id]", "h1");
    }

    @Override
    protected List<String> locationSelectors() {
        return List.of("[data-automation-id=locations] dd", "[data-automation-id=locations]");
    }

    @Override
    protected List<String> employmentTypeSelectors() {
        return List.of("[data-automation-id=time] dd", "[data-automation-id=time]");
    }

    @Override
    protected List<String> descriptionSelectors() {
        return List.of("[data-automation-id=jobPostingDescription]", "main");
    }
}

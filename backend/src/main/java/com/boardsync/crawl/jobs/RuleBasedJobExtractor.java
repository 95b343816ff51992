package com.boardsync.crawl.jobs;

import com.boardsync.crawl.ats.AtsPlatform;
import com.boardsync.crawl.model.JobFields;
import com.boardsync.crawl.util.HtmlText;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Fallback extraction used when AI extraction is unavailable or returns nothing usable. Layers, highest priority
 * first: JSON-LD, platform selectors, section parsing of the description text.
 */
@Component
public class RuleBasedJobExtractor {
    private final JobPostingExtractor jsonLdExtractor;
    private final JobSectionParser sectionParser;

    public RuleBasedJobExtractor(JobPostingExtractor jsonLdExtractor, JobSectionParser sectionParser) {
        this.jsonLdExtractor = jsonLdExtractor;
        this.sectionParser = sectionParser;
    }

    public JobFields extract(Document page, String url, AtsPlatform platform) {
        JobFields jsonLd = jsonLdExtractor.extract(page).orElse(JobFields.empty());
        JobFields selectors = platform.extractFallbackFields(page, url);
        JobFields base = jsonLd.orElse(selectors);

        String description = base.aboutJob();
        if (description == null || description.isBlank()) {
            description = HtmlText.fromElement(page.body());
        }
        JobFields sections = sectionParser.parse(description);
        String aboutJob = sections.aboutJob() == null || sections.aboutJob().isBlank() ? description : sections.aboutJob();
        String workEnvironment = base.workEnvironment() != null
            ? base.workEnvironment()
            : sectionParser.detectWorkEnvironment(base.location() + "\n" + description);

        return new JobFields(
            base.title(),
            base.company(),
            base.aboutCompany(),
            base.location(),
            base.alternateLocations(),
            base.employmentType(),
            aboutJob,
            base.qualifications(),
            base.benefits(),
            base.salary(),
            workEnvironment,
            base.postedDate()
        ).orElse(sections);
    }
}

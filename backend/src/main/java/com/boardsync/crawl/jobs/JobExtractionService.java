package com.boardsync.crawl.jobs;

import com.boardsync.crawl.ats.AtsPlatform;
import com.boardsync.crawl.ats.AtsPlatformRegistry;
import com.boardsync.crawl.ats.CompanyNameResolver;
import com.boardsync.crawl.model.AiParseResult;
import com.boardsync.crawl.model.ExtractionOutcome;
import com.boardsync.crawl.model.JobFields;
import com.boardsync.crawl.model.JobRecord;
import com.boardsync.crawl.model.RenderedPage;
import com.boardsync.crawl.model.SalaryRange;
import com.boardsync.crawl.render.PageLoader;
import com.boardsync.crawl.render.RenderException;
import com.boardsync.crawl.util.HtmlText;
import com.boardsync.crawl.util.JobUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Turns one job-posting URL into a candidate record: render, AI extraction with rule-based fallback, text cleanup
 * and the geography and employment-type filters. Has no side effects besides the metrics it is handed.
 */
@Service
public class JobExtractionService {
    private static final Logger log = LoggerFactory.getLogger(JobExtractionService.class);

    private final PageLoader pageLoader;
    private final AtsPlatformRegistry platformRegistry;
    private final AiJobParser aiJobParser;
    private final RuleBasedJobExtractor ruleBasedExtractor;
    private final JobTextCleaner textCleaner;
    private final CompanyNameResolver companyNameResolver;
    private final UsLocationFilter usLocationFilter;
    private final EmploymentTypeFilter employmentTypeFilter;
    private final SalaryParser salaryParser;
    private final JobSectionParser sectionParser;

    public JobExtractionService(
        PageLoader pageLoader,
        AtsPlatformRegistry platformRegistry,
        AiJobParser aiJobParser,
        RuleBasedJobExtractor ruleBasedExtractor,
        JobTextCleaner textCleaner,
        CompanyNameResolver companyNameResolver,
        UsLocationFilter usLocationFilter,
        EmploymentTypeFilter employmentTypeFilter,
        SalaryParser salaryParser,
        JobSectionParser sectionParser
    ) {
        this.pageLoader = pageLoader;
        this.platformRegistry = platformRegistry;
        this.aiJobParser = aiJobParser;
        this.ruleBasedExtractor = ruleBasedExtractor;
        this.textCleaner = textCleaner;
        this.companyNameResolver = companyNameResolver;
        this.usLocationFilter = usLocationFilter;
        this.employmentTypeFilter = employmentTypeFilter;
        this.salaryParser = salaryParser;
        this.sectionParser = sectionParser;
    }

    public ExtractionOutcome extract(String url, String employerName, ExtractionMetrics metrics) {
        long started = System.nanoTime();
        try {
            return doExtract(url, employerName, metrics);
        } finally {
            metrics.addExtractionMillis((System.nanoTime() - started) / 1_000_000L);
        }
    }

    private ExtractionOutcome doExtract(String url, String employerName, ExtractionMetrics metrics) {
        String normalizedUrl = JobUrlUtils.normalize(url);
        if (normalizedUrl == null) {
            return ExtractionOutcome.failed("invalid_url");
        }

        RenderedPage page;
        try {
            page = pageLoader.load(url);
        } catch (RenderException e) {
            metrics.renderFailed();
            log.warn("Render failed for {}: {}", e.getUrl(), e.getMessage());
            return ExtractionOutcome.failed("render_failed");
        }
        metrics.pageRendered();

        Document document = Jsoup.parse(page.html(), page.finalUrl() == null ? url : page.finalUrl());
        AtsPlatform platform = platformRegistry.forPage(url, page.html());

        JobFields fields = extractWithAi(document, url, platform, metrics)
            .orElseGet(() -> {
                metrics.fallbackUsed();
                return ruleBasedExtractor.extract(document, url, platform);
            });
        fields = fields.map(textCleaner::clean);
        if (!fields.hasTitle()) {
            return ExtractionOutcome.failed("missing_title");
        }

        if (fields.company() == null) {
            fields = fields.withCompany(companyNameResolver.fromUrl(url).orElse(employerName));
        }

        if (!usLocationFilter.isUsLocation(fields.location(), fields.alternateLocations())) {
            metrics.geographyRejected();
            log.debug("Rejected {}: location '{}' not confirmed as US", url, fields.location());
            return ExtractionOutcome.rejected("non_us_location");
        }
        Optional<String> employmentRejection = employmentTypeFilter.rejectionReason(fields);
        if (employmentRejection.isPresent()) {
            metrics.employmentTypeRejected();
            log.debug("Rejected {}: {}", url, employmentRejection.get());
            return ExtractionOutcome.rejected(employmentRejection.get());
        }

        JobFields normalized = normalize(fields.withEmploymentType(EmploymentTypeFilter.CANONICAL_FULL_TIME));
        return ExtractionOutcome.extracted(
            JobRecord.candidate(employerName, normalizedUrl, normalized, Instant.now(), platform.type())
        );
    }

    private Optional<JobFields> extractWithAi(Document document, String url, AtsPlatform platform, ExtractionMetrics metrics) {
        if (!aiJobParser.isEnabled()) {
            return Optional.empty();
        }
        metrics.aiCalled();
        try {
            AiParseResult result = aiJobParser.parse(HtmlText.fromElement(document.body()), url, platform.type());
            metrics.aiSucceeded(result.totalTokens());
            return Optional.of(result.fields());
        } catch (AiExtractionException e) {
            metrics.aiFailed();
            log.info("AI extraction failed for {} ({}), using rule-based extraction", url, e.getMessage());
            return Optional.empty();
        }
    }

    private JobFields normalize(JobFields fields) {
        String salary = fields.salary() == null
            ? null
            : salaryParser.parse(fields.salary()).map(SalaryRange::display).orElse(fields.salary());
        String workEnvironment = fields.workEnvironment();
        if (workEnvironment == null) {
            workEnvironment = sectionParser.detectWorkEnvironment(fields.location() + "\n" + fields.aboutJob());
        }
        return new JobFields(
            fields.title(),
            fields.company(),
            fields.aboutCompany(),
            fields.location(),
            fields.alternateLocations(),
            fields.employmentType(),
            fields.aboutJob(),
            fields.qualifications(),
            fields.benefits(),
            salary,
            workEnvironment,
            fields.postedDate()
        );
    }
}

package com.boardsync.crawl.service;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.model.CrawlRunOptions;
import com.boardsync.crawl.model.CrawlRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CrawlRunSummary summary = crawlOrchestratorService.run(CrawlRunOptions.defaults());
        log.info(
            "Crawl run {} finished with status {} in phase {}",
            summary.crawlRunId(),
            summary.status(),
            summary.finalPhase()
        );

        if (properties.getCli().isExitAfterRun()) {
            int code = "FAILED".equals(summary.status()) ? 1 : 0;
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }
}

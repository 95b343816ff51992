package com.boardsync.crawl.api;

import com.boardsync.crawl.model.CrawlProgressView;
import com.boardsync.crawl.model.CrawlRunOptions;
import com.boardsync.crawl.model.CrawlRunSummary;
import com.boardsync.crawl.model.MaintenanceCleanupResponse;
import com.boardsync.crawl.model.StatusResponse;
import com.boardsync.crawl.service.CrawlOrchestratorService;
import com.boardsync.crawl.service.CrawlStatusService;
import com.boardsync.crawl.service.JobMaintenanceService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final CrawlStatusService crawlStatusService;
    private final JobMaintenanceService jobMaintenanceService;

    public CrawlController(
        CrawlOrchestratorService crawlOrchestratorService,
        CrawlStatusService crawlStatusService,
        JobMaintenanceService jobMaintenanceService
    ) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.crawlStatusService = crawlStatusService;
        this.jobMaintenanceService = jobMaintenanceService;
    }

    @PostMapping("/crawl/run")
    public CrawlRunSummary runCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        return crawlOrchestratorService.run(toOptions(request));
    }

    @PostMapping("/crawl/start")
    public CrawlProgressView startCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        crawlOrchestratorService.startAsync(toOptions(request));
        return crawlOrchestratorService.progress();
    }

    @PostMapping("/crawl/stop")
    public CrawlProgressView stopCrawl() {
        crawlOrchestratorService.stop("stop_requested");
        return crawlOrchestratorService.progress();
    }

    @GetMapping("/crawl/progress")
    public CrawlProgressView progress() {
        return crawlOrchestratorService.progress();
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return crawlStatusService.getStatus();
    }

    @PostMapping("/maintenance/cleanup")
    public MaintenanceCleanupResponse cleanup(
        @RequestParam(name = "dryRun", required = false, defaultValue = "true") boolean dryRun,
        @RequestParam(name = "batchSize", required = false) Integer batchSize
    ) {
        return jobMaintenanceService.cleanup(batchSize, dryRun);
    }

    private CrawlRunOptions toOptions(CrawlApiRunRequest request) {
        if (request == null) {
            return CrawlRunOptions.defaults();
        }
        Integer batchSize = request.employerBatchSize() == null ? null : Math.max(1, request.employerBatchSize());
        return new CrawlRunOptions(batchSize, request.resume());
    }
}

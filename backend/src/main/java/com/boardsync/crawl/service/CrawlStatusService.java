package com.boardsync.crawl.service;

import com.boardsync.crawl.model.CrawlRunMeta;
import com.boardsync.crawl.model.StatusResponse;
import com.boardsync.crawl.persistence.CrawlRunRepository;
import com.boardsync.crawl.persistence.JobRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class CrawlStatusService {
    private static final Logger log = LoggerFactory.getLogger(CrawlStatusService.class);

    private final JobRecordRepository jobRecordRepository;
    private final CrawlRunRepository crawlRunRepository;
    private final PipelineApiClient pipelineApiClient;

    public CrawlStatusService(
        JobRecordRepository jobRecordRepository,
        CrawlRunRepository crawlRunRepository,
        PipelineApiClient pipelineApiClient
    ) {
        this.jobRecordRepository = jobRecordRepository;
        this.crawlRunRepository = crawlRunRepository;
        this.pipelineApiClient = pipelineApiClient;
    }

    public StatusResponse getStatus() {
        Boolean downstreamHealthy = pipelineApiClient.isConfigured() ? pipelineApiClient.isHealthy() : null;
        boolean dbConnected;
        try {
            dbConnected = jobRecordRepository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Database unreachable: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, new LinkedHashMap<>(), null, downstreamHealthy);
        }

        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("job_records", jobRecordRepository.countAll());
        counts.put("employers_with_records", jobRecordRepository.countEmployers());
        counts.putAll(crawlRunRepository.tableCounts());
        counts.put("running_crawl_runs", (long) crawlRunRepository.findRunningCrawlRuns().size());
        CrawlRunMeta latest = crawlRunRepository.findMostRecentCrawlRun();
        return new StatusResponse(true, counts, latest, downstreamHealthy);
    }
}

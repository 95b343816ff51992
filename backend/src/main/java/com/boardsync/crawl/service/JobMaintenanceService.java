package com.boardsync.crawl.service;

import com.boardsync.crawl.jobs.EmploymentTypeFilter;
import com.boardsync.crawl.jobs.UsLocationFilter;
import com.boardsync.crawl.model.JobFields;
import com.boardsync.crawl.model.JobRecord;
import com.boardsync.crawl.model.MaintenanceCleanupResponse;
import com.boardsync.crawl.persistence.JobRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit maintenance: removes stored records that the current geography and employment-type filters would
 * reject. The only code path that deletes job records.
 */
@Service
public class JobMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(JobMaintenanceService.class);
    private static final int DEFAULT_BATCH_SIZE = 200;
    private static final int DELETE_BATCH_SIZE = 50;

    private final JobRecordRepository jobRecordRepository;
    private final UsLocationFilter usLocationFilter;
    private final EmploymentTypeFilter employmentTypeFilter;

    public JobMaintenanceService(
        JobRecordRepository jobRecordRepository,
        UsLocationFilter usLocationFilter,
        EmploymentTypeFilter employmentTypeFilter
    ) {
        this.jobRecordRepository = jobRecordRepository;
        this.usLocationFilter = usLocationFilter;
        this.employmentTypeFilter = employmentTypeFilter;
    }

    public MaintenanceCleanupResponse cleanup(Integer batchSize, boolean dryRun) {
        int safeBatchSize = batchSize == null || batchSize <= 0 ? DEFAULT_BATCH_SIZE : batchSize;
        int scanned = 0;
        int rejected = 0;
        int deleted = 0;
        long lastId = 0L;
        Map<String, Integer> reasons = new LinkedHashMap<>();

        while (true) {
            List<JobRecord> batch = jobRecordRepository.findBatchAfterId(lastId, safeBatchSize);
            if (batch.isEmpty()) {
                break;
            }
            List<Long> toDelete = new ArrayList<>();
            for (JobRecord record : batch) {
                lastId = record.id();
                scanned++;
                Optional<String> reason = rejectionReason(record);
                if (reason.isEmpty()) {
                    continue;
                }
                rejected++;
                reasons.put(reason.get(), reasons.getOrDefault(reason.get(), 0) + 1);
                log.debug("Maintenance rejects {} ({})", record.sourceUrl(), reason.get());
                if (!dryRun) {
                    toDelete.add(record.id());
                }
            }
            if (!toDelete.isEmpty()) {
                deleted += deleteInBatches(toDelete);
            }
            log.info(
                "Maintenance cleanup progress: scanned={}, rejected={}, deleted={}, dryRun={}, lastId={}",
                scanned,
                rejected,
                deleted,
                dryRun,
                lastId
            );
        }
        return new MaintenanceCleanupResponse(scanned, rejected, deleted, dryRun, lastId, reasons);
    }

    Optional<String> rejectionReason(JobRecord record) {
        if (!usLocationFilter.isUsLocation(record.location(), record.alternateLocations())) {
            return Optional.of("non_us_location");
        }
        return employmentTypeFilter.rejectionReason(new JobFields(
            record.title(),
            record.company(),
            record.aboutCompany(),
            record.location(),
            record.alternateLocations(),
            record.employmentType(),
            record.aboutJob(),
            record.qualifications(),
            record.benefits(),
            record.salary(),
            record.workEnvironment(),
            record.postedDate()
        ));
    }

    private int deleteInBatches(List<Long> ids) {
        int removed = 0;
        for (int i = 0; i < ids.size(); i += DELETE_BATCH_SIZE) {
            int end = Math.min(ids.size(), i + DELETE_BATCH_SIZE);
            removed += jobRecordRepository.deleteByIds(ids.subList(i, end));
        }
        return removed;
    }
}

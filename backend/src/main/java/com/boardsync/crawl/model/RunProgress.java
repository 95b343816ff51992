package com.boardsync.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Resume state persisted between invocations. {@code lastCompletedIndex} is -1 before the first employer of a
 * cycle has been processed.
 */
public record RunProgress(
    List<String> employers,
    int lastCompletedIndex,
    int batchSize,
    int cycle,
    Instant createdAt,
    Instant updatedAt
) {
    public RunProgress {
        employers = employers == null ? List.of() : List.copyOf(employers);
    }

    public static RunProgress start(List<String> employers, int batchSize, Instant now) {
        return new RunProgress(employers, -1, batchSize, 1, now, now);
    }

    public int nextIndex() {
        return lastCompletedIndex + 1;
    }

    @JsonIgnore
    public boolean isCycleComplete() {
        return nextIndex() >= employers.size();
    }

    public RunProgress withCompleted(int index, Instant now) {
        return new RunProgress(employers, index, batchSize, cycle, createdAt, now);
    }

    public RunProgress nextCycle(Instant now) {
        return new RunProgress(employers, -1, batchSize, cycle + 1, createdAt, now);
    }

    public RunProgress withBatchSize(int value, Instant now) {
        return new RunProgress(employers, lastCompletedIndex, value, cycle, createdAt, now);
    }

    public RunProgress touch(Instant now) {
        return new RunProgress(employers, lastCompletedIndex, batchSize, cycle, createdAt, now);
    }
}

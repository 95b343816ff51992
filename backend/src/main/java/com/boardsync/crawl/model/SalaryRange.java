package com.boardsync.crawl.model;

public record SalaryRange(String display, Long min, Long max, SalaryPeriod period) {
    public boolean isHourly() {
        return period == SalaryPeriod.HOURLY;
    }
}

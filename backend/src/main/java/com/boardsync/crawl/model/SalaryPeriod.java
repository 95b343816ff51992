package com.boardsync.crawl.model;

public enum SalaryPeriod {
    YEARLY,
    MONTHLY,
    HOURLY,
    UNKNOWN
}

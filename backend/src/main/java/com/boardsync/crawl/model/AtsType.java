package com.boardsync.crawl.model;

public enum AtsType {
    GREENHOUSE,
    LEVER,
    ASHBY,
    WORKDAY,
    SMARTRECRUITERS,
    WORKABLE,
    GENERIC
}

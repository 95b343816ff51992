package com.boardsync.crawl.model;

import java.util.List;

public record EmployerTarget(String name, List<String> listingUrls) {
    public EmployerTarget {
        listingUrls = listingUrls == null ? List.of() : List.copyOf(listingUrls);
    }
}

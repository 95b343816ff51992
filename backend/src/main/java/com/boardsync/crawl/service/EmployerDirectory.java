package com.boardsync.crawl.service;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.model.EmployerTarget;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The fixed employer set: {@code crawler.employers} followed by the rows of the optional employers CSV, merged by
 * case-insensitive name in first-seen order.
 */
@Service
public class EmployerDirectory {
    private static final Logger log = LoggerFactory.getLogger(EmployerDirectory.class);

    private final CrawlerProperties properties;

    public EmployerDirectory(CrawlerProperties properties) {
        this.properties = properties;
    }

    public List<EmployerTarget> employers() {
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, Set<String>> urls = new LinkedHashMap<>();
        for (CrawlerProperties.Employer employer : properties.getEmployers()) {
            if (employer.getListingUrls() == null) {
                continue;
            }
            for (String url : employer.getListingUrls()) {
                add(names, urls, employer.getName(), url);
            }
        }
        String csvPath = properties.getData().getEmployersCsv();
        if (csvPath != null && !csvPath.isBlank()) {
            readCsv(resolvePath(csvPath), names, urls);
        }

        List<EmployerTarget> targets = new ArrayList<>();
        for (Map.Entry<String, String> entry : names.entrySet()) {
            Set<String> listingUrls = urls.get(entry.getKey());
            if (listingUrls.isEmpty()) {
                log.warn("Employer {} has no listing URLs, ignoring", entry.getValue());
                continue;
            }
            targets.add(new EmployerTarget(entry.getValue(), new ArrayList<>(listingUrls)));
        }
        return targets;
    }

    private void readCsv(Path path, Map<String, String> names, Map<String, Set<String>> urls) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String name = getColumn(record, "name", "employer", "company");
                String url = getColumn(record, "listing_url", "url", "careers_url");
                if (name == null || url == null) {
                    log.warn("Employers CSV row {} missing name or listing_url, skipping", record.getRecordNumber());
                    continue;
                }
                add(names, urls, name, url);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read employers CSV at " + path, e);
        }
    }

    private void add(Map<String, String> names, Map<String, Set<String>> urls, String rawName, String rawUrl) {
        if (rawName == null || rawName.isBlank()) {
            return;
        }
        String name = rawName.trim();
        String key = name.toLowerCase(Locale.ROOT);
        names.putIfAbsent(key, name);
        Set<String> listingUrls = urls.computeIfAbsent(key, ignored -> new LinkedHashSet<>());
        if (rawUrl != null && !rawUrl.isBlank()) {
            listingUrls.add(rawUrl.trim());
        }
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... columns) {
        for (String column : columns) {
            for (String header : record.toMap().keySet()) {
                if (header != null && header.trim().equalsIgnoreCase(column)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}

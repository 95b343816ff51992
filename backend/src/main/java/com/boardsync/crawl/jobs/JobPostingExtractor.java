package com.boardsync.crawl.jobs;

import com.boardsync.crawl.model.JobFields;
import com.boardsync.crawl.util.HtmlText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reads schema.org JobPosting blocks embedded as JSON-LD.
 */
@Component
public class JobPostingExtractor {
    private final ObjectMapper objectMapper;

    public JobPostingExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JobFields> extract(Document document) {
        if (document == null) {
            return Optional.empty();
        }
        List<JsonNode> jobPostingNodes = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(payload);
                collectJobPostingNodes(root, jobPostingNodes);
            } catch (JsonProcessingException ignored) {
                // Ignore malformed JSON-LD blobs and continue extracting from others.
            }
        }
        if (jobPostingNodes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toFields(jobPostingNodes.get(0)));
    }

    private void collectJobPostingNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isJobPostingType(node.get("@type"))) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectJobPostingNodes(value, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectJobPostingNodes(child, out);
            }
        }
    }

    private boolean isJobPostingType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "jobposting".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "jobposting".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private JobFields toFields(JsonNode node) {
        List<String> locations = extractLocations(node.get("jobLocation"));
        String primary = locations.isEmpty() ? null : locations.get(0);
        String alternates = locations.size() > 1 ? String.join("; ", locations.subList(1, locations.size())) : null;
        String description = text(node, "description");
        String workEnvironment = "TELECOMMUTE".equalsIgnoreCase(text(node, "jobLocationType")) ? "Remote" : null;
        if (primary == null && workEnvironment != null) {
            primary = applicantLocation(node.get("applicantLocationRequirements"));
        }
        return new JobFields(
            firstNonBlank(text(node, "title"), text(node, "name")),
            text(node.path("hiringOrganization"), "name"),
            text(node.path("hiringOrganization"), "description"),
            primary,
            alternates,
            extractEmploymentType(node.get("employmentType")),
            description == null ? null : HtmlText.fromHtml(description),
            htmlOrNull(text(node, "qualifications")),
            htmlOrNull(text(node, "jobBenefits")),
            extractSalary(node.get("baseSalary")),
            workEnvironment,
            datePart(text(node, "datePosted"))
        );
    }

    private List<String> extractLocations(JsonNode jobLocation) {
        if (jobLocation == null || jobLocation.isNull()) {
            return List.of();
        }
        LinkedHashSet<String> locations = new LinkedHashSet<>();
        collectLocationStrings(jobLocation, locations);
        return new ArrayList<>(locations);
    }

    private void collectLocationStrings(JsonNode node, LinkedHashSet<String> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectLocationStrings(item, out);
            }
            return;
        }
        if (!node.isObject()) {
            if (node.isTextual()) {
                String val = node.asText().trim();
                if (!val.isEmpty()) {
                    out.add(val);
                }
            }
            return;
        }

        JsonNode address = node.has("address") ? node.get("address") : node;
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, text(address, "addressLocality"));
        addIfPresent(parts, text(address, "addressRegion"));
        JsonNode country = address.get("addressCountry");
        addIfPresent(parts, country != null && country.isObject() ? text(country, "name") : text(address, "addressCountry"));

        if (!parts.isEmpty()) {
            out.add(String.join(", ", parts));
            return;
        }
        String fallback = firstNonBlank(text(node, "name"), text(address, "name"));
        if (fallback != null) {
            out.add(fallback);
        }
    }

    private String applicantLocation(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode first = node.isArray() && node.size() > 0 ? node.get(0) : node;
        return text(first, "name");
    }

    private String extractEmploymentType(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return humanize(node.asText());
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode item : node) {
                if (item.isTextual()) {
                    values.add(humanize(item.asText()));
                }
            }
            if (!values.isEmpty()) {
                return values.stream().distinct().collect(Collectors.joining(", "));
            }
        }
        return null;
    }

    private String extractSalary(JsonNode baseSalary) {
        if (baseSalary == null || baseSalary.isNull() || !baseSalary.isObject()) {
            return null;
        }
        JsonNode value = baseSalary.path("value");
        String unit = firstNonBlank(text(value, "unitText"), text(baseSalary, "unitText"));
        Double min = number(value.get("minValue"));
        Double max = number(value.get("maxValue"));
        Double single = number(value.get("value"));
        if (min == null && single == null && value.isNumber()) {
            single = value.asDouble();
        }
        String amount;
        if (min != null && max != null) {
            amount = money(min) + " - " + money(max);
        } else if (min != null || single != null) {
            amount = money(min != null ? min : single);
        } else {
            return null;
        }
        if (unit == null) {
            return amount;
        }
        return amount + " per " + unit.toLowerCase(Locale.ROOT);
    }

    private Double number(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().replace(",", ""));
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private String money(double value) {
        return "$" + NumberFormat.getIntegerInstance(Locale.US).format(Math.round(value));
    }

    private String humanize(String raw) {
        String value = raw.trim();
        if (value.equalsIgnoreCase("FULL_TIME")) {
            return "Full time";
        }
        return value.replace('_', ' ');
    }

    private String datePart(String rawDate) {
        if (rawDate == null || rawDate.isBlank()) {
            return null;
        }
        String candidate = rawDate.trim();
        return candidate.length() >= 10 ? candidate.substring(0, 10) : candidate;
    }

    private String htmlOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return HtmlText.fromHtml(value);
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private void addIfPresent(List<String> list, String value) {
        if (value != null && !value.isBlank()) {
            list.add(value.trim());
        }
    }
}

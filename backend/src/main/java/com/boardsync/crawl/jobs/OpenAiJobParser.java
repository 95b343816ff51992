package com.boardsync.crawl.jobs;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.http.PoliteHttpClient;
import com.boardsync.crawl.model.AiParseResult;
import com.boardsync.crawl.model.AtsType;
import com.boardsync.crawl.model.HttpFetchResult;
import com.boardsync.crawl.model.JobFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client that asks the model for the job fields as a flat JSON object.
 */
@Component
public class OpenAiJobParser implements AiJobParser {
    private static final String SYSTEM_PROMPT = """
        You extract job posting data from raw web page text and answer with one JSON object only.
        Copy text verbatim from the page. Do not summarize, paraphrase or invent values.
        Strip decorative symbols and emoji from the copied text but keep bullet structure using "- ".
        Some pages mark sections with emoji or symbols. Map them explicitly:
        a section about the role, the day to day or responsibilities goes to about_job,
        a section about requirements, skills or experience goes to qualifications,
        a section about perks, compensation extras or benefits goes to benefits,
        a section about the company or its mission goes to about_company.
        Keys: title, company, location, alternate_locations, employment_type, about_job, qualifications,
        benefits, salary_range, work_environment, about_company, posted_date.
        Use null for anything the page does not state. work_environment is one of Remote, Hybrid, Onsite.
        """;

    private final CrawlerProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiJobParser(CrawlerProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isEnabled() {
        return properties.getAi().isConfigured();
    }

    @Override
    public AiParseResult parse(String content, String url, AtsType platformHint) {
        if (!isEnabled()) {
            throw new AiExtractionException("ai_disabled");
        }
        if (content == null || content.isBlank()) {
            throw new AiExtractionException("empty_content");
        }
        CrawlerProperties.Ai ai = properties.getAi();
        String requestBody = buildRequest(truncate(content, properties.getExtraction().getMaxContentChars()), url, platformHint);
        HttpFetchResult response = httpClient.postJson(
            ai.getEndpoint(),
            requestBody,
            Map.of("Authorization", "Bearer " + ai.getApiKey()),
            Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
            1
        );
        if (response == null || !response.isSuccessful() || response.body() == null) {
            String detail = response == null ? "no_response"
                : response.errorCode() != null ? response.errorCode() : "http_" + response.statusCode();
            throw new AiExtractionException("ai_request_failed:" + detail);
        }
        return readResponse(response.body());
    }

    AiParseResult readResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AiExtractionException("ai_response_not_json", e);
        }
        long tokens = root.path("usage").path("total_tokens").asLong(0L);
        String message = root.path("choices").path(0).path("message").path("content").asText(null);
        if (message == null || message.isBlank()) {
            throw new AiExtractionException("ai_empty_message");
        }
        JsonNode fields;
        try {
            fields = objectMapper.readTree(stripFences(message));
        } catch (JsonProcessingException e) {
            throw new AiExtractionException("ai_message_not_json", e);
        }
        if (fields == null || !fields.isObject()) {
            throw new AiExtractionException("ai_message_not_object");
        }
        JobFields parsed = new JobFields(
            text(fields, "title"),
            text(fields, "company"),
            text(fields, "about_company"),
            text(fields, "location"),
            text(fields, "alternate_locations"),
            text(fields, "employment_type"),
            text(fields, "about_job"),
            text(fields, "qualifications"),
            text(fields, "benefits"),
            text(fields, "salary_range"),
            text(fields, "work_environment"),
            text(fields, "posted_date")
        );
        if (!parsed.hasTitle()) {
            throw new AiExtractionException("ai_missing_title");
        }
        return new AiParseResult(parsed, tokens);
    }

    private String buildRequest(String content, String url, AtsType platformHint) {
        CrawlerProperties.Ai ai = properties.getAi();
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", ai.getModel());
        request.put("temperature", ai.getTemperature());
        request.put("max_tokens", ai.getMaxTokens());
        ArrayNode messages = request.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        String platform = platformHint == null ? AtsType.GENERIC.name() : platformHint.name();
        messages.addObject()
            .put("role", "user")
            .put("content", "Platform: " + platform + "\nURL: " + url + "\n\nPage text:\n" + content);
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new AiExtractionException("ai_request_not_serializable", e);
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode item : value) {
                if (!item.isNull() && !item.asText().isBlank()) {
                    parts.add(item.asText().trim());
                }
            }
            return parts.isEmpty() ? null : String.join("; ", parts);
        }
        if (value.isContainerNode()) {
            return null;
        }
        String text = value.asText().trim();
        if (text.isEmpty() || text.equalsIgnoreCase("null")) {
            return null;
        }
        return text;
    }

    static String stripFences(String message) {
        String trimmed = message.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed.replace("```", "").trim();
        }
        return trimmed.substring(firstNewline + 1, closing).trim();
    }

    static String truncate(String content, int maxChars) {
        if (content.length() <= maxChars) {
            return content;
        }
        return content.substring(0, maxChars);
    }
}

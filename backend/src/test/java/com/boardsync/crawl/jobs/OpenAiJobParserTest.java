package com.boardsync.crawl.jobs;

import com.boardsync.config.CrawlConfig;
import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.http.PoliteHttpClient;
import com.boardsync.crawl.model.AiParseResult;
import com.boardsync.crawl.model.AtsType;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class OpenAiJobParserTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void readsFencedJsonMessageAndTokenUsage() {
        OpenAiJobParser parser = parser(new CrawlerProperties());
        String body = """
            {"choices":[{"message":{"role":"assistant","content":"```json\\n{\\"title\\":\\"Staff Engineer\\",\\"location\\":\\"Denver, CO\\",\\"alternate_locations\\":[\\"Austin, TX\\",\\"Remote - US\\"],\\"salary_range\\":null}\\n```"}}],
             "usage":{"total_tokens":812}}
            """;

        AiParseResult result = parser.readResponse(body);

        assertEquals(812L, result.totalTokens());
        assertEquals("Staff Engineer", result.fields().title());
        assertEquals("Denver, CO", result.fields().location());
        assertEquals("Austin, TX; Remote - US", result.fields().alternateLocations());
        assertNull(result.fields().salary());
    }

    @Test
    void messageWithoutTitleIsAFailure() {
        OpenAiJobParser parser = parser(new CrawlerProperties());
        String body = """
            {"choices":[{"message":{"content":"{\\"location\\":\\"Denver, CO\\"}"}}]}
            """;

        assertThatThrownBy(() -> parser.readResponse(body))
            .isInstanceOf(AiExtractionException.class)
            .hasMessageContaining("ai_missing_title");
    }

    @Test
    void postsTruncatedContentWithBearerToken() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"{\\\"title\\\":\\\"Engineer\\\"}\"}}],\"usage\":{\"total_tokens\":10}}"));
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.getAi().setEnabled(true);
        properties.getAi().setApiKey("sk-test");
        properties.getAi().setEndpoint(server.url("/v1/chat/completions").toString());
        properties.getExtraction().setMaxContentChars(500);
        OpenAiJobParser parser = parser(properties);

        AiParseResult result = parser.parse("a".repeat(2000), "https://jobs.lever.co/acme/1", AtsType.LEVER);

        assertEquals("Engineer", result.fields().title());
        RecordedRequest request = server.takeRequest();
        assertEquals("Bearer sk-test", request.getHeader("Authorization"));
        String sent = request.getBody().readUtf8();
        assertThat(sent).contains("Platform: LEVER").contains("a".repeat(500)).doesNotContain("a".repeat(501));
    }

    @Test
    void disabledParserRefusesToCall() {
        OpenAiJobParser parser = parser(new CrawlerProperties());

        assertThatThrownBy(() -> parser.parse("content", "https://acme.com/jobs/1", AtsType.GENERIC))
            .isInstanceOf(AiExtractionException.class)
            .hasMessageContaining("ai_disabled");
    }

    private OpenAiJobParser parser(CrawlerProperties properties) {
        if (executor == null) {
            executor = Executors.newFixedThreadPool(1);
        }
        return new OpenAiJobParser(properties, new PoliteHttpClient(properties, executor), new CrawlConfig().objectMapper());
    }
}

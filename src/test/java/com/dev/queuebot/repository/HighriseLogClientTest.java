package com.dev.queuebot.repository;

import com.dev.queuebot.domain.GameLogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HighriseLogClientTest {

    private static final String LOGS_URL = "http://storage.test/api/management/logs?limit=50";

    private MockRestServiceServer server;
    private HighriseLogClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://storage.test/api").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HighriseLogClient(restTemplate);
    }

    @Test
    void readsEntriesInServerOrder() {
        server.expect(requestTo(LOGS_URL)).andRespond(withSuccess("""
                {"values":[
                  {"id":"0002","message":"!play abc | u1 | 42"},
                  {"timestamp":"2026-01-01T00:00:00Z","message":"hello"},
                  {"created_at":"2025-12-31"}
                ]}
                """, MediaType.APPLICATION_JSON));

        List<GameLogEntry> entries = client.fetchRecent(50);

        assertThat(entries).containsExactly(
                new GameLogEntry("0002", "!play abc | u1 | 42"),
                new GameLogEntry("2026-01-01T00:00:00Z", "hello"),
                new GameLogEntry("2025-12-31", ""));
    }

    @Test
    void rateLimitGivesNoEntries() {
        server.expect(requestTo(LOGS_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThat(client.fetchRecent(50)).isEmpty();
    }

    @Test
    void missingValuesGiveNoEntries() {
        server.expect(requestTo(LOGS_URL)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchRecent(50)).isEmpty();
    }
}

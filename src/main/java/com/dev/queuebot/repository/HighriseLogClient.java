package com.dev.queuebot.repository;

import com.dev.queuebot.domain.GameLogEntry;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class HighriseLogClient {

    private final RestTemplate restTemplate;

    public HighriseLogClient(@Qualifier("storageRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public List<GameLogEntry> fetchRecent(int limit) {
        JsonNode body;
        try {
            body = restTemplate.getForObject("/management/logs?limit={limit}", JsonNode.class, limit);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                log.warn("Log fetch rate limited, skipping this cycle");
            } else {
                log.warn("Log fetch failed with status {}", e.getStatusCode().value());
            }
            return List.of();
        } catch (RestClientException e) {
            log.warn("Log fetch failed: {}", e.getMessage());
            return List.of();
        }
        if (body == null) {
            return List.of();
        }
        List<GameLogEntry> entries = new ArrayList<>();
        for (JsonNode node : body.path("values")) {
            String id = firstText(node, "id", "timestamp", "created_at");
            entries.add(new GameLogEntry(id, node.path("message").asText("")));
        }
        return entries;
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (!value.isMissingNode() && !value.isNull() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }
}

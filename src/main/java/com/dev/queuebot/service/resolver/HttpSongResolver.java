package com.dev.queuebot.service.resolver;

import com.dev.queuebot.config.QueueBotProperties;
import com.dev.queuebot.domain.InboxRequest;
import com.dev.queuebot.domain.SongMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

@Slf4j
@Component
@ConditionalOnProperty(name = "queuebot.resolver.type", havingValue = "http")
public class HttpSongResolver implements SongResolver {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final QueueBotProperties.Resolver properties;

    public HttpSongResolver(@Qualifier("resolverRestTemplate") RestTemplate restTemplate,
                            ObjectMapper objectMapper,
                            QueueBotProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties.resolver();
        if (this.properties.baseUrl() == null || this.properties.baseUrl().isBlank()) {
            throw new IllegalStateException("queuebot.resolver.base-url is required for the http resolver");
        }
    }

    @Override
    public SongMetadata resolve(InboxRequest request) {
        URI uri = UriComponentsBuilder.fromHttpUrl(properties.baseUrl())
                .queryParam("q", request.query())
                .queryParam("user", request.user())
                .queryParam("userid", request.userId())
                .encode()
                .build()
                .toUri();
        ResponseEntity<String> response;
        try {
            log.info("Forwarding '{}' from {} to the playback host", request.query(), request.user());
            response = restTemplate.getForEntity(uri, String.class);
        } catch (RestClientException e) {
            throw new SongResolutionException("Playback host rejected '" + request.query() + "'", e);
        }
        JsonNode body = parse(response.getBody());
        String title = request.query();
        int duration = properties.defaultDurationSeconds();
        if (body != null && body.isObject()) {
            if (body.hasNonNull("title") && !body.get("title").asText().isBlank()) {
                title = body.get("title").asText();
            }
            if (body.hasNonNull("duration") && body.get("duration").asInt() > 0) {
                duration = body.get("duration").asInt();
            }
        }
        return new SongMetadata(title, properties.streamUrl(), duration, request.user());
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Playback host answered without song details");
            return null;
        }
    }
}

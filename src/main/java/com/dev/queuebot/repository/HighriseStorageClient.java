package com.dev.queuebot.repository;

import com.dev.queuebot.domain.RemoteObject;
import com.dev.queuebot.domain.VersionToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

@Slf4j
@Component
public class HighriseStorageClient implements RemoteStorageClient {

    private static final String OBJECT_PATH = "/storage/object/{key}";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public HighriseStorageClient(@Qualifier("storageRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<RemoteObject> read(String key) {
        JsonNode body;
        try {
            body = restTemplate.getForObject(OBJECT_PATH, JsonNode.class, key);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new StorageAccessException("Reading " + key + " failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new StorageAccessException("Reading " + key + " failed: " + e.getMessage(), e);
        }
        if (body == null || body.isNull()) {
            return Optional.empty();
        }
        return Optional.of(new RemoteObject(key, valueOf(body), versionOf(body)));
    }

    @Override
    public RemoteObject write(String key, String value, VersionToken expectedVersion) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("value", value);
        payload.putArray("attributes");
        if (expectedVersion != null) {
            payload.set("version", toJson(expectedVersion));
        }
        JsonNode body;
        try {
            body = restTemplate.exchange(OBJECT_PATH, HttpMethod.PUT, new HttpEntity<>(payload), JsonNode.class, key)
                    .getBody();
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.CONFLICT.value() || status == HttpStatus.PRECONDITION_FAILED.value()) {
                throw new VersionConflictException(
                        "Version " + expectedVersion + " of " + key + " is no longer current");
            }
            log.warn("Updating {} failed with status {}: {}", key, status, e.getResponseBodyAsString());
            throw new StorageAccessException("Updating " + key + " failed with status " + status, e);
        } catch (ResourceAccessException e) {
            throw new StorageAccessException("Updating " + key + " timed out or could not connect", e);
        } catch (RestClientException e) {
            throw new StorageAccessException("Updating " + key + " failed: " + e.getMessage(), e);
        }
        VersionToken newVersion = body == null ? null : versionOf(body);
        if (newVersion == null) {
            log.warn("Storage accepted {} but returned no version", key);
        }
        return new RemoteObject(key, value, newVersion);
    }

    private String valueOf(JsonNode body) {
        JsonNode value = body.path("value");
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    private VersionToken versionOf(JsonNode body) {
        JsonNode version = body.path("version");
        if (version.isMissingNode() || version.isNull()) {
            version = body.path("metadata").path("version");
        }
        if (version.isMissingNode() || version.isNull()) {
            return null;
        }
        return VersionToken.of(version.toString());
    }

    private JsonNode toJson(VersionToken token) {
        try {
            return objectMapper.readTree(token.value());
        } catch (JsonProcessingException e) {
            return objectMapper.getNodeFactory().textNode(token.value());
        }
    }
}

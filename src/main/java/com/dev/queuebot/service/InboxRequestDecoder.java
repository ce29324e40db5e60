package com.dev.queuebot.service;

import com.dev.queuebot.domain.InboxRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
public class InboxRequestDecoder {

    private final ObjectMapper objectMapper;

    public InboxRequestDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<InboxRequest> decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Optional<JsonNode> parsed = parse(raw);
        if (parsed.isPresent() && parsed.get().isObject()) {
            return Optional.of(fromObject(parsed.get(), raw));
        }
        if (parsed.isPresent() && parsed.get().isTextual()) {
            String inner = parsed.get().asText();
            Optional<JsonNode> reparsed = parse(inner);
            if (reparsed.isPresent() && reparsed.get().isObject()) {
                return Optional.of(fromObject(reparsed.get(), inner));
            }
            if (!inner.isBlank()) {
                return Optional.of(InboxRequest.anonymous(inner));
            }
        }
        log.debug("Inbox value is not structured, using it as the query");
        return Optional.of(InboxRequest.anonymous(raw));
    }

    private Optional<JsonNode> parse(String text) {
        try {
            return Optional.ofNullable(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private InboxRequest fromObject(JsonNode node, String source) {
        String query = text(node, "query");
        if (query == null || query.isBlank()) {
            log.warn("Inbox object has no query, using the raw value instead");
            query = source;
        }
        String user = text(node, "user");
        if (user == null || user.isBlank()) {
            user = InboxRequest.UNKNOWN_USER;
        }
        String userId = text(node, "userId");
        if (userId == null) {
            userId = text(node, "userid");
        }
        return new InboxRequest(query, user, userId == null ? "" : userId);
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}

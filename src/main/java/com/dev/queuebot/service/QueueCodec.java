package com.dev.queuebot.service;

import com.dev.queuebot.domain.SongEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class QueueCodec {

    static final String QUEUE_FIELD = "q";

    private final ObjectMapper objectMapper;
    private final LuaLongStringEnvelope envelope;

    public QueueCodec(ObjectMapper objectMapper, LuaLongStringEnvelope envelope) {
        this.objectMapper = objectMapper;
        this.envelope = envelope;
    }

    public String encode(List<SongEntry> songs) {
        return envelope.wrap(serialize(songs));
    }

    public String serialize(List<SongEntry> songs) {
        ObjectNode document = objectMapper.createObjectNode();
        ArrayNode queue = document.putArray(QUEUE_FIELD);
        songs.forEach(song -> queue.add(objectMapper.valueToTree(song)));
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize queue", e);
        }
    }

    public DecodedQueue decode(String value) {
        if (value == null || value.isBlank()) {
            return new DecodedQueue(List.of(), false);
        }
        Optional<String> payload = envelope.strip(value);
        JsonNode root = parse(payload.orElse(value));
        if (root == null) {
            log.warn("Stored queue is not readable, starting from an empty queue");
            return new DecodedQueue(List.of(), false);
        }
        if (payload.isPresent() && root.path(QUEUE_FIELD).isArray()) {
            return new DecodedQueue(toEntries(root.path(QUEUE_FIELD)), true);
        }
        if (root.isArray()) {
            return new DecodedQueue(toEntries(root), false);
        }
        if (root.path(QUEUE_FIELD).isArray()) {
            return new DecodedQueue(toEntries(root.path(QUEUE_FIELD)), false);
        }
        log.warn("Stored queue has an unexpected shape, starting from an empty queue");
        return new DecodedQueue(List.of(), false);
    }

    private JsonNode parse(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private List<SongEntry> toEntries(JsonNode array) {
        List<SongEntry> songs = new ArrayList<>();
        for (JsonNode node : array) {
            if (!node.isObject()) {
                log.warn("Skipping queue element that is not an object: {}", node);
                continue;
            }
            try {
                songs.add(objectMapper.treeToValue(node, SongEntry.class).withPlayableDuration());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping unreadable queue element {}: {}", node, e.getMessage());
            }
        }
        return songs;
    }

    /**
     * @param canonical whether the value was already stored in the wrapped {@code {"q":[...]}} form
     */
    public record DecodedQueue(List<SongEntry> songs, boolean canonical) {
    }
}

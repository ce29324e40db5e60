package com.dev.queuebot.service;

import com.dev.queuebot.config.QueueBotProperties;
import com.dev.queuebot.domain.GameLogEntry;
import com.dev.queuebot.domain.InboxRequest;
import com.dev.queuebot.repository.HighriseLogClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class LogCommandPoller {

    static final String PLAY_COMMAND = "!play ";

    private final HighriseLogClient logClient;
    private final InboxProcessor inboxProcessor;
    private final QueueBotProperties.LogCommands properties;

    private String lastProcessedId;

    public LogCommandPoller(HighriseLogClient logClient,
                            InboxProcessor inboxProcessor,
                            QueueBotProperties properties) {
        this.logClient = logClient;
        this.inboxProcessor = inboxProcessor;
        this.properties = properties.logCommands();
    }

    public boolean isEnabled() {
        return properties.enabled();
    }

    /**
     * @return the number of songs queued from the log
     */
    public int poll() {
        List<GameLogEntry> logs = logClient.fetchRecent(properties.fetchLimit());
        if (logs.isEmpty()) {
            return 0;
        }
        if (lastProcessedId == null) {
            lastProcessedId = logs.get(0).id();
            if (lastProcessedId != null) {
                log.info("Log watermark initialised at {}", lastProcessedId);
            }
            return 0;
        }
        List<GameLogEntry> oldestFirst = new ArrayList<>(logs);
        Collections.reverse(oldestFirst);
        int queued = 0;
        for (GameLogEntry entry : oldestFirst) {
            if (entry.id() == null || entry.id().compareTo(lastProcessedId) <= 0) {
                continue;
            }
            Optional<InboxRequest> command = parse(entry.message());
            if (command.isPresent()) {
                log.info("Found command: {}", entry.message());
                if (inboxProcessor.enqueue(command.get())) {
                    queued++;
                }
            }
            lastProcessedId = entry.id();
        }
        return queued;
    }

    static Optional<InboxRequest> parse(String message) {
        if (message == null || !message.startsWith(PLAY_COMMAND)) {
            return Optional.empty();
        }
        String[] parts = message.substring(PLAY_COMMAND.length()).split("\\|");
        if (parts.length < 3) {
            return Optional.empty();
        }
        String query = parts[0].strip();
        if (query.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new InboxRequest(query, parts[1].strip(), parts[2].strip()));
    }
}

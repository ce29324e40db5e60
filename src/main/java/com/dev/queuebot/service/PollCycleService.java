package com.dev.queuebot.service;

import com.dev.queuebot.config.QueueBotProperties;
import com.dev.queuebot.domain.PlaybackTransition;
import com.dev.queuebot.domain.RemoteObject;
import com.dev.queuebot.repository.RemoteStorageClient;
import com.dev.queuebot.repository.StorageAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Slf4j
@Service
public class PollCycleService {

    private final RemoteStorageClient storage;
    private final QueueSynchronizer queueSynchronizer;
    private final InboxProcessor inboxProcessor;
    private final LogCommandPoller logCommandPoller;
    private final PlaybackScheduler playbackScheduler;
    private final Clock clock;
    private final String inboxKey;

    public PollCycleService(RemoteStorageClient storage,
                            QueueSynchronizer queueSynchronizer,
                            InboxProcessor inboxProcessor,
                            LogCommandPoller logCommandPoller,
                            PlaybackScheduler playbackScheduler,
                            Clock clock,
                            QueueBotProperties properties) {
        this.storage = storage;
        this.queueSynchronizer = queueSynchronizer;
        this.inboxProcessor = inboxProcessor;
        this.logCommandPoller = logCommandPoller;
        this.playbackScheduler = playbackScheduler;
        this.clock = clock;
        this.inboxKey = properties.storage().inboxKey();
    }

    public PlaybackTransition runCycle() {
        try {
            queueSynchronizer.flushPending();
        } catch (QueueSyncException e) {
            log.warn("Postponed queue changes are still not stored: {}", e.getMessage());
        }

        Optional<RemoteObject> inbox = readInbox();
        inboxProcessor.process(inbox);

        if (logCommandPoller.isEnabled()) {
            logCommandPoller.poll();
        }

        return playbackScheduler.advance(clock.instant());
    }

    private Optional<RemoteObject> readInbox() {
        try {
            return storage.read(inboxKey);
        } catch (StorageAccessException e) {
            log.warn("Inbox not readable this cycle: {}", e.getMessage());
            return Optional.empty();
        }
    }
}

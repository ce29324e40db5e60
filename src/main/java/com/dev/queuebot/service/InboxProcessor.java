package com.dev.queuebot.service;

import com.dev.queuebot.config.QueueBotProperties;
import com.dev.queuebot.domain.InboxRequest;
import com.dev.queuebot.domain.RemoteObject;
import com.dev.queuebot.domain.SongEntry;
import com.dev.queuebot.domain.SongMetadata;
import com.dev.queuebot.repository.RemoteStorageClient;
import com.dev.queuebot.repository.StorageAccessException;
import com.dev.queuebot.repository.VersionConflictException;
import com.dev.queuebot.service.resolver.SongResolutionException;
import com.dev.queuebot.service.resolver.SongResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * The inbox is cleared before the song is resolved, so a request is queued at most once.
 */
@Slf4j
@Service
public class InboxProcessor {

    private final RemoteStorageClient storage;
    private final InboxRequestDecoder decoder;
    private final SongResolver songResolver;
    private final QueueSynchronizer queueSynchronizer;
    private final String inboxKey;

    public InboxProcessor(RemoteStorageClient storage,
                          InboxRequestDecoder decoder,
                          SongResolver songResolver,
                          QueueSynchronizer queueSynchronizer,
                          QueueBotProperties properties) {
        this.storage = storage;
        this.decoder = decoder;
        this.songResolver = songResolver;
        this.queueSynchronizer = queueSynchronizer;
        this.inboxKey = properties.storage().inboxKey();
    }

    /**
     * @return whether a song was added to the queue
     */
    public boolean process(Optional<RemoteObject> inbox) {
        if (inbox.isEmpty() || inbox.get().isBlank()) {
            return false;
        }
        RemoteObject handle = inbox.get();
        log.info("Raw inbox value: {}", handle.value());
        Optional<InboxRequest> request = decoder.decode(handle.value());
        if (!clear(handle)) {
            return false;
        }
        return request.map(this::enqueue).orElse(false);
    }

    /**
     * Resolves the request and appends it to the queue.
     *
     * @return whether a song was added to the queue
     */
    public boolean enqueue(InboxRequest request) {
        SongMetadata metadata;
        try {
            metadata = songResolver.resolve(request);
        } catch (SongResolutionException e) {
            log.error("Dropping request '{}' from {}: {}", request.query(), request.user(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Resolver failed for '{}' from {}", request.query(), request.user(), e);
            return false;
        }
        SongEntry entry = SongEntry.builder()
                .id(UUID.randomUUID().toString())
                .title(metadata.title())
                .url(metadata.url())
                .durationSeconds(metadata.durationSeconds())
                .requestedBy(request.user())
                .requestedByUserId(request.userId())
                .build()
                .withPlayableDuration();
        try {
            queueSynchronizer.append(entry);
        } catch (QueueSyncException e) {
            log.warn("'{}' is queued locally but not stored yet: {}", entry.getTitle(), e.getMessage());
        }
        return true;
    }

    private boolean clear(RemoteObject handle) {
        try {
            storage.write(inboxKey, "", handle.version());
            return true;
        } catch (VersionConflictException e) {
            log.info("Inbox was rewritten while draining, the newer request is handled next cycle");
            return false;
        } catch (StorageAccessException e) {
            log.warn("Could not clear the inbox, leaving the request for the next cycle: {}", e.getMessage());
            return false;
        }
    }
}

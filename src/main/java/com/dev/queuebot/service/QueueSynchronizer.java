package com.dev.queuebot.service;

import com.dev.queuebot.config.QueueBotProperties;
import com.dev.queuebot.domain.QueueMutation;
import com.dev.queuebot.domain.RemoteObject;
import com.dev.queuebot.domain.SongEntry;
import com.dev.queuebot.domain.VersionToken;
import com.dev.queuebot.repository.RemoteStorageClient;
import com.dev.queuebot.repository.StorageAccessException;
import com.dev.queuebot.repository.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes the queue with the last known version. On a conflict the pending mutations are replayed on
 * the remote queue and the write is retried once; after that they stay pending for
 * {@link #flushPending()}. A superseded or unknown version is never written with.
 */
@Slf4j
@Service
public class QueueSynchronizer {

    private final RemoteStorageClient storage;
    private final QueueCodec codec;
    private final QueueEventPublisher eventPublisher;
    private final String queueKey;

    private final List<QueueMutation> pending = new ArrayList<>();
    private List<SongEntry> songs = new ArrayList<>();
    private VersionToken version;
    private boolean versionStale;

    public QueueSynchronizer(RemoteStorageClient storage,
                             QueueCodec codec,
                             QueueEventPublisher eventPublisher,
                             QueueBotProperties properties) {
        this.storage = storage;
        this.codec = codec;
        this.eventPublisher = eventPublisher;
        this.queueKey = properties.storage().queueKey();
    }

    /**
     * Replaces the local queue with the remote one, keeping any changes not yet written.
     *
     * @return whether the remote value was already stored in the canonical wrapped form
     */
    public synchronized boolean load(Optional<RemoteObject> remote) {
        QueueCodec.DecodedQueue decoded = codec.decode(remote.map(RemoteObject::value).orElse(null));
        version = remote.map(RemoteObject::version).orElse(null);
        versionStale = false;
        songs = replayPending(decoded.songs());
        log.info("Loaded {} song(s) from {} (version {})", songs.size(), queueKey, version);
        eventPublisher.queueChanged(List.copyOf(songs));
        return decoded.canonical();
    }

    /**
     * @throws StorageAccessException when the remote queue cannot be read
     */
    public boolean refresh() {
        return load(storage.read(queueKey));
    }

    /**
     * @throws QueueSyncException when the write is postponed; the entry is still queued locally
     */
    public synchronized void append(SongEntry entry) {
        apply(new QueueMutation.Append(entry));
        log.info("Queued '{}' for {} at position {}", entry.getTitle(), entry.getRequestedBy(), songs.size() - 1);
        persist();
    }

    /**
     * @throws QueueSyncException when the write is postponed; the head is still removed locally
     */
    public synchronized Optional<SongEntry> popHead() {
        if (songs.isEmpty()) {
            return Optional.empty();
        }
        SongEntry head = songs.get(0);
        apply(new QueueMutation.RemoveEntry(head));
        persist();
        return Optional.of(head);
    }

    public synchronized void flushPending() {
        if (pending.isEmpty()) {
            return;
        }
        log.info("Writing {} postponed queue change(s)", pending.size());
        persist();
    }

    /**
     * Rewrites the remote queue in canonical form even when nothing changed locally.
     */
    public synchronized void publishCanonical() {
        persist();
    }

    public synchronized List<SongEntry> snapshot() {
        return List.copyOf(songs);
    }

    public synchronized Optional<SongEntry> head() {
        return songs.isEmpty() ? Optional.empty() : Optional.of(songs.get(0));
    }

    public synchronized boolean hasPendingChanges() {
        return !pending.isEmpty();
    }

    public synchronized Optional<VersionToken> currentVersion() {
        return Optional.ofNullable(version);
    }

    private void apply(QueueMutation mutation) {
        pending.add(mutation);
        songs = mutation.applyTo(songs);
    }

    private void persist() {
        try {
            if (versionStale || version == null) {
                rebaseOnRemote();
            }
            write();
        } catch (VersionConflictException first) {
            versionStale = true;
            log.info("Queue version {} was superseded, replaying {} change(s) on the remote queue", version, pending.size());
            try {
                rebaseOnRemote();
                write();
            } catch (VersionConflictException second) {
                versionStale = true;
                throw new QueueSyncException("Queue write conflicted again, retrying next cycle", second);
            } catch (StorageAccessException e) {
                throw new QueueSyncException("Queue rebase failed, retrying next cycle", e);
            }
        } catch (StorageAccessException e) {
            throw new QueueSyncException("Queue write failed, retrying next cycle", e);
        }
    }

    private void rebaseOnRemote() {
        Optional<RemoteObject> remote = storage.read(queueKey);
        version = remote.map(RemoteObject::version).orElse(null);
        songs = replayPending(codec.decode(remote.map(RemoteObject::value).orElse(null)).songs());
        versionStale = false;
    }

    private List<SongEntry> replayPending(List<SongEntry> base) {
        List<SongEntry> result = base;
        for (QueueMutation mutation : pending) {
            result = mutation.applyTo(result);
        }
        return new ArrayList<>(result);
    }

    private void write() {
        RemoteObject written = storage.write(queueKey, codec.encode(songs), version);
        version = written.version();
        // without a returned version the next write has to re-read first
        versionStale = version == null;
        pending.clear();
        eventPublisher.queueChanged(List.copyOf(songs));
    }
}

package com.dev.queuebot.service;

import com.dev.queuebot.domain.PlaybackState;
import com.dev.queuebot.domain.PlaybackTransition;
import com.dev.queuebot.domain.SongEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * The playing song stays at the head of the queue until the first poll at or after its deadline.
 */
@Slf4j
@Service
public class PlaybackScheduler {

    private final QueueSynchronizer queueSynchronizer;
    private final QueueEventPublisher eventPublisher;

    private volatile PlaybackState state = PlaybackState.idle();

    public PlaybackScheduler(QueueSynchronizer queueSynchronizer, QueueEventPublisher eventPublisher) {
        this.queueSynchronizer = queueSynchronizer;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Performs at most one transition.
     */
    public PlaybackTransition advance(Instant now) {
        PlaybackState current = state;
        if (current.isPlaying()) {
            if (!current.hasElapsed(now)) {
                return PlaybackTransition.NONE;
            }
            finish(current);
            return PlaybackTransition.FINISHED;
        }
        Optional<SongEntry> head = queueSynchronizer.head();
        if (head.isEmpty()) {
            return PlaybackTransition.NONE;
        }
        start(head.get(), now);
        return PlaybackTransition.STARTED;
    }

    public PlaybackState state() {
        return state;
    }

    private void start(SongEntry entry, Instant now) {
        state = PlaybackState.playing(entry.withPlayableDuration(), now);
        log.info("Now playing: {} (ends in {}s)", entry.getTitle(), state.getCurrentEntry().getDurationSeconds());
        eventPublisher.playbackChanged(state);
    }

    private void finish(PlaybackState finished) {
        SongEntry song = finished.getCurrentEntry();
        log.info("Song finished: {}", song.getTitle());
        boolean stillAtHead = queueSynchronizer.head().map(song::isSameSong).orElse(false);
        if (stillAtHead) {
            try {
                queueSynchronizer.popHead();
            } catch (QueueSyncException e) {
                log.warn("Removing the finished song is postponed: {}", e.getMessage());
            }
        } else {
            // removed by someone else after a reload
            log.info("'{}' is no longer at the head of the queue, nothing to remove", song.getTitle());
        }
        state = PlaybackState.idle();
        eventPublisher.playbackChanged(state);
    }
}

package com.dev.queuebot.web.dto;

import com.dev.queuebot.domain.PlaybackState;
import com.dev.queuebot.domain.PlaybackStatus;
import com.dev.queuebot.domain.SongEntry;

import java.time.Instant;

public record PlaybackStateResponse(
        PlaybackStatus status,
        String nowPlayingTitle,
        String nowPlayingId,
        String requestedBy,
        Instant startedAt,
        Instant deadline
) {

    public static PlaybackStateResponse of(PlaybackState state) {
        SongEntry current = state.getCurrentEntry();
        return new PlaybackStateResponse(
                state.getStatus(),
                current != null ? current.getTitle() : null,
                current != null ? current.getId() : null,
                current != null ? current.getRequestedBy() : null,
                state.getStartedAt(),
                state.getDeadline()
        );
    }
}

package com.dev.queuebot.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class PlaybackState {

    private static final PlaybackState IDLE = PlaybackState.builder().status(PlaybackStatus.IDLE).build();

    PlaybackStatus status;
    SongEntry currentEntry;
    Instant startedAt;
    Instant deadline;

    public static PlaybackState idle() {
        return IDLE;
    }

    public static PlaybackState playing(SongEntry entry, Instant now) {
        return PlaybackState.builder()
                .status(PlaybackStatus.PLAYING)
                .currentEntry(entry)
                .startedAt(now)
                .deadline(now.plusSeconds(entry.getDurationSeconds()))
                .build();
    }

    public boolean isPlaying() {
        return status == PlaybackStatus.PLAYING;
    }

    public boolean hasElapsed(Instant now) {
        return isPlaying() && !now.isBefore(deadline);
    }
}

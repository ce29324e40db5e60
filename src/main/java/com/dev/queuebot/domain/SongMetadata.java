package com.dev.queuebot.domain;

public record SongMetadata(
        String title,
        String url,
        int durationSeconds,
        String attributionUser
) {
}

package com.dev.queuebot.web.dto;

public record QueueItemView(
        String id,
        String title,
        String url,
        int durationSeconds,
        int position,
        String requestedBy,
        String requestedByUserId
) {
}

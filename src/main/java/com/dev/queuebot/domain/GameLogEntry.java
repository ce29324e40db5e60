package com.dev.queuebot.domain;

public record GameLogEntry(
        String id,
        String message
) {
}

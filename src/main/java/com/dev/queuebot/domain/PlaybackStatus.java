package com.dev.queuebot.domain;

public enum PlaybackStatus {
    IDLE,
    PLAYING
}

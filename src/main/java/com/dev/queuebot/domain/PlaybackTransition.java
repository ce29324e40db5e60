package com.dev.queuebot.domain;

public enum PlaybackTransition {
    NONE,
    STARTED,
    FINISHED
}

package com.dev.queuebot.service.resolver;

public class SongResolutionException extends RuntimeException {

    public SongResolutionException(String message) {
        super(message);
    }

    public SongResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.dev.queuebot.domain;

public record RemoteObject(
        String key,
        String value,
        VersionToken version
) {

    public boolean isBlank() {
        return value == null || value.isBlank();
    }
}

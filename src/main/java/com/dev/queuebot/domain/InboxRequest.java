package com.dev.queuebot.domain;

public record InboxRequest(
        String query,
        String user,
        String userId
) {

    public static final String UNKNOWN_USER = "Unknown";

    public static InboxRequest anonymous(String query) {
        return new InboxRequest(query, UNKNOWN_USER, "");
    }
}

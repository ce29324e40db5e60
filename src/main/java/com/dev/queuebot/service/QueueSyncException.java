package com.dev.queuebot.service;

/**
 * A queue write was given up for this cycle. The local change is kept and written on the next flush.
 */
public class QueueSyncException extends RuntimeException {

    public QueueSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}

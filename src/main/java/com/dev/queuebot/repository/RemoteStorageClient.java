package com.dev.queuebot.repository;

import com.dev.queuebot.domain.RemoteObject;
import com.dev.queuebot.domain.VersionToken;

import java.util.Optional;

/**
 * Versioned key-value storage shared with the game.
 */
public interface RemoteStorageClient {

    /**
     * @return the stored object, or empty when the key has never been written
     * @throws StorageAccessException on transport failure, timeout or an unexpected response
     */
    Optional<RemoteObject> read(String key);

    /**
     * Writes {@code value} under {@code key}. A {@code null} expected version overwrites
     * unconditionally.
     *
     * @return the stored object carrying the new version
     * @throws VersionConflictException when {@code expectedVersion} is no longer current; nothing is written
     * @throws StorageAccessException on transport failure, timeout or an unexpected response
     */
    RemoteObject write(String key, String value, VersionToken expectedVersion);
}

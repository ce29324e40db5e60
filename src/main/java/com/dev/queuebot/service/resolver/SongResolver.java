package com.dev.queuebot.service.resolver;

import com.dev.queuebot.domain.InboxRequest;
import com.dev.queuebot.domain.SongMetadata;

/**
 * Turns a free-text request into something playable.
 */
public interface SongResolver {

    /**
     * @throws SongResolutionException when nothing playable can be produced
     */
    SongMetadata resolve(InboxRequest request);
}

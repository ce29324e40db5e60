package com.dev.queuebot.service.resolver;

import com.dev.queuebot.config.QueueBotProperties;
import com.dev.queuebot.domain.InboxRequest;
import com.dev.queuebot.domain.SongMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(name = "queuebot.resolver.type", havingValue = "placeholder", matchIfMissing = true)
public class PlaceholderSongResolver implements SongResolver {

    private final QueueBotProperties.Resolver properties;

    public PlaceholderSongResolver(QueueBotProperties properties) {
        this.properties = properties.resolver();
    }

    @Override
    public SongMetadata resolve(InboxRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new SongResolutionException("Empty query");
        }
        log.info("Resolving song: {}", request.query());
        return new SongMetadata(
                "Song: " + request.query(),
                properties.streamUrl(),
                properties.defaultDurationSeconds(),
                request.user()
        );
    }
}

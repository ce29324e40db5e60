package com.dev.queuebot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "queuebot")
public record QueueBotProperties(
        @Valid @DefaultValue Storage storage,
        @Valid @DefaultValue Poll poll,
        @Valid @DefaultValue Resolver resolver,
        @Valid @DefaultValue LogCommands logCommands
) {

    public record Storage(
            @NotBlank @DefaultValue("https://api.worlds.highrise.game/api") String apiBase,
            @DefaultValue("") String apiKey,
            @NotBlank @DefaultValue("bot_inbox") String inboxKey,
            @NotBlank @DefaultValue("music_queue") String queueKey,
            @NotNull @DefaultValue("10s") Duration timeout
    ) {
    }

    public record Poll(
            @DefaultValue("true") boolean enabled
    ) {
    }

    public record Resolver(
            @NotBlank @DefaultValue("placeholder") String type,
            @DefaultValue("") String baseUrl,
            @NotBlank @DefaultValue("http://46.224.123.14:8000/radio") String streamUrl,
            @Min(1) @DefaultValue("30") int defaultDurationSeconds
    ) {
    }

    public record LogCommands(
            @DefaultValue("false") boolean enabled,
            @Min(1) @DefaultValue("50") int fetchLimit
    ) {
    }
}

package com.dev.queuebot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Slf4j
@Configuration
public class StorageClientConfig {

    @Bean
    public RestTemplate storageRestTemplate(RestTemplateBuilder builder, QueueBotProperties properties) {
        QueueBotProperties.Storage storage = properties.storage();
        String apiKey = storage.apiKey() == null ? "" : storage.apiKey().trim();
        if (apiKey.isEmpty()) {
            log.error("Storage API key is missing, remote calls will be rejected");
        } else {
            log.info("Storage API key loaded (length {})", apiKey.length());
        }
        return builder
                .rootUri(storage.apiBase())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .setConnectTimeout(storage.timeout())
                .setReadTimeout(storage.timeout())
                .build();
    }

    @Bean
    public RestTemplate resolverRestTemplate(RestTemplateBuilder builder, QueueBotProperties properties) {
        return builder
                .setConnectTimeout(properties.storage().timeout())
                .setReadTimeout(properties.storage().timeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

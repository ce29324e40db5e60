package com.dev.queuebot.scheduler;

import com.dev.queuebot.repository.StorageAccessException;
import com.dev.queuebot.service.QueueSyncException;
import com.dev.queuebot.service.QueueSynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "queuebot.poll.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class QueueBootstrap implements ApplicationRunner {

    private final QueueSynchronizer queueSynchronizer;

    @Override
    public void run(ApplicationArguments args) {
        boolean canonical;
        try {
            canonical = queueSynchronizer.refresh();
        } catch (StorageAccessException e) {
            log.error("Could not restore the queue, starting empty: {}", e.getMessage());
            return;
        }
        log.info("Restored {} song(s) from storage", queueSynchronizer.snapshot().size());
        if (canonical) {
            return;
        }
        try {
            queueSynchronizer.publishCanonical();
            log.info("Stored queue rewritten in the wrapped format");
        } catch (QueueSyncException e) {
            log.warn("Failed to rewrite the stored queue: {}", e.getMessage());
        }
    }
}

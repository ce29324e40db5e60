package com.dev.queuebot.scheduler;

import com.dev.queuebot.service.PollCycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
        name = "queuebot.poll.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class PollScheduler {

    private final PollCycleService pollCycleService;

    @Scheduled(fixedDelayString = "${queuebot.poll.interval:PT3S}")
    public void poll() {
        try {
            pollCycleService.runCycle();
        } catch (Exception e) {
            log.error("Poll cycle failed", e);
        }
    }
}

package com.dev.queuebot.web.rest;

import com.dev.queuebot.service.QueueSynchronizer;
import com.dev.queuebot.web.dto.QueueResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/queue")
public class QueueController {

    private final QueueSynchronizer queueSynchronizer;

    public QueueController(QueueSynchronizer queueSynchronizer) {
        this.queueSynchronizer = queueSynchronizer;
    }

    @GetMapping
    public QueueResponse getQueue() {
        return QueueResponse.of(queueSynchronizer.snapshot());
    }

    @PostMapping("/refresh")
    public QueueResponse refresh() {
        queueSynchronizer.refresh();
        return QueueResponse.of(queueSynchronizer.snapshot());
    }
}

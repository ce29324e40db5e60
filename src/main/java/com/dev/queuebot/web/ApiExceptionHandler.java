package com.dev.queuebot.web;

import com.dev.queuebot.repository.StorageAccessException;
import com.dev.queuebot.service.QueueSyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({
            StorageAccessException.class,
            QueueSyncException.class
    })
    public ResponseEntity<Map<String, Object>> handleRemoteFailure(RuntimeException ex) {
        HttpStatus status = HttpStatus.BAD_GATEWAY;
        log.warn("Remote storage request failed: {}", ex.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "status", status.value(),
                "error", status.getReasonPhrase(),
                "message", ex.getMessage()
        ));
    }
}

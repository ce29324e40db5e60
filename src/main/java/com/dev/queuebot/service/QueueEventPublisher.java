package com.dev.queuebot.service;

import com.dev.queuebot.domain.PlaybackState;
import com.dev.queuebot.domain.SongEntry;
import com.dev.queuebot.web.dto.PlaybackStateResponse;
import com.dev.queuebot.web.dto.QueueResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
public class QueueEventPublisher {

    static final String QUEUE_TOPIC = "/topic/queue";
    static final String PLAYBACK_TOPIC = "/topic/playback";

    private final SimpMessagingTemplate messagingTemplate;

    public QueueEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void queueChanged(List<SongEntry> songs) {
        send(QUEUE_TOPIC, QueueResponse.of(songs));
    }

    public void playbackChanged(PlaybackState state) {
        send(PLAYBACK_TOPIC, PlaybackStateResponse.of(state));
    }

    private void send(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            log.warn("Broadcast to {} failed: {}", destination, e.getMessage());
        }
    }
}

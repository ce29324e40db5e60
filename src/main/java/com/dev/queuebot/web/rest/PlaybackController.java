package com.dev.queuebot.web.rest;

import com.dev.queuebot.service.PlaybackScheduler;
import com.dev.queuebot.web.dto.PlaybackStateResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/playback")
public class PlaybackController {

    private final PlaybackScheduler playbackScheduler;

    public PlaybackController(PlaybackScheduler playbackScheduler) {
        this.playbackScheduler = playbackScheduler;
    }

    @GetMapping
    public PlaybackStateResponse getState() {
        return PlaybackStateResponse.of(playbackScheduler.state());
    }
}

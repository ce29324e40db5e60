package com.dev.queuebot.service;

import com.dev.queuebot.config.QueueBotProperties;
import com.dev.queuebot.domain.PlaybackStatus;
import com.dev.queuebot.domain.PlaybackTransition;
import com.dev.queuebot.domain.SongEntry;
import com.dev.queuebot.repository.HighriseLogClient;
import com.dev.queuebot.service.resolver.PlaceholderSongResolver;
import com.dev.queuebot.support.InMemoryRemoteStorage;
import com.dev.queuebot.support.MutableClock;
import com.dev.queuebot.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.dev.queuebot.support.TestProperties.INBOX_KEY;
import static com.dev.queuebot.support.TestProperties.QUEUE_KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class PollCycleServiceTest {

    private InMemoryRemoteStorage storage;
    private QueueCodec codec;
    private QueueSynchronizer queueSynchronizer;
    private PlaybackScheduler playbackScheduler;
    private HighriseLogClient logClient;
    private MutableClock clock;
    private PollCycleService pollCycleService;

    @BeforeEach
    void setUp() {
        QueueBotProperties properties = TestProperties.defaults();
        ObjectMapper objectMapper = new ObjectMapper();
        QueueEventPublisher eventPublisher = mock(QueueEventPublisher.class);
        storage = new InMemoryRemoteStorage();
        codec = new QueueCodec(objectMapper, new LuaLongStringEnvelope());
        queueSynchronizer = new QueueSynchronizer(storage, codec, eventPublisher, properties);
        InboxProcessor inboxProcessor = new InboxProcessor(storage, new InboxRequestDecoder(objectMapper),
                new PlaceholderSongResolver(properties), queueSynchronizer, properties);
        logClient = mock(HighriseLogClient.class);
        LogCommandPoller logCommandPoller = new LogCommandPoller(logClient, inboxProcessor, properties);
        playbackScheduler = new PlaybackScheduler(queueSynchronizer, eventPublisher);
        clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        pollCycleService = new PollCycleService(storage, queueSynchronizer, inboxProcessor, logCommandPoller,
                playbackScheduler, clock, properties);
    }

    private List<SongEntry> storedQueue() {
        return codec.decode(storage.valueOf(QUEUE_KEY).orElse(null)).songs();
    }

    @Test
    @DisplayName("a request goes from the inbox to playing and out of the queue after its duration")
    void requestLifecycle() {
        storage.put(INBOX_KEY, "{\"query\":\"abc\",\"user\":\"u1\",\"userId\":\"42\"}");

        PlaybackTransition first = pollCycleService.runCycle();

        assertThat(first).isEqualTo(PlaybackTransition.STARTED);
        assertThat(storage.valueOf(INBOX_KEY)).contains("");
        assertThat(storedQueue()).singleElement().satisfies(entry -> {
            assertThat(entry.getTitle()).contains("abc");
            assertThat(entry.getDurationSeconds()).isEqualTo(30);
            assertThat(entry.getRequestedBy()).isEqualTo("u1");
            assertThat(entry.getRequestedByUserId()).isEqualTo("42");
        });
        assertThat(playbackScheduler.state().getStatus()).isEqualTo(PlaybackStatus.PLAYING);

        clock.advance(Duration.ofSeconds(3));
        assertThat(pollCycleService.runCycle()).isEqualTo(PlaybackTransition.NONE);

        clock.advance(Duration.ofSeconds(27));
        PlaybackTransition last = pollCycleService.runCycle();

        assertThat(last).isEqualTo(PlaybackTransition.FINISHED);
        assertThat(storedQueue()).isEmpty();
        assertThat(playbackScheduler.state().getStatus()).isEqualTo(PlaybackStatus.IDLE);
    }

    @Test
    @DisplayName("an unreadable inbox is picked up on the next cycle")
    void transientInboxReadFailure() {
        storage.put(INBOX_KEY, "abc");
        storage.failNextReads(1);

        pollCycleService.runCycle();

        assertThat(storage.valueOf(INBOX_KEY)).contains("abc");
        assertThat(queueSynchronizer.snapshot()).isEmpty();

        clock.advance(Duration.ofSeconds(3));
        pollCycleService.runCycle();

        assertThat(storage.valueOf(INBOX_KEY)).contains("");
        assertThat(storedQueue()).extracting(SongEntry::getTitle).containsExactly("Song: abc");
    }

    @Test
    @DisplayName("a postponed queue write is stored at the start of the next cycle")
    void flushesPendingFirst() {
        storage.put(INBOX_KEY, "abc");
        storage.beforeWrite(QUEUE_KEY, () -> storage.failNextWrites(1));

        pollCycleService.runCycle();

        assertThat(storage.valueOf(QUEUE_KEY)).isEmpty();
        assertThat(queueSynchronizer.hasPendingChanges()).isTrue();

        clock.advance(Duration.ofSeconds(3));
        pollCycleService.runCycle();

        assertThat(storedQueue()).extracting(SongEntry::getTitle).containsExactly("Song: abc");
        assertThat(queueSynchronizer.hasPendingChanges()).isFalse();
    }

    @Test
    @DisplayName("the game log is not read while log commands are disabled")
    void logCommandsDisabled() {
        pollCycleService.runCycle();

        verifyNoInteractions(logClient);
    }
}

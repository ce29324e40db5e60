package com.dev.queuebot.scheduler;

import com.dev.queuebot.service.LuaLongStringEnvelope;
import com.dev.queuebot.service.QueueCodec;
import com.dev.queuebot.service.QueueEventPublisher;
import com.dev.queuebot.service.QueueSynchronizer;
import com.dev.queuebot.support.InMemoryRemoteStorage;
import com.dev.queuebot.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dev.queuebot.support.SongEntries.song;
import static com.dev.queuebot.support.TestProperties.QUEUE_KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class QueueBootstrapTest {

    private InMemoryRemoteStorage storage;
    private QueueCodec codec;
    private QueueSynchronizer queueSynchronizer;
    private QueueBootstrap bootstrap;

    @BeforeEach
    void setUp() {
        storage = new InMemoryRemoteStorage();
        codec = new QueueCodec(new ObjectMapper(), new LuaLongStringEnvelope());
        queueSynchronizer = new QueueSynchronizer(storage, codec, mock(QueueEventPublisher.class),
                TestProperties.defaults());
        bootstrap = new QueueBootstrap(queueSynchronizer);
    }

    @Test
    void restoresWrappedQueueWithoutWriting() {
        storage.put(QUEUE_KEY, codec.encode(List.of(song("a"), song("b"))));

        bootstrap.run(null);

        assertThat(queueSynchronizer.snapshot()).hasSize(2);
        assertThat(storage.writeLog()).isEmpty();
    }

    @Test
    void rewritesLegacyArray() {
        storage.put(QUEUE_KEY, "[{\"title\":\"old\",\"url\":\"u\",\"duration\":10}]");

        bootstrap.run(null);

        String stored = storage.valueOf(QUEUE_KEY).orElseThrow();
        assertThat(codec.decode(stored).canonical()).isTrue();
        assertThat(codec.decode(stored).songs()).extracting("title").containsExactly("old");
    }

    @Test
    void missingQueueIsInitialised() {
        bootstrap.run(null);

        assertThat(storage.valueOf(QUEUE_KEY)).contains("return [[{\"q\":[]}]]");
    }

    @Test
    void unreadableStorageStartsEmpty() {
        storage.failNextReads(1);

        bootstrap.run(null);

        assertThat(queueSynchronizer.snapshot()).isEmpty();
        assertThat(storage.writeLog()).isEmpty();
    }
}

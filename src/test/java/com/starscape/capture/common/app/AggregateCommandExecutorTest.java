package com.starscape.capture.common.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.starscape.capture.common.concurrency.AggregateLocks;
import com.starscape.capture.common.config.CaptureProperties;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.common.exception.NotFoundException;
import com.starscape.capture.common.outbox.InMemoryOutboxEventRepository;
import com.starscape.capture.common.outbox.OutboxService;
import com.starscape.capture.features.instagram.domain.Post;
import com.starscape.capture.features.instagram.domain.PostId;
import com.starscape.capture.features.instagram.domain.PostMetadata;
import com.starscape.capture.features.instagram.domain.UserId;
import com.starscape.capture.features.instagram.domain.events.PostDownloadRequested;
import com.starscape.capture.features.instagram.infra.InMemoryPostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregateCommandExecutorTest {

    private static final PostId POST_ID = PostId.of("C1a2B3");

    private InMemoryPostRepository postRepository;
    private InMemoryOutboxEventRepository outboxRepository;
    private AggregateCommandExecutor executor;

    @BeforeEach
    void setUp() {
        postRepository = new InMemoryPostRepository();
        outboxRepository = new InMemoryOutboxEventRepository();
        OutboxService outboxService = new OutboxService(outboxRepository, rejectingDownloadRequests());
        executor = new AggregateCommandExecutor(new AggregateLocks(new CaptureProperties()), outboxService);

        PostMetadata metadata = new PostMetadata("Sunset", "https://cdn.example.com/1.jpg", null, 0, 0,
                List.of(), null, Instant.now(), false, null);
        executor.create(postRepository, POST_ID, () -> Post.capture(POST_ID, UserId.of("user-1"), metadata));
    }

    @Test
    void captureStoresAggregateAndItsEvent() {
        assertTrue(postRepository.findById(POST_ID).isPresent());
        assertEquals(1, outboxRepository.findByAggregateId(POST_ID.value()).size());
    }

    @Test
    void unserializableEventLeavesStoredStateUntouched() {
        RuntimeException ex = assertThrows(RuntimeException.class,
                () -> executor.update(postRepository, POST_ID, Post::requestDownload));
        assertInstanceOf(JsonProcessingException.class, ex.getCause());

        Post stored = postRepository.findById(POST_ID).orElseThrow();
        assertEquals(DownloadState.CAPTURED, stored.getDownloadState());
        assertEquals(1, outboxRepository.findByAggregateId(POST_ID.value()).size());
    }

    @Test
    void updateOfMissingAggregateIsNotFound() {
        assertThrows(NotFoundException.class,
                () -> executor.update(postRepository, PostId.of("missing"), Post::requestDownload));
    }

    private static ObjectMapper rejectingDownloadRequests() {
        ObjectMapper mapper = new ObjectMapper() {
            @Override
            public String writeValueAsString(Object value) throws JsonProcessingException {
                if (value instanceof PostDownloadRequested) {
                    throw new JsonMappingException(null, "cannot write " + PostDownloadRequested.TYPE);
                }
                return super.writeValueAsString(value);
            }
        };
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}

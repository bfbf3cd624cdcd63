package com.starscape.capture.features.download.app;

import com.starscape.capture.common.app.AggregateCommandExecutor;
import com.starscape.capture.common.concurrency.AggregateLocks;
import com.starscape.capture.common.config.CaptureProperties;
import com.starscape.capture.common.config.JacksonConfig;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.common.exception.AlreadyDownloadedException;
import com.starscape.capture.common.exception.NotFoundException;
import com.starscape.capture.common.outbox.InMemoryOutboxEventRepository;
import com.starscape.capture.common.outbox.OutboxEvent;
import com.starscape.capture.common.outbox.OutboxService;
import com.starscape.capture.features.instagram.domain.Post;
import com.starscape.capture.features.instagram.domain.PostId;
import com.starscape.capture.features.instagram.domain.PostMetadata;
import com.starscape.capture.features.instagram.domain.UserId;
import com.starscape.capture.features.instagram.infra.InMemoryPostRepository;
import com.starscape.capture.features.pinterest.infra.InMemoryPinRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DownloadServiceTest {

    private static final String POST_ID = "C1a2B3";

    private InMemoryPostRepository postRepository;
    private InMemoryOutboxEventRepository outboxRepository;
    private AggregateCommandExecutor executor;
    private DownloadService downloadService;

    @BeforeEach
    void setUp() {
        postRepository = new InMemoryPostRepository();
        outboxRepository = new InMemoryOutboxEventRepository();
        OutboxService outboxService = new OutboxService(outboxRepository, new JacksonConfig().objectMapper());
        executor = new AggregateCommandExecutor(new AggregateLocks(new CaptureProperties()), outboxService);
        downloadService = new DownloadService(List.of(postRepository, new InMemoryPinRepository()), executor);

        PostId id = PostId.of(POST_ID);
        PostMetadata metadata = new PostMetadata("Sunset", "https://cdn.example.com/1.jpg", null, 0, 0,
                List.of(), null, Instant.now(), false, null);
        executor.create(postRepository, id, () -> Post.capture(id, UserId.of("user-1"), metadata));
    }

    @Test
    void routesByContentType() {
        assertEquals(List.of("instagram.post", "pinterest.pin"), List.copyOf(downloadService.contentTypes()));

        DownloadStatus requested = downloadService.requestDownload("instagram.post", POST_ID);
        assertEquals(DownloadState.DOWNLOAD_REQUESTED, requested.state());

        DownloadStatus completed = downloadService.completeDownload("instagram.post", POST_ID, "/d/1.jpg");
        assertEquals(DownloadState.DOWNLOADED, completed.state());
        assertEquals("/d/1.jpg", completed.localPath());
        assertTrue(postRepository.findById(PostId.of(POST_ID)).orElseThrow().isDownloaded());
    }

    @Test
    void unknownContentTypeOrIdIsNotFound() {
        assertThrows(NotFoundException.class, () -> downloadService.requestDownload("myspace.post", POST_ID));
        assertThrows(NotFoundException.class, () -> downloadService.requestDownload("instagram.post", "missing"));
    }

    @Test
    void duplicateCompletionIsRejectedAndLeavesOutboxUntouched() {
        downloadService.completeDownload("instagram.post", POST_ID, "/d/1.jpg");
        int before = outboxRepository.findByAggregateId(POST_ID).size();

        assertThrows(AlreadyDownloadedException.class,
                () -> downloadService.completeDownload("instagram.post", POST_ID, "/d/2.jpg"));

        assertEquals(before, outboxRepository.findByAggregateId(POST_ID).size());
        assertEquals("/d/1.jpg", downloadService.status("instagram.post", POST_ID).localPath());
    }

    @Test
    void concurrentCompletionsProduceExactlyOneDownloadedEvent() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                String path = "/d/" + i + ".jpg";
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        downloadService.completeDownload("instagram.post", POST_ID, path);
                        return true;
                    } catch (AlreadyDownloadedException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    accepted++;
                }
            }
            assertEquals(1, accepted);
        } finally {
            pool.shutdownNow();
        }

        List<OutboxEvent> downloaded = outboxRepository.findByAggregateId(POST_ID).stream()
                .filter(e -> e.getEventType().equals("instagram.post.downloaded"))
                .toList();
        assertEquals(1, downloaded.size());
    }
}

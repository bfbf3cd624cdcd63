package com.starscape.capture.integration;

import com.starscape.capture.features.instagram.domain.PostId;
import com.starscape.capture.features.instagram.domain.PostMetadata;
import com.starscape.capture.features.instagram.domain.PostRepository;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end capture flow over HTTP.
 * Tests: capture → request download → complete → outbox drain and acknowledge
 */
@ActiveProfiles("test")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class CaptureFlowIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private PostRepository postRepository;

    @BeforeEach
    void setUp() {
        RestAssured.port = port;
        RestAssured.baseURI = "http://localhost";
    }

    @Test
    void shouldCaptureDownloadAndDrainOutbox() {
        String postId = "P" + System.nanoTime();

        // 1. Capture a post
        given()
                .contentType(ContentType.JSON)
                .header("X-Correlation-Id", "flow-" + postId)
                .body(Map.of(
                    "id", postId,
                    "authorId", "user-1",
                    "caption", "Sunset over the bay",
                    "imageUrl", "https://cdn.example.com/p/1.jpg",
                    "hashtags", List.of("sunset")
                ))
                .post("/commands/captures/instagram/posts")
                .then()
                .statusCode(201)
                .body("contentType", equalTo("instagram.post"))
                .body("id", equalTo(postId));

        // 2. Request the download
        given()
                .post("/commands/downloads/instagram.post/{id}/request", postId)
                .then()
                .statusCode(202)
                .body("state", equalTo("DOWNLOAD_REQUESTED"));

        // 3. Report completion
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("localPath", "/downloads/" + postId + ".jpg"))
                .post("/commands/downloads/instagram.post/{id}/complete", postId)
                .then()
                .statusCode(200)
                .body("state", equalTo("DOWNLOADED"))
                .body("localPath", equalTo("/downloads/" + postId + ".jpg"));

        // 4. A replayed completion is rejected
        given()
                .contentType(ContentType.JSON)
                .body(Map.of("localPath", "/downloads/other.jpg"))
                .post("/commands/downloads/instagram.post/{id}/complete", postId)
                .then()
                .statusCode(409)
                .body("code", equalTo("ALREADY_DOWNLOADED"));

        // 5. Drain the outbox
        List<Map<String, Object>> pending = given()
                .queryParam("limit", 1000)
                .get("/queries/outbox")
                .then()
                .statusCode(200)
                .extract()
                .jsonPath()
                .getList("findAll { it.aggregateId == '" + postId + "' }");

        List<Object> eventTypes = pending.stream().map(e -> e.get("eventType")).toList();
        assertEquals(List.of(
                "instagram.post.saved",
                "instagram.post.download.requested",
                "instagram.post.downloaded"), eventTypes);
        assertEquals("flow-" + postId, pending.get(0).get("correlationId"));

        for (Map<String, Object> event : pending) {
            given()
                    .post("/commands/outbox/{eventId}/ack", event.get("eventId"))
                    .then()
                    .statusCode(204);
        }

        List<Object> remaining = given()
                .queryParam("limit", 1000)
                .get("/queries/outbox")
                .then()
                .statusCode(200)
                .extract()
                .jsonPath()
                .getList("findAll { it.aggregateId == '" + postId + "' }");
        assertTrue(remaining.isEmpty());
    }

    @Test
    void shouldRejectInvalidPayloadNamingTheField() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "id", "P" + System.nanoTime(),
                    "authorId", "user-1",
                    "caption", "Clip",
                    "imageUrl", "https://cdn.example.com/p/2.jpg",
                    "isVideo", true
                ))
                .post("/commands/captures/instagram/posts")
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"))
                .body("details.field", equalTo("videoUrl"));
    }

    @Test
    void shouldRejectViewingExpiredStory() {
        String storyId = "S" + System.nanoTime();
        Instant expiresAt = Instant.now().minus(1, ChronoUnit.HOURS);

        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "id", storyId,
                    "authorId", "user-1",
                    "mediaUrl", "https://cdn.example.com/s/1.jpg",
                    "mediaType", "image",
                    "timestamp", expiresAt.minus(24, ChronoUnit.HOURS).toString(),
                    "expiresAt", expiresAt.toString()
                ))
                .post("/commands/captures/instagram/stories")
                .then()
                .statusCode(201);

        given()
                .post("/commands/instagram/stories/{storyId}/view", storyId)
                .then()
                .statusCode(409)
                .body("code", equalTo("EXPIRED_CONTENT"));
    }

    @Test
    void shouldReturnNotFoundForUnknownContent() {
        given()
                .post("/commands/downloads/instagram.post/{id}/request", "missing-" + System.nanoTime())
                .then()
                .statusCode(404)
                .body("code", equalTo("NOT_FOUND"));

        given()
                .post("/commands/downloads/myspace.song/{id}/request", "1")
                .then()
                .statusCode(404);
    }

    @Test
    void shouldSyncBoardToEmptyMembership() {
        String boardId = "B" + System.nanoTime();

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("id", boardId, "name", "Recipes", "ownerId", "owner-1"))
                .post("/commands/captures/pinterest/boards")
                .then()
                .statusCode(201)
                .body("contentType", equalTo("pinterest.board"));

        for (String pinId : List.of("101", "102", "103")) {
            given()
                    .put("/commands/pinterest/boards/{boardId}/pins/{pinId}", boardId, pinId)
                    .then()
                    .statusCode(204);
        }

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("pinIds", List.of()))
                .post("/commands/pinterest/boards/{boardId}/sync", boardId)
                .then()
                .statusCode(204);

        List<Map<String, Object>> events = given()
                .queryParam("limit", 1000)
                .get("/queries/outbox")
                .then()
                .extract()
                .jsonPath()
                .getList("findAll { it.aggregateId == '" + boardId + "' }");
        assertEquals(List.of("pinterest.board.created", "pinterest.board.synced"),
                events.stream().map(e -> e.get("eventType")).toList());
    }

    @Test
    void shouldRequestVideoDownloadAtChosenQuality() {
        String videoId = "dQw4w9WgXcQ";

        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "id", videoId,
                    "title", "Conference keynote",
                    "channelId", "UC_x5XG1OV2P6uZZ5FSM9Ttw",
                    "duration", 245,
                    "quality", "720p"
                ))
                .post("/commands/captures/video/videos")
                .then()
                .statusCode(201)
                .body("contentType", equalTo("video"));

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("quality", "1080p"))
                .post("/commands/video/videos/{videoId}/download", videoId)
                .then()
                .statusCode(202);

        given()
                .get("/queries/downloads/video/{id}", videoId)
                .then()
                .statusCode(200)
                .body("state", anyOf(equalTo("DOWNLOAD_REQUESTED"), equalTo("DOWNLOADED")));
    }

    @Test
    void shouldRejectPartialEngagementRefreshAndKeepCounters() {
        String postId = capturePostWithCounters(10, 4);

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("likesCount", 5))
                .put("/commands/instagram/posts/{postId}/engagement", postId)
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"))
                .body("details.commentsCount", notNullValue());

        PostMetadata unchanged = postRepository.findById(PostId.of(postId)).orElseThrow().getMetadata();
        assertEquals(10, unchanged.likesCount());
        assertEquals(4, unchanged.commentsCount());

        given()
                .contentType(ContentType.JSON)
                .body(Map.of("likesCount", 12, "commentsCount", 6))
                .put("/commands/instagram/posts/{postId}/engagement", postId)
                .then()
                .statusCode(204);

        PostMetadata refreshed = postRepository.findById(PostId.of(postId)).orElseThrow().getMetadata();
        assertEquals(12, refreshed.likesCount());
        assertEquals(6, refreshed.commentsCount());
    }

    @Test
    void shouldNameMissingCaptureFieldInValidationDetails() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "id", "P" + System.nanoTime(),
                    "authorId", "user-1",
                    "caption", "No image"
                ))
                .post("/commands/captures/instagram/posts")
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"))
                .body("details.imageUrl", equalTo("imageUrl is required"));
    }

    @Test
    void shouldNameMistypedCaptureField() {
        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "id", "123" + System.nanoTime(),
                    "title", "Kitchen ideas",
                    "imageUrl", "https://i.example.com/1.jpg",
                    "originalImageUrl", "https://i.example.com/1-orig.jpg",
                    "width", "wide",
                    "height", 600,
                    "creatorId", "creator-1"
                ))
                .post("/commands/captures/pinterest/pins")
                .then()
                .statusCode(400)
                .body("code", equalTo("VALIDATION_ERROR"))
                .body("details.field", equalTo("width"));
    }

    @Test
    void shouldIgnoreUnmodelledPayloadFields() {
        String postId = "P" + System.nanoTime();

        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "id", postId,
                    "authorId", "user-1",
                    "caption", "Extra fields",
                    "imageUrl", "https://cdn.example.com/p/3.jpg",
                    "accessibilityCaption", "Photo of a beach",
                    "sponsorTags", List.of("brand")
                ))
                .post("/commands/captures/instagram/posts")
                .then()
                .statusCode(201)
                .body("id", equalTo(postId));
    }

    private String capturePostWithCounters(long likes, long comments) {
        String postId = "P" + System.nanoTime();
        given()
                .contentType(ContentType.JSON)
                .body(Map.of(
                    "id", postId,
                    "authorId", "user-1",
                    "caption", "Counters",
                    "imageUrl", "https://cdn.example.com/p/4.jpg",
                    "likesCount", likes,
                    "commentsCount", comments
                ))
                .post("/commands/captures/instagram/posts")
                .then()
                .statusCode(201);
        return postId;
    }
}

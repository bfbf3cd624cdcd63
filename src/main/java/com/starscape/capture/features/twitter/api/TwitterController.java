package com.starscape.capture.features.twitter.api;

import com.starscape.capture.common.api.dto.CaptureResponse;
import com.starscape.capture.features.twitter.api.dto.EngagementInsightsResponse;
import com.starscape.capture.features.twitter.api.dto.EngagementMetricsRequest;
import com.starscape.capture.features.twitter.api.dto.EngagementTrackRequest;
import com.starscape.capture.features.twitter.api.dto.InsightRequest;
import com.starscape.capture.features.twitter.api.dto.ReorderTweetsRequest;
import com.starscape.capture.features.twitter.api.dto.TagRequest;
import com.starscape.capture.features.twitter.api.dto.ThreadCaptureRequest;
import com.starscape.capture.features.twitter.api.dto.ThreadMetadataRequest;
import com.starscape.capture.features.twitter.api.dto.TweetCaptureRequest;
import com.starscape.capture.features.twitter.api.dto.TweetEngagementRequest;
import com.starscape.capture.features.twitter.api.dto.UserCaptureRequest;
import com.starscape.capture.features.twitter.api.dto.UserProfileRequest;
import com.starscape.capture.features.twitter.api.dto.UserStatsRequest;
import com.starscape.capture.features.twitter.app.TwitterContentService;
import com.starscape.capture.features.twitter.domain.Engagement;
import com.starscape.capture.features.twitter.domain.TweetCounters;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Capture and lifecycle commands for Twitter content.
 */
@RestController
@RequestMapping("/commands")
public class TwitterController {

    private final TwitterContentService service;

    public TwitterController(TwitterContentService service) {
        this.service = service;
    }

    @PostMapping("/captures/twitter/tweets")
    public ResponseEntity<CaptureResponse> captureTweet(@Valid @RequestBody TweetCaptureRequest request) {
        return created(CaptureResponse.of(service.captureTweet(request)));
    }

    @PostMapping("/captures/twitter/threads")
    public ResponseEntity<CaptureResponse> createThread(@Valid @RequestBody ThreadCaptureRequest request) {
        return created(CaptureResponse.of(service.createThread(request)));
    }

    @PostMapping("/captures/twitter/users")
    public ResponseEntity<CaptureResponse> captureUser(@Valid @RequestBody UserCaptureRequest request) {
        return created(CaptureResponse.of(service.captureUser(request)));
    }

    @PostMapping("/captures/twitter/engagements")
    public ResponseEntity<CaptureResponse> trackEngagement(@Valid @RequestBody EngagementTrackRequest request) {
        return created(CaptureResponse.of(service.trackEngagement(request)));
    }

    @PostMapping("/twitter/tweets/{tweetId}/like")
    public ResponseEntity<Void> likeTweet(@PathVariable String tweetId) {
        service.likeTweet(tweetId);
        return noContent();
    }

    @PostMapping("/twitter/tweets/{tweetId}/retweet")
    public ResponseEntity<Void> retweet(@PathVariable String tweetId) {
        service.retweet(tweetId);
        return noContent();
    }

    @PutMapping("/twitter/tweets/{tweetId}/engagement")
    public ResponseEntity<Void> updateTweetEngagement(
            @PathVariable String tweetId,
            @Valid @RequestBody TweetEngagementRequest request) {
        service.updateTweetEngagement(tweetId, new TweetCounters(
                request.retweets(), request.likes(), request.replies(), request.quotes(), request.views()));
        return noContent();
    }

    @PostMapping("/twitter/tweets/{tweetId}/hashtags")
    public ResponseEntity<Void> addHashtag(@PathVariable String tweetId, @Valid @RequestBody TagRequest request) {
        service.addHashtag(tweetId, request.value());
        return noContent();
    }

    @PostMapping("/twitter/tweets/{tweetId}/mentions")
    public ResponseEntity<Void> addMention(@PathVariable String tweetId, @Valid @RequestBody TagRequest request) {
        service.addMention(tweetId, request.value());
        return noContent();
    }

    @PutMapping("/twitter/threads/{threadId}/tweets/{tweetId}")
    public ResponseEntity<Void> addTweetToThread(@PathVariable String threadId, @PathVariable String tweetId) {
        service.addTweetToThread(threadId, tweetId);
        return noContent();
    }

    @DeleteMapping("/twitter/threads/{threadId}/tweets/{tweetId}")
    public ResponseEntity<Void> removeTweetFromThread(@PathVariable String threadId, @PathVariable String tweetId) {
        service.removeTweetFromThread(threadId, tweetId);
        return noContent();
    }

    /**
     * Reorder the tweets of a thread.
     * PUT /commands/twitter/threads/{threadId}/order
     */
    @PutMapping("/twitter/threads/{threadId}/order")
    public ResponseEntity<Void> reorderThread(
            @PathVariable String threadId,
            @Valid @RequestBody ReorderTweetsRequest request) {
        service.reorderThread(threadId, request.tweetIds());
        return noContent();
    }

    @PostMapping("/twitter/threads/{threadId}/archive")
    public ResponseEntity<Void> archiveThread(@PathVariable String threadId) {
        service.archiveThread(threadId);
        return noContent();
    }

    @DeleteMapping("/twitter/threads/{threadId}/archive")
    public ResponseEntity<Void> unarchiveThread(@PathVariable String threadId) {
        service.unarchiveThread(threadId);
        return noContent();
    }

    @PutMapping("/twitter/threads/{threadId}")
    public ResponseEntity<Void> updateThreadMetadata(
            @PathVariable String threadId,
            @RequestBody ThreadMetadataRequest request) {
        service.updateThreadMetadata(threadId, request.title(), request.description());
        return noContent();
    }

    @PutMapping("/twitter/threads/{threadId}/visibility")
    public ResponseEntity<Void> setThreadVisibility(
            @PathVariable String threadId,
            @RequestParam("private") boolean privateThread) {
        service.setThreadVisibility(threadId, privateThread);
        return noContent();
    }

    @PostMapping("/twitter/users/{userId}/follow")
    public ResponseEntity<Void> followUser(@PathVariable String userId) {
        service.followUser(userId);
        return noContent();
    }

    @DeleteMapping("/twitter/users/{userId}/follow")
    public ResponseEntity<Void> unfollowUser(@PathVariable String userId) {
        service.unfollowUser(userId);
        return noContent();
    }

    @PutMapping("/twitter/users/{userId}/profile")
    public ResponseEntity<Void> updateUserProfile(
            @PathVariable String userId,
            @Valid @RequestBody UserProfileRequest request) {
        service.updateUserProfile(userId, request);
        return noContent();
    }

    @PutMapping("/twitter/users/{userId}/stats")
    public ResponseEntity<Void> updateUserStats(
            @PathVariable String userId,
            @Valid @RequestBody UserStatsRequest request) {
        service.updateUserStats(userId, request);
        return noContent();
    }

    @PostMapping("/twitter/users/{userId}/verify")
    public ResponseEntity<Void> verifyUser(@PathVariable String userId) {
        service.verifyUser(userId);
        return noContent();
    }

    @PutMapping("/twitter/users/{userId}/protection")
    public ResponseEntity<Void> setUserProtection(
            @PathVariable String userId,
            @RequestParam("protected") boolean protectedAccount) {
        service.setUserProtection(userId, protectedAccount);
        return noContent();
    }

    @PutMapping("/twitter/engagements/{tweetId}/metrics")
    public ResponseEntity<Void> updateEngagementMetrics(
            @PathVariable String tweetId,
            @Valid @RequestBody EngagementMetricsRequest request) {
        service.updateEngagementMetrics(tweetId, request);
        return noContent();
    }

    @PostMapping("/twitter/engagements/{tweetId}/analyze")
    public ResponseEntity<EngagementInsightsResponse> analyzeEngagement(@PathVariable String tweetId) {
        Engagement engagement = service.analyzeEngagement(tweetId);
        return ResponseEntity.ok(new EngagementInsightsResponse(
                engagement.getId().value(),
                engagement.getMetrics().engagementRate(),
                engagement.getInsights(),
                engagement.getAnalyzedAt().orElse(null)));
    }

    /**
     * Attach an analyst note to the engagement insights. Dropped by the next analysis.
     * POST /commands/twitter/engagements/{tweetId}/insights
     */
    @PostMapping("/twitter/engagements/{tweetId}/insights")
    public ResponseEntity<Void> addInsight(
            @PathVariable String tweetId,
            @Valid @RequestBody InsightRequest request) {
        service.addEngagementInsight(tweetId, request.insight());
        return noContent();
    }

    @DeleteMapping("/twitter/engagements/{tweetId}/insights")
    public ResponseEntity<Void> removeInsight(
            @PathVariable String tweetId,
            @Valid @RequestBody InsightRequest request) {
        service.removeEngagementInsight(tweetId, request.insight());
        return noContent();
    }

    private static ResponseEntity<CaptureResponse> created(CaptureResponse body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    private static ResponseEntity<Void> noContent() {
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}

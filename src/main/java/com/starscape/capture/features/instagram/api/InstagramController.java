package com.starscape.capture.features.instagram.api;

import com.starscape.capture.common.api.dto.CaptureResponse;
import com.starscape.capture.features.instagram.api.dto.HashtagRequest;
import com.starscape.capture.features.instagram.api.dto.PostCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.PostEngagementRequest;
import com.starscape.capture.features.instagram.api.dto.ReelCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.ReelEngagementRequest;
import com.starscape.capture.features.instagram.api.dto.StoryCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.UserCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.UserProfileRequest;
import com.starscape.capture.features.instagram.api.dto.UserStatsRequest;
import com.starscape.capture.features.instagram.app.InstagramContentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Capture and lifecycle commands for Instagram content.
 */
@RestController
@RequestMapping("/commands")
public class InstagramController {

    private final InstagramContentService service;

    public InstagramController(InstagramContentService service) {
        this.service = service;
    }

    @PostMapping("/captures/instagram/posts")
    public ResponseEntity<CaptureResponse> capturePost(@Valid @RequestBody PostCaptureRequest request) {
        return created(CaptureResponse.of(service.capturePost(request)));
    }

    @PostMapping("/captures/instagram/reels")
    public ResponseEntity<CaptureResponse> captureReel(@Valid @RequestBody ReelCaptureRequest request) {
        return created(CaptureResponse.of(service.captureReel(request)));
    }

    @PostMapping("/captures/instagram/stories")
    public ResponseEntity<CaptureResponse> captureStory(@Valid @RequestBody StoryCaptureRequest request) {
        return created(CaptureResponse.of(service.captureStory(request)));
    }

    @PostMapping("/captures/instagram/users")
    public ResponseEntity<CaptureResponse> captureUser(@Valid @RequestBody UserCaptureRequest request) {
        return created(CaptureResponse.of(service.captureUser(request)));
    }

    @PutMapping("/instagram/posts/{postId}/engagement")
    public ResponseEntity<Void> updatePostEngagement(
            @PathVariable String postId,
            @Valid @RequestBody PostEngagementRequest request) {
        service.updatePostEngagement(postId, request.likesCount(), request.commentsCount());
        return noContent();
    }

    @PutMapping("/instagram/reels/{reelId}/engagement")
    public ResponseEntity<Void> updateReelEngagement(
            @PathVariable String reelId,
            @Valid @RequestBody ReelEngagementRequest request) {
        service.updateReelEngagement(reelId, request.viewsCount(), request.likesCount(), request.commentsCount());
        return noContent();
    }

    @PostMapping("/instagram/reels/{reelId}/share")
    public ResponseEntity<Void> shareReel(@PathVariable String reelId) {
        service.shareReel(reelId);
        return noContent();
    }

    @PostMapping("/instagram/reels/{reelId}/hashtags")
    public ResponseEntity<Void> addReelHashtag(
            @PathVariable String reelId,
            @Valid @RequestBody HashtagRequest request) {
        service.addReelHashtag(reelId, request.hashtag());
        return noContent();
    }

    @DeleteMapping("/instagram/reels/{reelId}/hashtags/{hashtag}")
    public ResponseEntity<Void> removeReelHashtag(@PathVariable String reelId, @PathVariable String hashtag) {
        service.removeReelHashtag(reelId, hashtag);
        return noContent();
    }

    @PostMapping("/instagram/stories/{storyId}/view")
    public ResponseEntity<Void> viewStory(@PathVariable String storyId) {
        service.viewStory(storyId);
        return noContent();
    }

    @PostMapping("/instagram/stories/{storyId}/archive")
    public ResponseEntity<Void> archiveStory(@PathVariable String storyId) {
        service.archiveStory(storyId);
        return noContent();
    }

    @PostMapping("/instagram/stories/{storyId}/highlight")
    public ResponseEntity<Void> highlightStory(@PathVariable String storyId) {
        service.highlightStory(storyId, true);
        return noContent();
    }

    @DeleteMapping("/instagram/stories/{storyId}/highlight")
    public ResponseEntity<Void> removeStoryHighlight(@PathVariable String storyId) {
        service.highlightStory(storyId, false);
        return noContent();
    }

    @PostMapping("/instagram/users/{userId}/follow")
    public ResponseEntity<Void> followUser(@PathVariable String userId) {
        service.followUser(userId);
        return noContent();
    }

    @DeleteMapping("/instagram/users/{userId}/follow")
    public ResponseEntity<Void> unfollowUser(@PathVariable String userId) {
        service.unfollowUser(userId);
        return noContent();
    }

    @PutMapping("/instagram/users/{userId}/profile")
    public ResponseEntity<Void> updateUserProfile(
            @PathVariable String userId,
            @Valid @RequestBody UserProfileRequest request) {
        service.updateUserProfile(userId, request);
        return noContent();
    }

    @PutMapping("/instagram/users/{userId}/stats")
    public ResponseEntity<Void> updateUserStats(
            @PathVariable String userId,
            @Valid @RequestBody UserStatsRequest request) {
        service.updateUserStats(userId, request);
        return noContent();
    }

    @PostMapping("/instagram/users/{userId}/verify")
    public ResponseEntity<Void> verifyUser(@PathVariable String userId) {
        service.verifyUser(userId);
        return noContent();
    }

    @PutMapping("/instagram/users/{userId}/visibility")
    public ResponseEntity<Void> setUserVisibility(
            @PathVariable String userId,
            @RequestParam("private") boolean privateAccount) {
        service.setUserVisibility(userId, privateAccount);
        return noContent();
    }

    private static ResponseEntity<CaptureResponse> created(CaptureResponse body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    private static ResponseEntity<Void> noContent() {
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}

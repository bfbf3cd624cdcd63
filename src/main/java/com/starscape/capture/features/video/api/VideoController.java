package com.starscape.capture.features.video.api;

import com.starscape.capture.common.api.dto.CaptureResponse;
import com.starscape.capture.features.video.api.dto.PlaylistCaptureRequest;
import com.starscape.capture.features.video.api.dto.PlaylistDetailsRequest;
import com.starscape.capture.features.video.api.dto.SyncVideosRequest;
import com.starscape.capture.features.video.api.dto.VideoCaptureRequest;
import com.starscape.capture.features.video.api.dto.VideoDownloadRequest;
import com.starscape.capture.features.video.api.dto.VideoEngagementRequest;
import com.starscape.capture.features.video.app.VideoContentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class VideoController {

    private final VideoContentService service;

    public VideoController(VideoContentService service) {
        this.service = service;
    }

    @PostMapping("/captures/video/videos")
    public ResponseEntity<CaptureResponse> captureVideo(@Valid @RequestBody VideoCaptureRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(CaptureResponse.of(service.captureVideo(request)));
    }

    @PostMapping("/captures/video/playlists")
    public ResponseEntity<CaptureResponse> createPlaylist(@Valid @RequestBody PlaylistCaptureRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(CaptureResponse.of(service.createPlaylist(request)));
    }

    /**
     * Request a download at an explicit quality.
     * POST /commands/video/videos/{videoId}/download
     */
    @PostMapping("/video/videos/{videoId}/download")
    public ResponseEntity<Void> requestDownload(
            @PathVariable String videoId,
            @Valid @RequestBody VideoDownloadRequest request) {
        service.requestVideoDownload(videoId, request.quality());
        return ResponseEntity.accepted().build();
    }

    @PutMapping("/video/videos/{videoId}/engagement")
    public ResponseEntity<Void> updateEngagement(
            @PathVariable String videoId,
            @Valid @RequestBody VideoEngagementRequest request) {
        service.updateVideoEngagement(videoId, request.viewCount(), request.likeCount());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/video/playlists/{playlistId}/videos/{videoId}")
    public ResponseEntity<Void> addVideo(@PathVariable String playlistId, @PathVariable String videoId) {
        service.addVideoToPlaylist(playlistId, videoId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/video/playlists/{playlistId}/videos/{videoId}")
    public ResponseEntity<Void> removeVideo(@PathVariable String playlistId, @PathVariable String videoId) {
        service.removeVideoFromPlaylist(playlistId, videoId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Replace the playlist's videos with the given list.
     * POST /commands/video/playlists/{playlistId}/sync
     */
    @PostMapping("/video/playlists/{playlistId}/sync")
    public ResponseEntity<Void> syncPlaylist(
            @PathVariable String playlistId,
            @Valid @RequestBody SyncVideosRequest request) {
        service.syncPlaylist(playlistId, request.videoIds());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/video/playlists/{playlistId}")
    public ResponseEntity<Void> updateDetails(
            @PathVariable String playlistId,
            @Valid @RequestBody PlaylistDetailsRequest request) {
        service.updatePlaylistDetails(playlistId, request.title(), request.description());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/video/playlists/{playlistId}/visibility")
    public ResponseEntity<Void> setVisibility(
            @PathVariable String playlistId,
            @RequestParam("public") boolean publicPlaylist) {
        service.setPlaylistVisibility(playlistId, publicPlaylist);
        return ResponseEntity.noContent().build();
    }
}

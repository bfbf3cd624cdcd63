package com.starscape.capture.features.video.app;

import com.starscape.capture.common.app.AggregateCommandExecutor;
import com.starscape.capture.features.video.api.dto.PlaylistCaptureRequest;
import com.starscape.capture.features.video.api.dto.VideoCaptureRequest;
import com.starscape.capture.features.video.domain.ChannelId;
import com.starscape.capture.features.video.domain.Playlist;
import com.starscape.capture.features.video.domain.PlaylistId;
import com.starscape.capture.features.video.domain.PlaylistRepository;
import com.starscape.capture.features.video.domain.Video;
import com.starscape.capture.features.video.domain.VideoId;
import com.starscape.capture.features.video.domain.VideoMetadata;
import com.starscape.capture.features.video.domain.VideoQuality;
import com.starscape.capture.features.video.domain.VideoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNullElse;

@Service
public class VideoContentService {

    private static final Logger log = LoggerFactory.getLogger(VideoContentService.class);

    private final VideoRepository videoRepository;
    private final PlaylistRepository playlistRepository;
    private final AggregateCommandExecutor executor;

    public VideoContentService(
            VideoRepository videoRepository,
            PlaylistRepository playlistRepository,
            AggregateCommandExecutor executor) {
        this.videoRepository = videoRepository;
        this.playlistRepository = playlistRepository;
        this.executor = executor;
    }

    /**
     * Captures a video. {@code quality} may be a label such as {@code 720p} and defaults to HIGH.
     */
    public Video captureVideo(VideoCaptureRequest request) {
        VideoId id = VideoId.of(request.id());
        VideoMetadata metadata = new VideoMetadata(
            request.title(),
            request.description(),
            requireNonNullElse(request.duration(), 0L),
            requireNonNullElse(request.publishedAt(), Instant.now()),
            ChannelId.of(request.channelId()),
            request.channelTitle(),
            request.thumbnailUrl(),
            requireNonNullElse(request.viewCount(), 0L),
            requireNonNullElse(request.likeCount(), 0L),
            request.tags()
        );
        VideoQuality quality = request.quality() != null ? VideoQuality.fromValue(request.quality()) : VideoQuality.HIGH;
        return executor.create(videoRepository, id, () -> Video.capture(id, metadata, quality));
    }

    public Playlist createPlaylist(PlaylistCaptureRequest request) {
        PlaylistId id = PlaylistId.of(request.id());
        ChannelId channelId = ChannelId.of(request.channelId());
        boolean publicPlaylist = requireNonNullElse(request.publicPlaylist(), true);
        return executor.create(playlistRepository, id,
                () -> Playlist.create(id, request.title(), request.description(), channelId, publicPlaylist));
    }

    /**
     * Requests a download at a specific quality, bypassing the generic download endpoint
     * which always uses the quality chosen at capture.
     */
    public Video requestVideoDownload(String videoId, String quality) {
        VideoQuality requested = VideoQuality.fromValue(quality);
        log.info("Requesting download of video {} at {}", videoId, requested.getLabel());
        return executor.update(videoRepository, VideoId.of(videoId), video -> video.requestDownload(requested));
    }

    public Video updateVideoEngagement(String videoId, long viewCount, long likeCount) {
        return executor.update(videoRepository, VideoId.of(videoId),
                video -> video.updateEngagement(viewCount, likeCount));
    }

    public Playlist addVideoToPlaylist(String playlistId, String videoId) {
        return executor.update(playlistRepository, PlaylistId.of(playlistId),
                playlist -> playlist.addVideo(VideoId.of(videoId)));
    }

    public Playlist removeVideoFromPlaylist(String playlistId, String videoId) {
        return executor.update(playlistRepository, PlaylistId.of(playlistId),
                playlist -> playlist.removeVideo(VideoId.of(videoId)));
    }

    public Playlist syncPlaylist(String playlistId, List<String> videoIds) {
        List<VideoId> ids = videoIds == null ? null : videoIds.stream().map(VideoId::of).toList();
        return executor.update(playlistRepository, PlaylistId.of(playlistId), playlist -> playlist.syncVideos(ids));
    }

    public Playlist updatePlaylistDetails(String playlistId, String title, String description) {
        return executor.update(playlistRepository, PlaylistId.of(playlistId),
                playlist -> playlist.updateDetails(title, description));
    }

    public Playlist setPlaylistVisibility(String playlistId, boolean publicPlaylist) {
        return executor.update(playlistRepository, PlaylistId.of(playlistId),
                playlist -> {
                    if (publicPlaylist) {
                        playlist.makePublic();
                    } else {
                        playlist.makePrivate();
                    }
                });
    }
}

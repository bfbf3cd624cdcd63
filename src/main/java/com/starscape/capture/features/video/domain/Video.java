package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Downloadable;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.DownloadLifecycle;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.features.video.domain.events.VideoCaptured;
import com.starscape.capture.features.video.domain.events.VideoDownloadCompleted;
import com.starscape.capture.features.video.domain.events.VideoDownloadRequested;

import java.time.Instant;
import java.util.Optional;

/**
 * Captured video. The requested quality is remembered so the completion event reports
 * the quality that was actually fetched.
 */
public class Video extends AggregateRoot<VideoId> implements Downloadable {

    public static final String AGGREGATE_TYPE = "video";

    private final VideoId id;
    private VideoMetadata metadata;
    private VideoQuality quality;
    private final Instant capturedAt;
    private final DownloadLifecycle download;

    private Video(VideoId id, VideoMetadata metadata, VideoQuality quality, Instant capturedAt,
                  DownloadLifecycle download) {
        this.id = Guard.requireNonNull("videoId", id);
        this.metadata = Guard.requireNonNull("metadata", metadata);
        this.quality = Guard.requireNonNull("quality", quality);
        this.capturedAt = capturedAt;
        this.download = download;
    }

    public static Video capture(VideoId id, VideoMetadata metadata, VideoQuality quality) {
        Video video = new Video(id, metadata, quality, Instant.now(), DownloadLifecycle.captured());
        video.record(new VideoCaptured(id.value(), metadata, quality, video.capturedAt));
        return video;
    }

    public static Video fromSnapshot(Snapshot snapshot) {
        return new Video(
            VideoId.of(snapshot.id()),
            snapshot.metadata(),
            snapshot.quality(),
            snapshot.capturedAt(),
            DownloadLifecycle.restore(snapshot.downloadRequestedAt(), snapshot.localPath(), snapshot.downloadedAt())
        );
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), metadata, quality, capturedAt,
                download.lastRequestedAt().orElse(null),
                download.localPath().orElse(null),
                download.downloadedAt().orElse(null));
    }

    @Override
    public void requestDownload() {
        requestDownload(quality);
    }

    public void requestDownload(VideoQuality requestedQuality) {
        Guard.requireNonNull("quality", requestedQuality);
        Instant requestedAt = download.requestDownload("Video " + id.value());
        this.quality = requestedQuality;
        record(new VideoDownloadRequested(id.value(), metadata.title(), requestedQuality, requestedAt));
    }

    @Override
    public void markAsDownloaded(String localPath) {
        Instant downloadedAt = download.markDownloaded("Video " + id.value(), localPath);
        record(new VideoDownloadCompleted(id.value(), localPath, quality, downloadedAt));
    }

    public void updateEngagement(long viewCount, long likeCount) {
        this.metadata = metadata.withEngagement(viewCount, likeCount);
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public VideoId getId() {
        return id;
    }

    // Getters
    public VideoMetadata getMetadata() { return metadata; }
    public VideoQuality getQuality() { return quality; }
    public Instant getCapturedAt() { return capturedAt; }

    @Override
    public boolean isDownloaded() { return download.isDownloaded(); }

    @Override
    public DownloadState getDownloadState() { return download.state(); }

    @Override
    public Optional<String> getLocalPath() { return download.localPath(); }

    @Override
    public Optional<Instant> getDownloadedAt() { return download.downloadedAt(); }

    public record Snapshot(
        String id,
        VideoMetadata metadata,
        VideoQuality quality,
        Instant capturedAt,
        Instant downloadRequestedAt,
        String localPath,
        Instant downloadedAt
    ) {
    }
}

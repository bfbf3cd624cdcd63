package com.starscape.capture.features.video.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.video.domain.Video;
import com.starscape.capture.features.video.domain.VideoQuality;

import java.time.Instant;
import java.util.Objects;

public record VideoDownloadCompleted(
    String videoId,
    String localPath,
    VideoQuality quality,
    Instant downloadedAt
) implements DomainEvent {

    public static final String TYPE = "video.download.completed";

    public VideoDownloadCompleted {
        Objects.requireNonNull(videoId, "videoId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Video.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return videoId;
    }

    @Override
    public Instant getOccurredOn() {
        return downloadedAt;
    }
}

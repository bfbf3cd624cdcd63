package com.starscape.capture.features.video.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.video.domain.Video;
import com.starscape.capture.features.video.domain.VideoQuality;

import java.time.Instant;
import java.util.Objects;

/**
 * Asks the download consumer to fetch the video at the given quality.
 */
public record VideoDownloadRequested(
    String videoId,
    String title,
    VideoQuality quality,
    Instant requestedAt
) implements DomainEvent {

    public static final String TYPE = "video.download.requested";

    public VideoDownloadRequested {
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
        return requestedAt;
    }
}

package com.starscape.capture.features.video.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.video.domain.Video;
import com.starscape.capture.features.video.domain.VideoMetadata;
import com.starscape.capture.features.video.domain.VideoQuality;

import java.time.Instant;
import java.util.Objects;

public record VideoCaptured(
    String videoId,
    VideoMetadata metadata,
    VideoQuality quality,
    Instant capturedAt
) implements DomainEvent {

    public static final String TYPE = "video.captured";

    public VideoCaptured {
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
        return capturedAt;
    }
}

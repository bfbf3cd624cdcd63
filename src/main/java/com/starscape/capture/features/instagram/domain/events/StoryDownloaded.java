package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.Story;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal event of the story download lifecycle.
 */
public record StoryDownloaded(
    String storyId,
    String authorId,
    String localPath,
    Instant downloadedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.story.downloaded";

    public StoryDownloaded {
        Objects.requireNonNull(storyId, "storyId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Story.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return storyId;
    }

    @Override
    public Instant getOccurredOn() {
        return downloadedAt;
    }
}

package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.Post;

import java.time.Instant;
import java.util.Objects;

public record PostDownloaded(
    String postId,
    String authorId,
    String localPath,
    Instant downloadedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.post.downloaded";

    public PostDownloaded {
        Objects.requireNonNull(postId, "postId");
    }

    @Override
    public String getEventType() {
        return TYPE;
    }

    @Override
    public String getAggregateType() {
        return Post.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return postId;
    }

    @Override
    public Instant getOccurredOn() {
        return downloadedAt;
    }
}

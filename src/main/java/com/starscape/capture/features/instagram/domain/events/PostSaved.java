package com.starscape.capture.features.instagram.domain.events;

import com.starscape.capture.common.domain.DomainEvent;
import com.starscape.capture.features.instagram.domain.Post;
import com.starscape.capture.features.instagram.domain.PostMetadata;

import java.time.Instant;
import java.util.Objects;

/**
 * Domain event published when a post is captured from a page.
 * Carries the full metadata bundle seen at capture time.
 */
public record PostSaved(
    String postId,
    String authorId,
    PostMetadata metadata,
    Instant savedAt
) implements DomainEvent {

    public static final String TYPE = "instagram.post.saved";

    public PostSaved {
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
        return savedAt;
    }
}

package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Downloadable;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.DownloadLifecycle;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.common.domain.lifecycle.Expiry;
import com.starscape.capture.common.exception.ExpiredContentException;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.instagram.domain.events.StoryArchived;
import com.starscape.capture.features.instagram.domain.events.StoryCaptured;
import com.starscape.capture.features.instagram.domain.events.StoryDownloadRequested;
import com.starscape.capture.features.instagram.domain.events.StoryDownloaded;
import com.starscape.capture.features.instagram.domain.events.StoryViewed;

import java.time.Instant;
import java.util.Optional;

/**
 * Ephemeral story. Expiry is evaluated against the clock on every call, never cached.
 * Viewing is rejected once the story has expired; downloading and archiving are not.
 */
public class Story extends AggregateRoot<StoryId> implements Downloadable {

    public static final String AGGREGATE_TYPE = "instagram.story";

    private final StoryId id;
    private final UserId authorId;
    private final StoryAttributes attributes;
    private final Instant capturedAt;
    private final DownloadLifecycle download;
    private Instant viewedAt;
    private Instant archivedAt;
    private Instant highlightedAt;

    private Story(StoryId id, UserId authorId, StoryAttributes attributes, Instant capturedAt,
                  DownloadLifecycle download) {
        this.id = Guard.requireNonNull("storyId", id);
        this.authorId = Guard.requireNonNull("authorId", authorId);
        this.attributes = Guard.requireNonNull("attributes", attributes);
        this.capturedAt = capturedAt;
        this.download = download;
    }

    public static Story capture(StoryId id, UserId authorId, StoryAttributes attributes) {
        Story story = new Story(id, authorId, attributes, Instant.now(), DownloadLifecycle.captured());
        story.record(new StoryCaptured(id.value(), authorId.value(), attributes.mediaUrl(),
                attributes.mediaType(), attributes.expiresAt(), story.capturedAt));
        return story;
    }

    public static Story fromSnapshot(Snapshot snapshot) {
        Story story = new Story(
            StoryId.of(snapshot.id()),
            UserId.of(snapshot.authorId()),
            snapshot.attributes(),
            snapshot.capturedAt(),
            DownloadLifecycle.restore(snapshot.downloadRequestedAt(), snapshot.localPath(), snapshot.downloadedAt())
        );
        story.viewedAt = snapshot.viewedAt();
        story.archivedAt = snapshot.archivedAt();
        story.highlightedAt = snapshot.highlightedAt();
        return story;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), authorId.value(), attributes, capturedAt,
                download.lastRequestedAt().orElse(null),
                download.localPath().orElse(null),
                download.downloadedAt().orElse(null),
                viewedAt, archivedAt, highlightedAt);
    }

    public void markAsViewed() {
        if (isExpired()) {
            throw new ExpiredContentException("Cannot view expired story " + id.value());
        }
        this.viewedAt = Instant.now();
        record(new StoryViewed(id.value(), authorId.value(), viewedAt));
    }

    public void archive() {
        if (isArchived()) {
            throw new InvalidStateException("ALREADY_ARCHIVED", "Story " + id.value() + " is already archived");
        }
        this.archivedAt = Instant.now();
        record(new StoryArchived(id.value(), authorId.value(), archivedAt));
    }

    public void highlight() {
        if (highlightedAt == null) {
            this.highlightedAt = Instant.now();
        }
    }

    public void removeHighlight() {
        this.highlightedAt = null;
    }

    @Override
    public void requestDownload() {
        Instant requestedAt = download.requestDownload("Story " + id.value());
        record(new StoryDownloadRequested(id.value(), authorId.value(), attributes.mediaUrl(), requestedAt));
    }

    @Override
    public void markAsDownloaded(String localPath) {
        Instant downloadedAt = download.markDownloaded("Story " + id.value(), localPath);
        record(new StoryDownloaded(id.value(), authorId.value(), localPath, downloadedAt));
    }

    public boolean isExpired() {
        return Expiry.at(attributes.expiresAt()).isExpired();
    }

    public boolean isArchived() {
        return archivedAt != null;
    }

    public boolean isHighlighted() {
        return highlightedAt != null;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public StoryId getId() {
        return id;
    }

    // Getters
    public UserId getAuthorId() { return authorId; }
    public StoryAttributes getAttributes() { return attributes; }
    public Instant getCapturedAt() { return capturedAt; }
    public Optional<Instant> getViewedAt() { return Optional.ofNullable(viewedAt); }
    public Optional<Instant> getArchivedAt() { return Optional.ofNullable(archivedAt); }

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
        String authorId,
        StoryAttributes attributes,
        Instant capturedAt,
        Instant downloadRequestedAt,
        String localPath,
        Instant downloadedAt,
        Instant viewedAt,
        Instant archivedAt,
        Instant highlightedAt
    ) {
    }
}

package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Downloadable;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.DownloadLifecycle;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.features.instagram.domain.events.PostDownloadRequested;
import com.starscape.capture.features.instagram.domain.events.PostDownloaded;
import com.starscape.capture.features.instagram.domain.events.PostSaved;

import java.time.Instant;
import java.util.Optional;

public class Post extends AggregateRoot<PostId> implements Downloadable {

    public static final String AGGREGATE_TYPE = "instagram.post";

    private final PostId id;
    private final UserId authorId;
    private PostMetadata metadata;
    private final Instant savedAt;
    private final DownloadLifecycle download;

    private Post(PostId id, UserId authorId, PostMetadata metadata, Instant savedAt, DownloadLifecycle download) {
        this.id = Guard.requireNonNull("postId", id);
        this.authorId = Guard.requireNonNull("authorId", authorId);
        this.metadata = Guard.requireNonNull("metadata", metadata);
        this.savedAt = savedAt;
        this.download = download;
    }

    public static Post capture(PostId id, UserId authorId, PostMetadata metadata) {
        Post post = new Post(id, authorId, metadata, Instant.now(), DownloadLifecycle.captured());
        post.record(new PostSaved(id.value(), authorId.value(), metadata, post.savedAt));
        return post;
    }

    public static Post fromSnapshot(Snapshot snapshot) {
        return new Post(
            PostId.of(snapshot.id()),
            UserId.of(snapshot.authorId()),
            snapshot.metadata(),
            snapshot.savedAt(),
            DownloadLifecycle.restore(snapshot.downloadRequestedAt(), snapshot.localPath(), snapshot.downloadedAt())
        );
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), authorId.value(), metadata, savedAt,
                download.lastRequestedAt().orElse(null),
                download.localPath().orElse(null),
                download.downloadedAt().orElse(null));
    }

    @Override
    public void requestDownload() {
        Instant requestedAt = download.requestDownload("Post " + id.value());
        record(new PostDownloadRequested(id.value(), authorId.value(), metadata.mediaUrl(), requestedAt));
    }

    @Override
    public void markAsDownloaded(String localPath) {
        Instant downloadedAt = download.markDownloaded("Post " + id.value(), localPath);
        record(new PostDownloaded(id.value(), authorId.value(), localPath, downloadedAt));
    }

    /**
     * Overwrites the counters with the latest values seen on the page. Records no event.
     */
    public void updateEngagement(long likesCount, long commentsCount) {
        this.metadata = metadata.withEngagement(likesCount, commentsCount);
    }

    public void updateMetadata(PostMetadata metadata) {
        this.metadata = Guard.requireNonNull("metadata", metadata);
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public PostId getId() {
        return id;
    }

    // Getters
    public UserId getAuthorId() { return authorId; }
    public PostMetadata getMetadata() { return metadata; }
    public Instant getSavedAt() { return savedAt; }

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
        PostMetadata metadata,
        Instant savedAt,
        Instant downloadRequestedAt,
        String localPath,
        Instant downloadedAt
    ) {
    }
}

package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Downloadable;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.DownloadLifecycle;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.features.instagram.domain.events.ReelDownloadRequested;
import com.starscape.capture.features.instagram.domain.events.ReelDownloaded;
import com.starscape.capture.features.instagram.domain.events.ReelSaved;
import com.starscape.capture.features.instagram.domain.events.ReelShared;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class Reel extends AggregateRoot<ReelId> implements Downloadable {

    public static final String AGGREGATE_TYPE = "instagram.reel";

    private final ReelId id;
    private final UserId authorId;
    private ReelAttributes attributes;
    private final Instant savedAt;
    private final DownloadLifecycle download;

    private Reel(ReelId id, UserId authorId, ReelAttributes attributes, Instant savedAt, DownloadLifecycle download) {
        this.id = Guard.requireNonNull("reelId", id);
        this.authorId = Guard.requireNonNull("authorId", authorId);
        this.attributes = Guard.requireNonNull("attributes", attributes);
        this.savedAt = savedAt;
        this.download = download;
    }

    public static Reel capture(ReelId id, UserId authorId, ReelAttributes attributes) {
        Reel reel = new Reel(id, authorId, attributes, Instant.now(), DownloadLifecycle.captured());
        reel.record(new ReelSaved(id.value(), authorId.value(), attributes, reel.savedAt));
        return reel;
    }

    public static Reel fromSnapshot(Snapshot snapshot) {
        return new Reel(
            ReelId.of(snapshot.id()),
            UserId.of(snapshot.authorId()),
            snapshot.attributes(),
            snapshot.savedAt(),
            DownloadLifecycle.restore(snapshot.downloadRequestedAt(), snapshot.localPath(), snapshot.downloadedAt())
        );
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), authorId.value(), attributes, savedAt,
                download.lastRequestedAt().orElse(null),
                download.localPath().orElse(null),
                download.downloadedAt().orElse(null));
    }

    @Override
    public void requestDownload() {
        Instant requestedAt = download.requestDownload("Reel " + id.value());
        record(new ReelDownloadRequested(id.value(), authorId.value(), attributes.videoUrl(), requestedAt));
    }

    @Override
    public void markAsDownloaded(String localPath) {
        Instant downloadedAt = download.markDownloaded("Reel " + id.value(), localPath);
        record(new ReelDownloaded(id.value(), authorId.value(), localPath, downloadedAt));
    }

    public void share() {
        this.attributes = attributes.withShares(attributes.sharesCount() + 1);
        record(new ReelShared(id.value(), authorId.value(), attributes.sharesCount(), Instant.now()));
    }

    public void updateEngagement(long viewsCount, long likesCount, long commentsCount) {
        this.attributes = attributes.withEngagement(viewsCount, likesCount, commentsCount);
    }

    public void addHashtag(String hashtag) {
        Guard.requireNonBlank("hashtag", hashtag);
        if (attributes.hashtags().contains(hashtag)) {
            return;
        }
        List<String> hashtags = new ArrayList<>(attributes.hashtags());
        hashtags.add(hashtag);
        this.attributes = attributes.withHashtags(hashtags);
    }

    public void removeHashtag(String hashtag) {
        if (!attributes.hashtags().contains(hashtag)) {
            return;
        }
        List<String> hashtags = new ArrayList<>(attributes.hashtags());
        hashtags.remove(hashtag);
        this.attributes = attributes.withHashtags(hashtags);
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public ReelId getId() {
        return id;
    }

    // Getters
    public UserId getAuthorId() { return authorId; }
    public ReelAttributes getAttributes() { return attributes; }
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
        ReelAttributes attributes,
        Instant savedAt,
        Instant downloadRequestedAt,
        String localPath,
        Instant downloadedAt
    ) {
    }
}

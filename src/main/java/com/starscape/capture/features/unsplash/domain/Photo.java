package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Downloadable;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.DownloadLifecycle;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.features.unsplash.domain.events.PhotoCaptured;
import com.starscape.capture.features.unsplash.domain.events.PhotoDownloadRequested;
import com.starscape.capture.features.unsplash.domain.events.PhotoDownloaded;
import com.starscape.capture.features.unsplash.domain.events.PhotoLiked;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class Photo extends AggregateRoot<PhotoId> implements Downloadable {

    public static final String AGGREGATE_TYPE = "unsplash.photo";

    private final PhotoId id;
    private final ArtistId artistId;
    private PhotoAttributes attributes;
    private final Instant capturedAt;
    private final DownloadLifecycle download;
    private Instant likedAt;

    private Photo(PhotoId id, ArtistId artistId, PhotoAttributes attributes, Instant capturedAt,
                  DownloadLifecycle download) {
        this.id = Guard.requireNonNull("photoId", id);
        this.artistId = Guard.requireNonNull("artistId", artistId);
        this.attributes = Guard.requireNonNull("attributes", attributes);
        this.capturedAt = capturedAt;
        this.download = download;
    }

    public static Photo capture(PhotoId id, ArtistId artistId, PhotoAttributes attributes) {
        Photo photo = new Photo(id, artistId, attributes, Instant.now(), DownloadLifecycle.captured());
        photo.record(new PhotoCaptured(id.value(), artistId.value(), attributes, photo.capturedAt));
        return photo;
    }

    public static Photo fromSnapshot(Snapshot snapshot) {
        Photo photo = new Photo(
            PhotoId.of(snapshot.id()),
            ArtistId.of(snapshot.artistId()),
            snapshot.attributes(),
            snapshot.capturedAt(),
            DownloadLifecycle.restore(snapshot.downloadRequestedAt(), snapshot.localPath(), snapshot.downloadedAt())
        );
        photo.likedAt = snapshot.likedAt();
        return photo;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), artistId.value(), attributes, capturedAt,
                download.lastRequestedAt().orElse(null),
                download.localPath().orElse(null),
                download.downloadedAt().orElse(null),
                likedAt);
    }

    @Override
    public void requestDownload() {
        Instant requestedAt = download.requestDownload("Photo " + id.value());
        record(new PhotoDownloadRequested(id.value(), artistId.value(), attributes.downloadUrl(), requestedAt));
    }

    @Override
    public void markAsDownloaded(String localPath) {
        Instant downloadedAt = download.markDownloaded("Photo " + id.value(), localPath);
        record(new PhotoDownloaded(id.value(), artistId.value(), localPath, downloadedAt));
    }

    public void like() {
        if (isLiked()) {
            throw new AlreadyExistsException("ALREADY_LIKED", "Photo " + id.value() + " is already liked");
        }
        this.likedAt = Instant.now();
        this.attributes = attributes.withEngagement(attributes.likes() + 1, attributes.downloads());
        record(new PhotoLiked(id.value(), artistId.value(), likedAt));
    }

    public void updateEngagement(long likes, long downloads) {
        this.attributes = attributes.withEngagement(likes, downloads);
    }

    public void addTag(String tag) {
        Guard.requireNonBlank("tag", tag);
        if (!attributes.tags().contains(tag)) {
            List<String> tags = new ArrayList<>(attributes.tags());
            tags.add(tag);
            this.attributes = attributes.withTags(tags);
        }
    }

    public void removeTag(String tag) {
        if (attributes.tags().contains(tag)) {
            List<String> tags = new ArrayList<>(attributes.tags());
            tags.remove(tag);
            this.attributes = attributes.withTags(tags);
        }
    }

    public boolean isLiked() {
        return likedAt != null;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public PhotoId getId() {
        return id;
    }

    // Getters
    public ArtistId getArtistId() { return artistId; }
    public PhotoAttributes getAttributes() { return attributes; }
    public Instant getCapturedAt() { return capturedAt; }
    public Optional<Instant> getLikedAt() { return Optional.ofNullable(likedAt); }

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
        String artistId,
        PhotoAttributes attributes,
        Instant capturedAt,
        Instant downloadRequestedAt,
        String localPath,
        Instant downloadedAt,
        Instant likedAt
    ) {
    }
}

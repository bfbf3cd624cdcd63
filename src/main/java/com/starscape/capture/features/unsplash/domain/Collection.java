package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.MembershipSet;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.unsplash.domain.events.CollectionCreated;
import com.starscape.capture.features.unsplash.domain.events.CollectionSynced;
import com.starscape.capture.features.unsplash.domain.events.PhotoAddedToCollection;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Curated set of photos. The cover photo, when set, is always a member.
 */
public class Collection extends AggregateRoot<CollectionId> {

    public static final String AGGREGATE_TYPE = "unsplash.collection";

    private final CollectionId id;
    private final ArtistId curatorId;
    private String title;
    private String description;
    private List<String> tags;
    private boolean privateCollection;
    private PhotoId coverPhotoId;
    private final Instant createdAt;
    private Instant updatedAt;
    private Instant syncedAt;
    private final MembershipSet<PhotoId> photos;

    private Collection(CollectionId id, ArtistId curatorId, String title, String description, List<String> tags,
                       boolean privateCollection, Instant createdAt, Instant updatedAt, MembershipSet<PhotoId> photos) {
        this.id = Guard.requireNonNull("collectionId", id);
        this.curatorId = Guard.requireNonNull("curatorId", curatorId);
        this.title = Guard.requireNonBlank("title", title);
        this.description = description;
        this.tags = Guard.copyOf("tags", tags);
        this.privateCollection = privateCollection;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.photos = photos;
    }

    public static Collection create(CollectionId id, ArtistId curatorId, String title, String description,
                                    List<String> tags, boolean privateCollection) {
        Instant now = Instant.now();
        Collection collection = new Collection(id, curatorId, title, description, tags, privateCollection, now, now,
                MembershipSet.empty("photo"));
        collection.record(new CollectionCreated(id.value(), curatorId.value(), title, privateCollection, now));
        return collection;
    }

    public static Collection fromSnapshot(Snapshot snapshot) {
        Collection collection = new Collection(
            CollectionId.of(snapshot.id()),
            ArtistId.of(snapshot.curatorId()),
            snapshot.title(),
            snapshot.description(),
            snapshot.tags(),
            snapshot.privateCollection(),
            snapshot.createdAt(),
            snapshot.updatedAt(),
            MembershipSet.of("photo", snapshot.photoIds().stream().map(PhotoId::of).toList())
        );
        collection.coverPhotoId = snapshot.coverPhotoId() != null ? PhotoId.of(snapshot.coverPhotoId()) : null;
        collection.syncedAt = snapshot.syncedAt();
        return collection;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), curatorId.value(), title, description, tags, privateCollection,
                coverPhotoId != null ? coverPhotoId.value() : null, createdAt, updatedAt, syncedAt, photoIdValues());
    }

    /**
     * Adding a photo that is already a member is a silent no-op.
     */
    public void addPhoto(PhotoId photoId) {
        if (!photos.add(photoId)) {
            return;
        }
        this.updatedAt = Instant.now();
        record(new PhotoAddedToCollection(id.value(), photoId.value(), curatorId.value(), updatedAt));
    }

    public void removePhoto(PhotoId photoId) {
        photos.remove(photoId);
        if (photoId.equals(coverPhotoId)) {
            this.coverPhotoId = null;
        }
        this.updatedAt = Instant.now();
    }

    public void setCoverPhoto(PhotoId photoId) {
        Guard.requireNonNull("photoId", photoId);
        if (!photos.contains(photoId)) {
            throw new InvalidStateException("COVER_NOT_MEMBER",
                    "Photo " + photoId.value() + " must be in collection " + id.value() + " to set as cover");
        }
        this.coverPhotoId = photoId;
        this.updatedAt = Instant.now();
    }

    /**
     * Replaces the whole membership. A cover photo that is no longer a member is cleared.
     */
    public void syncPhotos(List<PhotoId> photoIds) {
        photos.replaceAll(photoIds);
        if (coverPhotoId != null && !photos.contains(coverPhotoId)) {
            this.coverPhotoId = null;
        }
        this.syncedAt = Instant.now();
        this.updatedAt = syncedAt;
        record(new CollectionSynced(id.value(), curatorId.value(), photoIdValues(), syncedAt));
    }

    public void updateMetadata(String title, String description, List<String> tags) {
        String newTitle = Guard.requireNonBlank("title", title);
        List<String> newTags = Guard.copyOf("tags", tags);
        this.title = newTitle;
        this.description = description;
        this.tags = newTags;
        this.updatedAt = Instant.now();
    }

    public void makePrivate() {
        this.privateCollection = true;
    }

    public void makePublic() {
        this.privateCollection = false;
    }

    private List<String> photoIdValues() {
        return photos.asList().stream().map(PhotoId::value).toList();
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public CollectionId getId() {
        return id;
    }

    // Getters
    public ArtistId getCuratorId() { return curatorId; }
    public String getTitle() { return title; }
    public Optional<String> getDescription() { return Optional.ofNullable(description); }
    public List<String> getTags() { return tags; }
    public boolean isPrivateCollection() { return privateCollection; }
    public Optional<PhotoId> getCoverPhotoId() { return Optional.ofNullable(coverPhotoId); }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Optional<Instant> getSyncedAt() { return Optional.ofNullable(syncedAt); }
    public List<PhotoId> getPhotoIds() { return photos.asList(); }
    public int getTotalPhotos() { return photos.size(); }

    public record Snapshot(
        String id,
        String curatorId,
        String title,
        String description,
        List<String> tags,
        boolean privateCollection,
        String coverPhotoId,
        Instant createdAt,
        Instant updatedAt,
        Instant syncedAt,
        List<String> photoIds
    ) {
    }
}

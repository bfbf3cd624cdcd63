package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.unsplash.domain.events.CollectionSynced;
import com.starscape.capture.features.unsplash.domain.events.PhotoAddedToCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectionTest {

    private static final PhotoId A = PhotoId.of("a");
    private static final PhotoId B = PhotoId.of("b");

    private Collection collection;

    @BeforeEach
    void setUp() {
        collection = Collection.create(CollectionId.of("c-1"), ArtistId.of("curator-1"), "Mountains", null,
                List.of("nature"), false);
        collection.pullDomainEvents();
    }

    @Test
    void duplicateAddIsSilentNoOp() {
        collection.addPhoto(A);
        collection.addPhoto(A);

        assertEquals(1, collection.getTotalPhotos());
        assertEquals(1, collection.pullDomainEvents().stream()
                .filter(PhotoAddedToCollection.class::isInstance).count());
    }

    @Test
    void coverMustBeAMember() {
        InvalidStateException ex = assertThrows(InvalidStateException.class, () -> collection.setCoverPhoto(A));
        assertEquals("COVER_NOT_MEMBER", ex.getCode());

        collection.addPhoto(A);
        collection.setCoverPhoto(A);
        assertEquals(A, collection.getCoverPhotoId().orElseThrow());
    }

    @Test
    void removingCoverPhotoClearsCover() {
        collection.addPhoto(A);
        collection.setCoverPhoto(A);

        collection.removePhoto(A);

        assertTrue(collection.getCoverPhotoId().isEmpty());
    }

    @Test
    void syncReplacesMembersAndDropsStaleCover() {
        collection.addPhoto(A);
        collection.setCoverPhoto(A);
        collection.pullDomainEvents();

        collection.syncPhotos(List.of(B));

        assertEquals(List.of(B), collection.getPhotoIds());
        assertTrue(collection.getCoverPhotoId().isEmpty());
        CollectionSynced synced = assertInstanceOf(CollectionSynced.class, collection.pullDomainEvents().get(0));
        assertEquals(List.of("b"), synced.photoIds());
    }

    @Test
    void rejectedMetadataUpdateLeavesCollectionUnchanged() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> collection.updateMetadata("Changed", "new desc", Arrays.asList("ok", null)));
        assertEquals("tags", ex.getField());

        assertEquals("Mountains", collection.getTitle());
        assertTrue(collection.getDescription().isEmpty());
        assertEquals(List.of("nature"), collection.getTags());
    }
}

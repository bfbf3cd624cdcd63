package com.starscape.capture.features.unsplash.app;

import com.starscape.capture.common.app.AggregateCommandExecutor;
import com.starscape.capture.features.unsplash.api.dto.ArtistCaptureRequest;
import com.starscape.capture.features.unsplash.api.dto.ArtistProfileRequest;
import com.starscape.capture.features.unsplash.api.dto.ArtistStatsRequest;
import com.starscape.capture.features.unsplash.api.dto.CollectionCaptureRequest;
import com.starscape.capture.features.unsplash.api.dto.LicenseIssueRequest;
import com.starscape.capture.features.unsplash.api.dto.PhotoCaptureRequest;
import com.starscape.capture.features.unsplash.domain.Artist;
import com.starscape.capture.features.unsplash.domain.ArtistId;
import com.starscape.capture.features.unsplash.domain.ArtistRepository;
import com.starscape.capture.features.unsplash.domain.Collection;
import com.starscape.capture.features.unsplash.domain.CollectionId;
import com.starscape.capture.features.unsplash.domain.CollectionRepository;
import com.starscape.capture.features.unsplash.domain.License;
import com.starscape.capture.features.unsplash.domain.LicenseId;
import com.starscape.capture.features.unsplash.domain.LicenseRepository;
import com.starscape.capture.features.unsplash.domain.Photo;
import com.starscape.capture.features.unsplash.domain.PhotoId;
import com.starscape.capture.features.unsplash.domain.PhotoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Capture and lifecycle commands for Unsplash photos, collections, licenses and artists.
 */
@Service
public class UnsplashContentService {

    private static final Logger log = LoggerFactory.getLogger(UnsplashContentService.class);

    private final PhotoRepository photoRepository;
    private final CollectionRepository collectionRepository;
    private final LicenseRepository licenseRepository;
    private final ArtistRepository artistRepository;
    private final AggregateCommandExecutor executor;

    public UnsplashContentService(
            PhotoRepository photoRepository,
            CollectionRepository collectionRepository,
            LicenseRepository licenseRepository,
            ArtistRepository artistRepository,
            AggregateCommandExecutor executor) {
        this.photoRepository = photoRepository;
        this.collectionRepository = collectionRepository;
        this.licenseRepository = licenseRepository;
        this.artistRepository = artistRepository;
        this.executor = executor;
    }

    public Photo capturePhoto(PhotoCaptureRequest request) {
        PhotoId id = PhotoId.of(request.id());
        ArtistId artistId = ArtistId.of(request.artistId());
        var attributes = UnsplashPayloads.photoAttributes(request);
        return executor.create(photoRepository, id, () -> Photo.capture(id, artistId, attributes));
    }

    public Collection createCollection(CollectionCaptureRequest request) {
        CollectionId id = CollectionId.of(request.id());
        ArtistId curatorId = ArtistId.of(request.curatorId());
        boolean privateCollection = Boolean.TRUE.equals(request.privateCollection());
        return executor.create(collectionRepository, id, () -> Collection.create(
                id, curatorId, request.title(), request.description(), request.tags(), privateCollection));
    }

    public License issueLicense(String photoId, String artistId, LicenseIssueRequest request) {
        PhotoId photo = PhotoId.of(photoId);
        ArtistId artist = ArtistId.of(artistId);
        var terms = UnsplashPayloads.licenseTerms(request);
        return executor.create(licenseRepository, LicenseId.of(photo, artist), () -> License.issue(photo, artist, terms));
    }

    public Artist captureArtist(ArtistCaptureRequest request) {
        ArtistId id = ArtistId.of(request.id());
        var profile = UnsplashPayloads.artistProfile(request);
        var stats = UnsplashPayloads.artistStats(request);
        boolean forHire = Boolean.TRUE.equals(request.forHire());
        boolean acceptsDonations = Boolean.TRUE.equals(request.acceptsDonations());
        return executor.create(artistRepository, id, () -> Artist.create(id, profile, stats, forHire, acceptsDonations));
    }

    public Photo likePhoto(String photoId) {
        return executor.update(photoRepository, PhotoId.of(photoId), Photo::like);
    }

    public Photo updatePhotoEngagement(String photoId, long likes, long downloads) {
        log.debug("Refreshing engagement of photo {}", photoId);
        return executor.update(photoRepository, PhotoId.of(photoId), photo -> photo.updateEngagement(likes, downloads));
    }

    public Photo addPhotoTag(String photoId, String tag) {
        return executor.update(photoRepository, PhotoId.of(photoId), photo -> photo.addTag(tag));
    }

    public Photo removePhotoTag(String photoId, String tag) {
        return executor.update(photoRepository, PhotoId.of(photoId), photo -> photo.removeTag(tag));
    }

    public Collection addPhotoToCollection(String collectionId, String photoId) {
        return executor.update(collectionRepository, CollectionId.of(collectionId),
                collection -> collection.addPhoto(PhotoId.of(photoId)));
    }

    public Collection removePhotoFromCollection(String collectionId, String photoId) {
        return executor.update(collectionRepository, CollectionId.of(collectionId),
                collection -> collection.removePhoto(PhotoId.of(photoId)));
    }

    public Collection setCollectionCover(String collectionId, String photoId) {
        return executor.update(collectionRepository, CollectionId.of(collectionId),
                collection -> collection.setCoverPhoto(PhotoId.of(photoId)));
    }

    public Collection syncCollection(String collectionId, List<String> photoIds) {
        List<PhotoId> ids = photoIds == null ? null : photoIds.stream().map(PhotoId::of).toList();
        return executor.update(collectionRepository, CollectionId.of(collectionId),
                collection -> collection.syncPhotos(ids));
    }

    public Collection updateCollectionMetadata(String collectionId, String title, String description,
                                               List<String> tags) {
        return executor.update(collectionRepository, CollectionId.of(collectionId),
                collection -> collection.updateMetadata(title, description, tags));
    }

    public Collection setCollectionVisibility(String collectionId, boolean privateCollection) {
        return executor.update(collectionRepository, CollectionId.of(collectionId),
                collection -> {
                    if (privateCollection) {
                        collection.makePrivate();
                    } else {
                        collection.makePublic();
                    }
                });
    }

    public License acquireLicense(String photoId, String artistId) {
        return executor.update(licenseRepository, licenseId(photoId, artistId), License::acquire);
    }

    public License useLicense(String photoId, String artistId) {
        return executor.update(licenseRepository, licenseId(photoId, artistId), License::use);
    }

    public Artist followArtist(String artistId) {
        return executor.update(artistRepository, ArtistId.of(artistId), Artist::follow);
    }

    public Artist unfollowArtist(String artistId) {
        return executor.update(artistRepository, ArtistId.of(artistId), Artist::unfollow);
    }

    public Artist updateArtistProfile(String artistId, ArtistProfileRequest request) {
        var profile = UnsplashPayloads.artistProfile(request);
        return executor.update(artistRepository, ArtistId.of(artistId), artist -> artist.updateProfile(profile));
    }

    public Artist updateArtistStats(String artistId, ArtistStatsRequest request) {
        var stats = UnsplashPayloads.artistStats(request);
        return executor.update(artistRepository, ArtistId.of(artistId), artist -> artist.updateStats(stats));
    }

    public Artist updateArtistAvailability(String artistId, boolean forHire, boolean acceptsDonations) {
        return executor.update(artistRepository, ArtistId.of(artistId),
                artist -> {
                    artist.setForHire(forHire);
                    artist.setAcceptsDonations(acceptsDonations);
                });
    }

    private static LicenseId licenseId(String photoId, String artistId) {
        return LicenseId.of(PhotoId.of(photoId), ArtistId.of(artistId));
    }
}

package com.starscape.capture.features.unsplash.api;

import com.starscape.capture.common.api.dto.CaptureResponse;
import com.starscape.capture.features.unsplash.api.dto.ArtistAvailabilityRequest;
import com.starscape.capture.features.unsplash.api.dto.ArtistCaptureRequest;
import com.starscape.capture.features.unsplash.api.dto.ArtistProfileRequest;
import com.starscape.capture.features.unsplash.api.dto.ArtistStatsRequest;
import com.starscape.capture.features.unsplash.api.dto.CollectionCaptureRequest;
import com.starscape.capture.features.unsplash.api.dto.CollectionMetadataRequest;
import com.starscape.capture.features.unsplash.api.dto.LicenseIssueRequest;
import com.starscape.capture.features.unsplash.api.dto.LicenseUsageResponse;
import com.starscape.capture.features.unsplash.api.dto.PhotoCaptureRequest;
import com.starscape.capture.features.unsplash.api.dto.PhotoEngagementRequest;
import com.starscape.capture.features.unsplash.api.dto.SyncPhotosRequest;
import com.starscape.capture.features.unsplash.app.UnsplashContentService;
import com.starscape.capture.features.unsplash.domain.License;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Capture and lifecycle commands for Unsplash content.
 */
@RestController
@RequestMapping("/commands")
public class UnsplashController {

    private final UnsplashContentService service;

    public UnsplashController(UnsplashContentService service) {
        this.service = service;
    }

    @PostMapping("/captures/unsplash/photos")
    public ResponseEntity<CaptureResponse> capturePhoto(@Valid @RequestBody PhotoCaptureRequest request) {
        return created(CaptureResponse.of(service.capturePhoto(request)));
    }

    @PostMapping("/captures/unsplash/collections")
    public ResponseEntity<CaptureResponse> createCollection(@Valid @RequestBody CollectionCaptureRequest request) {
        return created(CaptureResponse.of(service.createCollection(request)));
    }

    @PostMapping("/captures/unsplash/artists")
    public ResponseEntity<CaptureResponse> captureArtist(@Valid @RequestBody ArtistCaptureRequest request) {
        return created(CaptureResponse.of(service.captureArtist(request)));
    }

    /**
     * Issue a license for a photo of an artist.
     * POST /commands/unsplash/photos/{photoId}/licenses/{artistId}
     */
    @PostMapping("/unsplash/photos/{photoId}/licenses/{artistId}")
    public ResponseEntity<CaptureResponse> issueLicense(
            @PathVariable String photoId,
            @PathVariable String artistId,
            @Valid @RequestBody LicenseIssueRequest request) {
        return created(CaptureResponse.of(service.issueLicense(photoId, artistId, request)));
    }

    @PostMapping("/unsplash/photos/{photoId}/licenses/{artistId}/acquire")
    public ResponseEntity<Void> acquireLicense(@PathVariable String photoId, @PathVariable String artistId) {
        service.acquireLicense(photoId, artistId);
        return noContent();
    }

    @PostMapping("/unsplash/photos/{photoId}/licenses/{artistId}/use")
    public ResponseEntity<LicenseUsageResponse> useLicense(@PathVariable String photoId, @PathVariable String artistId) {
        License license = service.useLicense(photoId, artistId);
        return ResponseEntity.ok(new LicenseUsageResponse(
                license.getId().value(), license.getUsageCount(), license.getTerms().downloadLimit()));
    }

    @PostMapping("/unsplash/photos/{photoId}/like")
    public ResponseEntity<Void> likePhoto(@PathVariable String photoId) {
        service.likePhoto(photoId);
        return noContent();
    }

    @PutMapping("/unsplash/photos/{photoId}/engagement")
    public ResponseEntity<Void> updatePhotoEngagement(
            @PathVariable String photoId,
            @Valid @RequestBody PhotoEngagementRequest request) {
        service.updatePhotoEngagement(photoId, request.likes(), request.downloads());
        return noContent();
    }

    @PutMapping("/unsplash/photos/{photoId}/tags/{tag}")
    public ResponseEntity<Void> addPhotoTag(@PathVariable String photoId, @PathVariable String tag) {
        service.addPhotoTag(photoId, tag);
        return noContent();
    }

    @DeleteMapping("/unsplash/photos/{photoId}/tags/{tag}")
    public ResponseEntity<Void> removePhotoTag(@PathVariable String photoId, @PathVariable String tag) {
        service.removePhotoTag(photoId, tag);
        return noContent();
    }

    @PutMapping("/unsplash/collections/{collectionId}/photos/{photoId}")
    public ResponseEntity<Void> addPhotoToCollection(@PathVariable String collectionId, @PathVariable String photoId) {
        service.addPhotoToCollection(collectionId, photoId);
        return noContent();
    }

    @DeleteMapping("/unsplash/collections/{collectionId}/photos/{photoId}")
    public ResponseEntity<Void> removePhotoFromCollection(
            @PathVariable String collectionId,
            @PathVariable String photoId) {
        service.removePhotoFromCollection(collectionId, photoId);
        return noContent();
    }

    @PutMapping("/unsplash/collections/{collectionId}/cover/{photoId}")
    public ResponseEntity<Void> setCollectionCover(@PathVariable String collectionId, @PathVariable String photoId) {
        service.setCollectionCover(collectionId, photoId);
        return noContent();
    }

    @PostMapping("/unsplash/collections/{collectionId}/sync")
    public ResponseEntity<Void> syncCollection(
            @PathVariable String collectionId,
            @Valid @RequestBody SyncPhotosRequest request) {
        service.syncCollection(collectionId, request.photoIds());
        return noContent();
    }

    @PutMapping("/unsplash/collections/{collectionId}")
    public ResponseEntity<Void> updateCollectionMetadata(
            @PathVariable String collectionId,
            @Valid @RequestBody CollectionMetadataRequest request) {
        service.updateCollectionMetadata(collectionId, request.title(), request.description(), request.tags());
        return noContent();
    }

    @PutMapping("/unsplash/collections/{collectionId}/visibility")
    public ResponseEntity<Void> setCollectionVisibility(
            @PathVariable String collectionId,
            @RequestParam("private") boolean privateCollection) {
        service.setCollectionVisibility(collectionId, privateCollection);
        return noContent();
    }

    @PostMapping("/unsplash/artists/{artistId}/follow")
    public ResponseEntity<Void> followArtist(@PathVariable String artistId) {
        service.followArtist(artistId);
        return noContent();
    }

    @DeleteMapping("/unsplash/artists/{artistId}/follow")
    public ResponseEntity<Void> unfollowArtist(@PathVariable String artistId) {
        service.unfollowArtist(artistId);
        return noContent();
    }

    @PutMapping("/unsplash/artists/{artistId}/profile")
    public ResponseEntity<Void> updateArtistProfile(
            @PathVariable String artistId,
            @Valid @RequestBody ArtistProfileRequest request) {
        service.updateArtistProfile(artistId, request);
        return noContent();
    }

    @PutMapping("/unsplash/artists/{artistId}/stats")
    public ResponseEntity<Void> updateArtistStats(
            @PathVariable String artistId,
            @Valid @RequestBody ArtistStatsRequest request) {
        service.updateArtistStats(artistId, request);
        return noContent();
    }

    @PutMapping("/unsplash/artists/{artistId}/availability")
    public ResponseEntity<Void> updateArtistAvailability(
            @PathVariable String artistId,
            @Valid @RequestBody ArtistAvailabilityRequest request) {
        service.updateArtistAvailability(artistId, request.forHire(), request.acceptsDonations());
        return noContent();
    }

    private static ResponseEntity<CaptureResponse> created(CaptureResponse body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    private static ResponseEntity<Void> noContent() {
        return ResponseEntity.status(HttpStatus.NO_CONTENT).build();
    }
}

package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Downloadable;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.DownloadLifecycle;
import com.starscape.capture.common.domain.lifecycle.DownloadState;
import com.starscape.capture.features.pinterest.domain.events.PinDownloadRequested;
import com.starscape.capture.features.pinterest.domain.events.PinDownloaded;
import com.starscape.capture.features.pinterest.domain.events.PinSaved;

import java.time.Instant;
import java.util.Optional;

public class Pin extends AggregateRoot<PinId> implements Downloadable {

    public static final String AGGREGATE_TYPE = "pinterest.pin";

    private final PinId id;
    private PinMetadata metadata;
    private BoardId boardId;
    private final Instant savedAt;
    private final DownloadLifecycle download;

    private Pin(PinId id, PinMetadata metadata, BoardId boardId, Instant savedAt, DownloadLifecycle download) {
        this.id = Guard.requireNonNull("pinId", id);
        this.metadata = Guard.requireNonNull("metadata", metadata);
        this.boardId = boardId;
        this.savedAt = savedAt;
        this.download = download;
    }

    /**
     * @param boardId board the pin was captured from, may be null
     */
    public static Pin capture(PinId id, PinMetadata metadata, BoardId boardId) {
        Pin pin = new Pin(id, metadata, boardId, Instant.now(), DownloadLifecycle.captured());
        pin.record(new PinSaved(id.value(), boardId != null ? boardId.value() : null, metadata, pin.savedAt));
        return pin;
    }

    public static Pin fromSnapshot(Snapshot snapshot) {
        return new Pin(
            PinId.of(snapshot.id()),
            snapshot.metadata(),
            snapshot.boardId() != null ? BoardId.of(snapshot.boardId()) : null,
            snapshot.savedAt(),
            DownloadLifecycle.restore(snapshot.downloadRequestedAt(), snapshot.localPath(), snapshot.downloadedAt())
        );
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), metadata, boardId != null ? boardId.value() : null, savedAt,
                download.lastRequestedAt().orElse(null),
                download.localPath().orElse(null),
                download.downloadedAt().orElse(null));
    }

    @Override
    public void requestDownload() {
        Instant requestedAt = download.requestDownload("Pin " + id.value());
        record(new PinDownloadRequested(id.value(), metadata.originalImageUrl(), requestedAt));
    }

    @Override
    public void markAsDownloaded(String localPath) {
        Instant downloadedAt = download.markDownloaded("Pin " + id.value(), localPath);
        record(new PinDownloaded(id.value(), localPath, downloadedAt));
    }

    public void assignToBoard(BoardId boardId) {
        this.boardId = Guard.requireNonNull("boardId", boardId);
    }

    public void updateEngagement(long repinCount, long commentCount) {
        this.metadata = metadata.withEngagement(repinCount, commentCount);
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public PinId getId() {
        return id;
    }

    // Getters
    public PinMetadata getMetadata() { return metadata; }
    public Optional<BoardId> getBoardId() { return Optional.ofNullable(boardId); }
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
        PinMetadata metadata,
        String boardId,
        Instant savedAt,
        Instant downloadRequestedAt,
        String localPath,
        Instant downloadedAt
    ) {
    }
}

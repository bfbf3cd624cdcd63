package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.MembershipSet;
import com.starscape.capture.features.pinterest.domain.events.BoardCreated;
import com.starscape.capture.features.pinterest.domain.events.BoardSynced;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Pinterest board and the pins it holds. Only {@link #syncPins(List)} records a sync;
 * incremental adds and removes are silent.
 */
public class Board extends AggregateRoot<BoardId> {

    public static final String AGGREGATE_TYPE = "pinterest.board";

    private final BoardId id;
    private String name;
    private String description;
    private final UserId ownerId;
    private boolean privateBoard;
    private final Instant createdAt;
    private Instant lastSyncedAt;
    private final MembershipSet<PinId> pins;

    private Board(BoardId id, String name, String description, UserId ownerId, boolean privateBoard,
                  Instant createdAt, MembershipSet<PinId> pins) {
        this.id = Guard.requireNonNull("boardId", id);
        this.name = Guard.requireNonBlank("name", name);
        this.description = description == null ? "" : description;
        this.ownerId = Guard.requireNonNull("ownerId", ownerId);
        this.privateBoard = privateBoard;
        this.createdAt = createdAt;
        this.pins = pins;
    }

    public static Board create(BoardId id, String name, String description, UserId ownerId, boolean privateBoard) {
        Board board = new Board(id, name, description, ownerId, privateBoard, Instant.now(), MembershipSet.empty("pin"));
        board.record(new BoardCreated(id.value(), board.name, board.description, ownerId.value(), board.createdAt));
        return board;
    }

    public static Board fromSnapshot(Snapshot snapshot) {
        Board board = new Board(
            BoardId.of(snapshot.id()),
            snapshot.name(),
            snapshot.description(),
            UserId.of(snapshot.ownerId()),
            snapshot.privateBoard(),
            snapshot.createdAt(),
            MembershipSet.of("pin", snapshot.pinIds().stream().map(PinId::of).toList())
        );
        board.lastSyncedAt = snapshot.lastSyncedAt();
        return board;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), name, description, ownerId.value(), privateBoard, createdAt, lastSyncedAt,
                pinIdValues());
    }

    public void addPin(PinId pinId) {
        pins.add(pinId);
    }

    public void removePin(PinId pinId) {
        pins.remove(pinId);
    }

    /**
     * Replaces the whole membership with {@code pinIds}. An empty list clears the board.
     */
    public void syncPins(List<PinId> pinIds) {
        pins.replaceAll(pinIds);
        this.lastSyncedAt = Instant.now();
        record(new BoardSynced(id.value(), pinIdValues(), lastSyncedAt));
    }

    public void updateDetails(String name, String description) {
        this.name = Guard.requireNonBlank("name", name);
        this.description = description == null ? "" : description;
    }

    public void makePrivate() {
        this.privateBoard = true;
    }

    public void makePublic() {
        this.privateBoard = false;
    }

    private List<String> pinIdValues() {
        return pins.asList().stream().map(PinId::value).toList();
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public BoardId getId() {
        return id;
    }

    // Getters
    public String getName() { return name; }
    public String getDescription() { return description; }
    public UserId getOwnerId() { return ownerId; }
    public boolean isPrivateBoard() { return privateBoard; }
    public Instant getCreatedAt() { return createdAt; }
    public Optional<Instant> getLastSyncedAt() { return Optional.ofNullable(lastSyncedAt); }
    public List<PinId> getPinIds() { return pins.asList(); }
    public int getPinCount() { return pins.size(); }

    public record Snapshot(
        String id,
        String name,
        String description,
        String ownerId,
        boolean privateBoard,
        Instant createdAt,
        Instant lastSyncedAt,
        List<String> pinIds
    ) {
    }
}

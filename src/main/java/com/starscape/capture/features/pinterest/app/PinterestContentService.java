package com.starscape.capture.features.pinterest.app;

import com.starscape.capture.common.app.AggregateCommandExecutor;
import com.starscape.capture.features.pinterest.api.dto.BoardCaptureRequest;
import com.starscape.capture.features.pinterest.api.dto.PinCaptureRequest;
import com.starscape.capture.features.pinterest.domain.Board;
import com.starscape.capture.features.pinterest.domain.BoardId;
import com.starscape.capture.features.pinterest.domain.BoardRepository;
import com.starscape.capture.features.pinterest.domain.Pin;
import com.starscape.capture.features.pinterest.domain.PinId;
import com.starscape.capture.features.pinterest.domain.PinMetadata;
import com.starscape.capture.features.pinterest.domain.PinRepository;
import com.starscape.capture.features.pinterest.domain.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNullElse;

@Service
public class PinterestContentService {

    private static final Logger log = LoggerFactory.getLogger(PinterestContentService.class);

    private final PinRepository pinRepository;
    private final BoardRepository boardRepository;
    private final AggregateCommandExecutor executor;

    public PinterestContentService(
            PinRepository pinRepository,
            BoardRepository boardRepository,
            AggregateCommandExecutor executor) {
        this.pinRepository = pinRepository;
        this.boardRepository = boardRepository;
        this.executor = executor;
    }

    public Pin capturePin(PinCaptureRequest request) {
        PinId id = PinId.of(request.id());
        BoardId boardId = request.boardId() != null ? BoardId.of(request.boardId()) : null;
        PinMetadata metadata = new PinMetadata(
            request.title(),
            request.description(),
            request.imageUrl(),
            request.originalImageUrl(),
            request.sourceUrl(),
            request.width(),
            request.height(),
            requireNonNullElse(request.createdAt(), Instant.now()),
            request.creatorId(),
            request.creatorName(),
            request.boardName(),
            requireNonNullElse(request.repinCount(), 0L),
            requireNonNullElse(request.commentCount(), 0L),
            request.tags()
        );
        return executor.create(pinRepository, id, () -> Pin.capture(id, metadata, boardId));
    }

    public Board createBoard(BoardCaptureRequest request) {
        BoardId id = BoardId.of(request.id());
        UserId ownerId = UserId.of(request.ownerId());
        boolean privateBoard = Boolean.TRUE.equals(request.privateBoard());
        return executor.create(boardRepository, id,
                () -> Board.create(id, request.name(), request.description(), ownerId, privateBoard));
    }

    public Pin updatePinEngagement(String pinId, long repinCount, long commentCount) {
        log.debug("Refreshing engagement of pin {}", pinId);
        return executor.update(pinRepository, PinId.of(pinId), pin -> pin.updateEngagement(repinCount, commentCount));
    }

    /**
     * Adds the pin to the board and, when the pin was captured, points it back at the board.
     * Neither side records an event.
     */
    public Board addPinToBoard(String boardId, String pinId) {
        PinId pin = PinId.of(pinId);
        BoardId board = BoardId.of(boardId);
        Board updated = executor.update(boardRepository, board, b -> b.addPin(pin));
        if (pinRepository.findById(pin).isPresent()) {
            executor.update(pinRepository, pin, p -> p.assignToBoard(board));
        }
        return updated;
    }

    public Board removePinFromBoard(String boardId, String pinId) {
        return executor.update(boardRepository, BoardId.of(boardId), board -> board.removePin(PinId.of(pinId)));
    }

    public Board syncBoard(String boardId, List<String> pinIds) {
        List<PinId> ids = pinIds == null ? null : pinIds.stream().map(PinId::of).toList();
        return executor.update(boardRepository, BoardId.of(boardId), board -> board.syncPins(ids));
    }

    public Board updateBoardDetails(String boardId, String name, String description) {
        return executor.update(boardRepository, BoardId.of(boardId), board -> board.updateDetails(name, description));
    }

    public Board setBoardVisibility(String boardId, boolean privateBoard) {
        return executor.update(boardRepository, BoardId.of(boardId),
                board -> {
                    if (privateBoard) {
                        board.makePrivate();
                    } else {
                        board.makePublic();
                    }
                });
    }
}

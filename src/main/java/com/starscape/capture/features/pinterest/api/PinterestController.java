package com.starscape.capture.features.pinterest.api;

import com.starscape.capture.common.api.dto.CaptureResponse;
import com.starscape.capture.features.pinterest.api.dto.BoardCaptureRequest;
import com.starscape.capture.features.pinterest.api.dto.BoardDetailsRequest;
import com.starscape.capture.features.pinterest.api.dto.PinCaptureRequest;
import com.starscape.capture.features.pinterest.api.dto.PinEngagementRequest;
import com.starscape.capture.features.pinterest.api.dto.SyncPinsRequest;
import com.starscape.capture.features.pinterest.app.PinterestContentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class PinterestController {

    private final PinterestContentService service;

    public PinterestController(PinterestContentService service) {
        this.service = service;
    }

    @PostMapping("/captures/pinterest/pins")
    public ResponseEntity<CaptureResponse> capturePin(@Valid @RequestBody PinCaptureRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(CaptureResponse.of(service.capturePin(request)));
    }

    @PostMapping("/captures/pinterest/boards")
    public ResponseEntity<CaptureResponse> createBoard(@Valid @RequestBody BoardCaptureRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(CaptureResponse.of(service.createBoard(request)));
    }

    @PutMapping("/pinterest/pins/{pinId}/engagement")
    public ResponseEntity<Void> updatePinEngagement(
            @PathVariable String pinId,
            @Valid @RequestBody PinEngagementRequest request) {
        service.updatePinEngagement(pinId, request.repinCount(), request.commentCount());
        return ResponseEntity.noContent().build();
    }

    /**
     * Add a pin to a board.
     * PUT /commands/pinterest/boards/{boardId}/pins/{pinId}
     */
    @PutMapping("/pinterest/boards/{boardId}/pins/{pinId}")
    public ResponseEntity<Void> addPin(@PathVariable String boardId, @PathVariable String pinId) {
        service.addPinToBoard(boardId, pinId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/pinterest/boards/{boardId}/pins/{pinId}")
    public ResponseEntity<Void> removePin(@PathVariable String boardId, @PathVariable String pinId) {
        service.removePinFromBoard(boardId, pinId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Replace the board's pins with the given list.
     * POST /commands/pinterest/boards/{boardId}/sync
     */
    @PostMapping("/pinterest/boards/{boardId}/sync")
    public ResponseEntity<Void> syncBoard(
            @PathVariable String boardId,
            @Valid @RequestBody SyncPinsRequest request) {
        service.syncBoard(boardId, request.pinIds());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/pinterest/boards/{boardId}")
    public ResponseEntity<Void> updateBoardDetails(
            @PathVariable String boardId,
            @Valid @RequestBody BoardDetailsRequest request) {
        service.updateBoardDetails(boardId, request.name(), request.description());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/pinterest/boards/{boardId}/visibility")
    public ResponseEntity<Void> setBoardVisibility(
            @PathVariable String boardId,
            @RequestParam("private") boolean privateBoard) {
        service.setBoardVisibility(boardId, privateBoard);
        return ResponseEntity.noContent().build();
    }
}

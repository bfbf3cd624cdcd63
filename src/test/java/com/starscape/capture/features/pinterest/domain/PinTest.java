package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.pinterest.domain.events.PinDownloadRequested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PinTest {

    private static PinMetadata metadata(int width, int height) {
        return new PinMetadata("Kitchen ideas", null, "https://i.pinimg.com/236x/1.jpg",
                "https://i.pinimg.com/originals/1.jpg", null, width, height, Instant.now(),
                "creator-1", "Creator", "Home", 3, 1, List.of("kitchen"));
    }

    @Test
    void pinIdsMustBeNumeric() {
        ValidationException ex = assertThrows(ValidationException.class, () -> PinId.of("abc123"));
        assertEquals("pinId", ex.getField());
        assertEquals("123456", PinId.of("123456").value());
    }

    @Test
    void orientationFollowsDimensions() {
        assertEquals(Orientation.PORTRAIT, metadata(600, 900).orientation());
        assertEquals(Orientation.LANDSCAPE, metadata(900, 600).orientation());
        assertEquals(Orientation.SQUARE, metadata(800, 800).orientation());
    }

    @Test
    void downloadRequestPointsAtOriginalImage() {
        Pin pin = Pin.capture(PinId.of("123456"), metadata(600, 900), null);
        pin.pullDomainEvents();

        pin.requestDownload();

        PinDownloadRequested event = assertInstanceOf(PinDownloadRequested.class, pin.pullDomainEvents().get(0));
        assertEquals("https://i.pinimg.com/originals/1.jpg", event.originalImageUrl());
        assertTrue(pin.getBoardId().isEmpty());
    }

    @Test
    void assigningBoardIsSilent() {
        Pin pin = Pin.capture(PinId.of("123456"), metadata(600, 900), null);
        pin.pullDomainEvents();

        pin.assignToBoard(BoardId.of("board-1"));

        assertEquals(BoardId.of("board-1"), pin.getBoardId().orElseThrow());
        assertTrue(pin.pullDomainEvents().isEmpty());
    }
}

package com.starscape.capture.common.outbox.api;

import com.starscape.capture.common.config.CaptureProperties;
import com.starscape.capture.common.outbox.OutboxEvent;
import com.starscape.capture.common.outbox.OutboxService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Polling surface for the transport consumer: read pending events, then acknowledge them.
 */
@RestController
public class OutboxController {

    private final OutboxService outboxService;
    private final CaptureProperties properties;

    public OutboxController(OutboxService outboxService, CaptureProperties properties) {
        this.outboxService = outboxService;
        this.properties = properties;
    }

    /**
     * Pending events in creation order.
     * GET /queries/outbox?limit=n
     */
    @GetMapping("/queries/outbox")
    public ResponseEntity<List<OutboxEvent>> pending(@RequestParam(required = false) Integer limit) {
        int batch = limit != null ? limit : properties.getOutboxBatchSize();
        if (batch <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(outboxService.findPending(batch));
    }

    @PostMapping("/commands/outbox/{eventId}/ack")
    public ResponseEntity<Void> acknowledge(@PathVariable String eventId) {
        outboxService.acknowledge(eventId);
        return ResponseEntity.noContent().build();
    }
}

package com.starscape.capture.features.download.api;

import com.starscape.capture.features.download.api.dto.CompleteDownloadRequest;
import com.starscape.capture.features.download.app.DownloadService;
import com.starscape.capture.features.download.app.DownloadStatus;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Callbacks for the download consumer.
 */
@RestController
public class DownloadController {

    private final DownloadService downloadService;

    public DownloadController(DownloadService downloadService) {
        this.downloadService = downloadService;
    }

    /**
     * Ask for content to be downloaded.
     * POST /commands/downloads/{contentType}/{id}/request
     */
    @PostMapping("/commands/downloads/{contentType}/{id}/request")
    public ResponseEntity<DownloadStatus> requestDownload(
            @PathVariable String contentType,
            @PathVariable String id) {
        return ResponseEntity.accepted().body(downloadService.requestDownload(contentType, id));
    }

    /**
     * Report a finished download.
     * POST /commands/downloads/{contentType}/{id}/complete
     */
    @PostMapping("/commands/downloads/{contentType}/{id}/complete")
    public ResponseEntity<DownloadStatus> completeDownload(
            @PathVariable String contentType,
            @PathVariable String id,
            @Valid @RequestBody CompleteDownloadRequest request) {
        return ResponseEntity.ok(downloadService.completeDownload(contentType, id, request.localPath()));
    }

    @GetMapping("/queries/downloads/{contentType}/{id}")
    public ResponseEntity<DownloadStatus> getStatus(
            @PathVariable String contentType,
            @PathVariable String id) {
        return ResponseEntity.ok(downloadService.status(contentType, id));
    }
}

package com.starscape.capture.features.download.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CompleteDownloadRequest(
    @NotBlank(message = "Local path is required")
    String localPath
) {}

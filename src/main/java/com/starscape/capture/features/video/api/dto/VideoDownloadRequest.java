package com.starscape.capture.features.video.api.dto;

import jakarta.validation.constraints.NotBlank;

public record VideoDownloadRequest(
    @NotBlank(message = "Quality is required")
    String quality
) {}

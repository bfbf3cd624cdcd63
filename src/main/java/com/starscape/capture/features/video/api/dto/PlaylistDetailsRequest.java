package com.starscape.capture.features.video.api.dto;

import jakarta.validation.constraints.NotBlank;

public record PlaylistDetailsRequest(
    @NotBlank(message = "Playlist title is required")
    String title,
    String description
) {}

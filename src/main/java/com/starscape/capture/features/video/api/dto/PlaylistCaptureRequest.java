package com.starscape.capture.features.video.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record PlaylistCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "title is required")
    String title,
    String description,
    @NotBlank(message = "channelId is required")
    String channelId,
    @JsonProperty("isPublic") Boolean publicPlaylist
) {}

package com.starscape.capture.features.video.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SyncVideosRequest(
    @NotNull(message = "videoIds is required")
    List<String> videoIds
) {}

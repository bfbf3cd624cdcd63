package com.starscape.capture.features.unsplash.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record SyncPhotosRequest(
    @NotNull(message = "photoIds is required")
    List<String> photoIds
) {}

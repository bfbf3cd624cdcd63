package com.starscape.capture.features.pinterest.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Full pin membership of a board. An empty list clears it.
 */
public record SyncPinsRequest(
    @NotNull(message = "pinIds is required")
    List<String> pinIds
) {}

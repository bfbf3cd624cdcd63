package com.starscape.capture.features.twitter.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ReorderTweetsRequest(
    @NotNull(message = "tweetIds is required")
    List<String> tweetIds
) {}

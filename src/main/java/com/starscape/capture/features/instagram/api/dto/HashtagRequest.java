package com.starscape.capture.features.instagram.api.dto;

import jakarta.validation.constraints.NotBlank;

public record HashtagRequest(
    @NotBlank(message = "Hashtag is required")
    String hashtag
) {}

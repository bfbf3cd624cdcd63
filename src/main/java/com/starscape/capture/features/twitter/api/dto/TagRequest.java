package com.starscape.capture.features.twitter.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * A hashtag or a mention, depending on the endpoint.
 */
public record TagRequest(
    @NotBlank(message = "Value is required")
    String value
) {}

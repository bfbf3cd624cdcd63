package com.starscape.capture.features.twitter.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Starts tracking a tweet's analytics over {@code startDate..endDate}. {@code period} defaults to day.
 */
public record EngagementTrackRequest(
    @NotBlank(message = "tweetId is required")
    String tweetId,
    @NotBlank(message = "authorId is required")
    String authorId,
    String period,
    @NotNull(message = "startDate is required")
    Instant startDate,
    @NotNull(message = "endDate is required")
    Instant endDate,
    @Valid
    EngagementMetricsRequest metrics
) {}

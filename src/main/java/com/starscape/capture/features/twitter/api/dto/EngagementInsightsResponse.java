package com.starscape.capture.features.twitter.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for an engagement analysis.
 */
public record EngagementInsightsResponse(
    String tweetId,
    double engagementRate,
    List<String> insights,
    Instant analyzedAt
) {}

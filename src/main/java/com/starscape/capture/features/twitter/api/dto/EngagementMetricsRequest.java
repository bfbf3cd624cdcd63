package com.starscape.capture.features.twitter.api.dto;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * Analytics counters. On a refresh, absent counters keep their current value.
 */
public record EngagementMetricsRequest(
    @PositiveOrZero Long impressions,
    @PositiveOrZero Long engagements,
    @PositiveOrZero Long likes,
    @PositiveOrZero Long retweets,
    @PositiveOrZero Long replies,
    @PositiveOrZero Long quotes,
    @PositiveOrZero Long profileClicks,
    @PositiveOrZero Long urlClicks,
    @PositiveOrZero Long hashtagClicks,
    @PositiveOrZero Long detailExpands,
    @PositiveOrZero Long mediaViews,
    @PositiveOrZero Long mediaEngagements
) {}

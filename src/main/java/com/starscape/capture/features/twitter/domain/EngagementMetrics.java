package com.starscape.capture.features.twitter.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

/**
 * Analytics counters for one tweet over one period. The engagement rate is derived from
 * engagements and impressions, so it is always consistent with them.
 */
public record EngagementMetrics(
    long impressions,
    long engagements,
    long likes,
    long retweets,
    long replies,
    long quotes,
    long profileClicks,
    long urlClicks,
    long hashtagClicks,
    long detailExpands,
    long mediaViews,
    long mediaEngagements
) implements ValueObject {

    public EngagementMetrics {
        Guard.requireNonNegative("impressions", impressions);
        Guard.requireNonNegative("engagements", engagements);
        Guard.requireNonNegative("likes", likes);
        Guard.requireNonNegative("retweets", retweets);
        Guard.requireNonNegative("replies", replies);
        Guard.requireNonNegative("quotes", quotes);
        Guard.requireNonNegative("profileClicks", profileClicks);
        Guard.requireNonNegative("urlClicks", urlClicks);
        Guard.requireNonNegative("hashtagClicks", hashtagClicks);
        Guard.requireNonNegative("detailExpands", detailExpands);
        Guard.requireNonNegative("mediaViews", mediaViews);
        Guard.requireNonNegative("mediaEngagements", mediaEngagements);
    }

    /**
     * Engagements per impression, 0 when nothing was shown yet.
     */
    @JsonProperty("engagementRate")
    public double engagementRate() {
        return impressions > 0 ? (double) engagements / impressions : 0.0;
    }
}

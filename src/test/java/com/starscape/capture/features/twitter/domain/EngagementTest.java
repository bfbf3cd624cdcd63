package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.twitter.domain.events.EngagementAnalyzed;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngagementTest {

    private static EngagementMetrics metrics(long impressions, long engagements, long likes, long retweets,
                                             long replies) {
        return new EngagementMetrics(impressions, engagements, likes, retweets, replies, 0, 0, 0, 0, 0, 0, 0);
    }

    private static Engagement track(EngagementMetrics metrics) {
        Instant end = Instant.now();
        Engagement engagement = Engagement.track(TweetId.of("1"), UserId.of("author-1"), metrics,
                EngagementPeriod.DAY, end.minus(Duration.ofDays(1)), end);
        engagement.pullDomainEvents();
        return engagement;
    }

    @Test
    void engagementRateIsDerived() {
        assertEquals(0.1, metrics(1000, 100, 0, 0, 0).engagementRate(), 1e-9);
        assertEquals(0.0, metrics(0, 100, 0, 0, 0).engagementRate());
    }

    @Test
    void analyzeGeneratesInsightsFromMetrics() {
        Engagement engagement = track(metrics(1000, 100, 50, 20, 5));

        engagement.analyze();

        assertEquals(List.of(
                "High engagement rate - content resonates well with audience",
                "High retweet ratio - content is highly shareable"), engagement.getInsights());
        assertTrue(engagement.isAnalyzed());
        assertInstanceOf(EngagementAnalyzed.class, engagement.pullDomainEvents().get(0));
    }

    @Test
    void analyzeReplacesCustomInsights() {
        Engagement engagement = track(metrics(1000, 10, 100, 0, 0));
        engagement.addCustomInsight("Posted during launch week");
        engagement.addCustomInsight("Posted during launch week");
        assertEquals(1, engagement.getInsights().size());

        engagement.analyze();

        assertTrue(engagement.getInsights().isEmpty());
    }

    @Test
    void periodMustNotEndBeforeItStarts() {
        Instant now = Instant.now();
        assertThrows(ValidationException.class, () -> Engagement.track(TweetId.of("1"), UserId.of("author-1"),
                metrics(0, 0, 0, 0, 0), EngagementPeriod.HOUR, now, now.minusSeconds(60)));
    }
}

package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.twitter.domain.events.EngagementAnalyzed;
import com.starscape.capture.features.twitter.domain.events.EngagementTracked;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Engagement analytics of a single tweet, keyed by the tweet id.
 * Metric refreshes are silent; only tracking and analysis record events.
 */
public class Engagement extends AggregateRoot<TweetId> {

    public static final String AGGREGATE_TYPE = "twitter.engagement";

    private static final double HIGH_ENGAGEMENT_RATE = 0.05;
    private static final double HIGH_RETWEET_RATIO = 0.3;
    private static final double HIGH_REPLY_RATIO = 0.2;
    private static final double STRONG_CLICK_THROUGH = 0.02;
    private static final double STRONG_MEDIA_ENGAGEMENT = 0.1;
    private static final double PROFILE_VISIT_RATIO = 0.01;

    private final TweetId tweetId;
    private final UserId authorId;
    private EngagementMetrics metrics;
    private final EngagementPeriod period;
    private final Instant startDate;
    private final Instant endDate;
    private Instant analyzedAt;
    private final List<String> insights;

    private Engagement(TweetId tweetId, UserId authorId, EngagementMetrics metrics, EngagementPeriod period,
                       Instant startDate, Instant endDate, List<String> insights) {
        this.tweetId = Guard.requireNonNull("tweetId", tweetId);
        this.authorId = Guard.requireNonNull("authorId", authorId);
        this.metrics = Guard.requireNonNull("metrics", metrics);
        this.period = Guard.requireNonNull("period", period);
        this.startDate = Guard.requireNonNull("startDate", startDate);
        this.endDate = Guard.requireNonNull("endDate", endDate);
        if (endDate.isBefore(startDate)) {
            throw new ValidationException("endDate", "endDate cannot be before startDate");
        }
        this.insights = new ArrayList<>(insights);
    }

    public static Engagement track(TweetId tweetId, UserId authorId, EngagementMetrics metrics,
                                   EngagementPeriod period, Instant startDate, Instant endDate) {
        Engagement engagement = new Engagement(tweetId, authorId, metrics, period, startDate, endDate, List.of());
        engagement.record(new EngagementTracked(tweetId.value(), authorId.value(), metrics, period, Instant.now()));
        return engagement;
    }

    public static Engagement fromSnapshot(Snapshot snapshot) {
        Engagement engagement = new Engagement(TweetId.of(snapshot.tweetId()), UserId.of(snapshot.authorId()),
                snapshot.metrics(), snapshot.period(), snapshot.startDate(), snapshot.endDate(), snapshot.insights());
        engagement.analyzedAt = snapshot.analyzedAt();
        return engagement;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(tweetId.value(), authorId.value(), metrics, period, startDate, endDate, analyzedAt,
                List.copyOf(insights));
    }

    public void updateMetrics(EngagementMetrics metrics) {
        this.metrics = Guard.requireNonNull("metrics", metrics);
    }

    /**
     * Replaces the generated insights with the ones derived from the current metrics.
     * Custom insights added earlier are discarded.
     */
    public void analyze() {
        this.analyzedAt = Instant.now();
        insights.clear();
        insights.addAll(generateInsights());
        record(new EngagementAnalyzed(tweetId.value(), authorId.value(), metrics, List.copyOf(insights), analyzedAt));
    }

    private List<String> generateInsights() {
        List<String> generated = new ArrayList<>();
        if (metrics.engagementRate() > HIGH_ENGAGEMENT_RATE) {
            generated.add("High engagement rate - content resonates well with audience");
        }
        if (metrics.retweets() > metrics.likes() * HIGH_RETWEET_RATIO) {
            generated.add("High retweet ratio - content is highly shareable");
        }
        if (metrics.replies() > metrics.likes() * HIGH_REPLY_RATIO) {
            generated.add("High reply ratio - content sparks conversation");
        }
        if (metrics.urlClicks() > 0 && metrics.impressions() > 0
                && (double) metrics.urlClicks() / metrics.impressions() > STRONG_CLICK_THROUGH) {
            generated.add("Strong click-through rate on links");
        }
        if (metrics.mediaViews() > 0
                && (double) metrics.mediaEngagements() / metrics.mediaViews() > STRONG_MEDIA_ENGAGEMENT) {
            generated.add("Media content performs well");
        }
        if (metrics.profileClicks() > metrics.impressions() * PROFILE_VISIT_RATIO) {
            generated.add("Content drives profile visits");
        }
        return generated;
    }

    public void addCustomInsight(String insight) {
        Guard.requireNonBlank("insight", insight);
        if (!insights.contains(insight)) {
            insights.add(insight);
        }
    }

    public void removeInsight(String insight) {
        insights.remove(insight);
    }

    public boolean isAnalyzed() {
        return analyzedAt != null;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public TweetId getId() {
        return tweetId;
    }

    // Getters
    public UserId getAuthorId() { return authorId; }
    public EngagementMetrics getMetrics() { return metrics; }
    public EngagementPeriod getPeriod() { return period; }
    public Instant getStartDate() { return startDate; }
    public Instant getEndDate() { return endDate; }
    public Optional<Instant> getAnalyzedAt() { return Optional.ofNullable(analyzedAt); }
    public List<String> getInsights() { return List.copyOf(insights); }

    public record Snapshot(
        String tweetId,
        String authorId,
        EngagementMetrics metrics,
        EngagementPeriod period,
        Instant startDate,
        Instant endDate,
        Instant analyzedAt,
        List<String> insights
    ) {
    }
}

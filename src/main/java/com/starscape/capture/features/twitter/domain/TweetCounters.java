package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

public record TweetCounters(
    long retweets,
    long likes,
    long replies,
    long quotes,
    long views
) implements ValueObject {

    public TweetCounters {
        Guard.requireNonNegative("retweets", retweets);
        Guard.requireNonNegative("likes", likes);
        Guard.requireNonNegative("replies", replies);
        Guard.requireNonNegative("quotes", quotes);
        Guard.requireNonNegative("views", views);
    }

    public static TweetCounters zero() {
        return new TweetCounters(0, 0, 0, 0, 0);
    }

    public TweetCounters plusLike() {
        return new TweetCounters(retweets, likes + 1, replies, quotes, views);
    }

    public TweetCounters plusRetweet() {
        return new TweetCounters(retweets + 1, likes, replies, quotes, views);
    }
}

package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record TweetId(String value) implements Identifier {

    public TweetId {
        Guard.requireNonBlank("tweetId", value);
    }

    public static TweetId of(String value) {
        return new TweetId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}

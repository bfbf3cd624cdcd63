package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

public record TwitterStats(
    long followersCount,
    long followingCount,
    long tweetsCount,
    long listedCount
) implements ValueObject {

    public TwitterStats {
        Guard.requireNonNegative("followersCount", followersCount);
        Guard.requireNonNegative("followingCount", followingCount);
        Guard.requireNonNegative("tweetsCount", tweetsCount);
        Guard.requireNonNegative("listedCount", listedCount);
    }
}

package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;

public record UserStats(long followersCount, long followingCount, long postsCount) implements ValueObject {

    public UserStats {
        Guard.requireNonNegative("followersCount", followersCount);
        Guard.requireNonNegative("followingCount", followingCount);
        Guard.requireNonNegative("postsCount", postsCount);
    }

    public static UserStats empty() {
        return new UserStats(0, 0, 0);
    }
}

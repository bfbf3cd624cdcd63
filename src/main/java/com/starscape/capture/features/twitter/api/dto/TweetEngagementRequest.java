package com.starscape.capture.features.twitter.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record TweetEngagementRequest(
    @NotNull(message = "retweets is required") @PositiveOrZero Long retweets,
    @NotNull(message = "likes is required") @PositiveOrZero Long likes,
    @NotNull(message = "replies is required") @PositiveOrZero Long replies,
    @NotNull(message = "quotes is required") @PositiveOrZero Long quotes,
    @NotNull(message = "views is required") @PositiveOrZero Long views
) {}

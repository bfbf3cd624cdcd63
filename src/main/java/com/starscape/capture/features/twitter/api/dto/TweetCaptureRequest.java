package com.starscape.capture.features.twitter.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;
import java.util.List;

public record TweetCaptureRequest(
    @NotBlank(message = "id is required")
    String id,
    @NotBlank(message = "authorId is required")
    String authorId,
    String threadId,
    String content,
    List<String> mediaUrls,
    List<String> hashtags,
    List<String> mentions,
    Instant createdAt,
    @JsonProperty("isRetweet") Boolean retweet,
    String originalTweetId,
    String inReplyToTweetId,
    @JsonProperty("isQuoteTweet") Boolean quoteTweet,
    String quotedTweetId,
    String language,
    String source,
    @PositiveOrZero Long retweetCount,
    @PositiveOrZero Long likeCount,
    @PositiveOrZero Long replyCount,
    @PositiveOrZero Long quoteCount,
    @PositiveOrZero Long viewCount
) {}

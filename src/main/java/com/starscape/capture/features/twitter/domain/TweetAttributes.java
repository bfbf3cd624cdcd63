package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.ValueObject;
import com.starscape.capture.common.exception.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Content of a captured tweet. A retweet names its original, a quote tweet names the quoted tweet.
 */
public record TweetAttributes(
    String content,
    List<String> mediaUrls,
    List<String> hashtags,
    List<String> mentions,
    Instant createdAt,
    boolean retweet,
    String originalTweetId,
    String inReplyToTweetId,
    boolean quoteTweet,
    String quotedTweetId,
    String language,
    String source
) implements ValueObject {

    public TweetAttributes {
        Guard.requireNonNull("content", content);
        mediaUrls = Guard.copyOf("mediaUrls", mediaUrls);
        hashtags = Guard.copyOf("hashtags", hashtags);
        mentions = Guard.copyOf("mentions", mentions);
        Guard.requireNonNull("createdAt", createdAt);
        if (retweet && (originalTweetId == null || originalTweetId.isBlank())) {
            throw new ValidationException("originalTweetId", "originalTweetId is required for retweets");
        }
        if (quoteTweet && (quotedTweetId == null || quotedTweetId.isBlank())) {
            throw new ValidationException("quotedTweetId", "quotedTweetId is required for quote tweets");
        }
    }

    public boolean isReply() {
        return inReplyToTweetId != null;
    }

    public boolean hasMedia() {
        return !mediaUrls.isEmpty();
    }

    TweetAttributes withHashtag(String hashtag) {
        List<String> updated = new ArrayList<>(hashtags);
        updated.add(hashtag);
        return new TweetAttributes(content, mediaUrls, updated, mentions, createdAt, retweet, originalTweetId,
                inReplyToTweetId, quoteTweet, quotedTweetId, language, source);
    }

    TweetAttributes withMention(String mention) {
        List<String> updated = new ArrayList<>(mentions);
        updated.add(mention);
        return new TweetAttributes(content, mediaUrls, hashtags, updated, createdAt, retweet, originalTweetId,
                inReplyToTweetId, quoteTweet, quotedTweetId, language, source);
    }
}

package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.features.twitter.domain.events.TweetLiked;
import com.starscape.capture.features.twitter.domain.events.TweetRetweeted;
import com.starscape.capture.features.twitter.domain.events.TweetSaved;

import java.time.Instant;
import java.util.Optional;

public class Tweet extends AggregateRoot<TweetId> {

    public static final String AGGREGATE_TYPE = "twitter.tweet";

    private final TweetId id;
    private final UserId authorId;
    private TweetAttributes attributes;
    private TweetCounters counters;
    private ThreadId threadId;
    private final Instant savedAt;
    private Instant likedAt;
    private Instant retweetedAt;

    private Tweet(TweetId id, UserId authorId, TweetAttributes attributes, TweetCounters counters,
                  ThreadId threadId, Instant savedAt) {
        this.id = Guard.requireNonNull("tweetId", id);
        this.authorId = Guard.requireNonNull("authorId", authorId);
        this.attributes = Guard.requireNonNull("attributes", attributes);
        this.counters = Guard.requireNonNull("counters", counters);
        this.threadId = threadId;
        this.savedAt = savedAt;
    }

    public static Tweet capture(TweetId id, UserId authorId, TweetAttributes attributes, TweetCounters counters,
                                ThreadId threadId) {
        Tweet tweet = new Tweet(id, authorId, attributes, counters, threadId, Instant.now());
        tweet.record(new TweetSaved(id.value(), authorId.value(), threadId != null ? threadId.value() : null,
                attributes, counters, tweet.savedAt));
        return tweet;
    }

    public static Tweet fromSnapshot(Snapshot snapshot) {
        Tweet tweet = new Tweet(
            TweetId.of(snapshot.id()),
            UserId.of(snapshot.authorId()),
            snapshot.attributes(),
            snapshot.counters(),
            snapshot.threadId() != null ? ThreadId.of(snapshot.threadId()) : null,
            snapshot.savedAt()
        );
        tweet.likedAt = snapshot.likedAt();
        tweet.retweetedAt = snapshot.retweetedAt();
        return tweet;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), authorId.value(), attributes, counters,
                threadId != null ? threadId.value() : null, savedAt, likedAt, retweetedAt);
    }

    public void like() {
        if (isLiked()) {
            throw new AlreadyExistsException("ALREADY_LIKED", "Tweet " + id.value() + " is already liked");
        }
        this.likedAt = Instant.now();
        this.counters = counters.plusLike();
        record(new TweetLiked(id.value(), authorId.value(), counters.likes(), likedAt));
    }

    public void retweet() {
        if (isRetweeted()) {
            throw new AlreadyExistsException("ALREADY_RETWEETED", "Tweet " + id.value() + " is already retweeted");
        }
        this.retweetedAt = Instant.now();
        this.counters = counters.plusRetweet();
        record(new TweetRetweeted(id.value(), authorId.value(), counters.retweets(), retweetedAt));
    }

    public void updateEngagement(TweetCounters counters) {
        this.counters = Guard.requireNonNull("counters", counters);
    }

    public void addHashtag(String hashtag) {
        Guard.requireNonBlank("hashtag", hashtag);
        if (!attributes.hashtags().contains(hashtag)) {
            this.attributes = attributes.withHashtag(hashtag);
        }
    }

    public void addMention(String mention) {
        Guard.requireNonBlank("mention", mention);
        if (!attributes.mentions().contains(mention)) {
            this.attributes = attributes.withMention(mention);
        }
    }

    public void addToThread(ThreadId threadId) {
        this.threadId = Guard.requireNonNull("threadId", threadId);
    }

    public void removeFromThread() {
        this.threadId = null;
    }

    public boolean isLiked() {
        return likedAt != null;
    }

    public boolean isRetweeted() {
        return retweetedAt != null;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public TweetId getId() {
        return id;
    }

    // Getters
    public UserId getAuthorId() { return authorId; }
    public TweetAttributes getAttributes() { return attributes; }
    public TweetCounters getCounters() { return counters; }
    public Optional<ThreadId> getThreadId() { return Optional.ofNullable(threadId); }
    public Instant getSavedAt() { return savedAt; }
    public Optional<Instant> getLikedAt() { return Optional.ofNullable(likedAt); }
    public Optional<Instant> getRetweetedAt() { return Optional.ofNullable(retweetedAt); }

    public record Snapshot(
        String id,
        String authorId,
        TweetAttributes attributes,
        TweetCounters counters,
        String threadId,
        Instant savedAt,
        Instant likedAt,
        Instant retweetedAt
    ) {
    }
}

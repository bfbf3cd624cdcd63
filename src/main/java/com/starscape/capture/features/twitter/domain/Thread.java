package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.lifecycle.MembershipSet;
import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.twitter.domain.events.ThreadArchived;
import com.starscape.capture.features.twitter.domain.events.ThreadCreated;
import com.starscape.capture.features.twitter.domain.events.TweetAddedToThread;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ordered collection of tweets by one author. Archived threads accept no new tweets.
 */
public class Thread extends AggregateRoot<ThreadId> {

    public static final String AGGREGATE_TYPE = "twitter.thread";

    private final ThreadId id;
    private final UserId authorId;
    private String title;
    private String description;
    private boolean privateThread;
    private final Instant createdAt;
    private Instant updatedAt;
    private Instant archivedAt;
    private final MembershipSet<TweetId> tweets;

    private Thread(ThreadId id, UserId authorId, String title, String description, boolean privateThread,
                   Instant createdAt, Instant updatedAt, MembershipSet<TweetId> tweets) {
        this.id = Guard.requireNonNull("threadId", id);
        this.authorId = Guard.requireNonNull("authorId", authorId);
        this.title = title;
        this.description = description;
        this.privateThread = privateThread;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.tweets = tweets;
    }

    public static Thread create(ThreadId id, UserId authorId, String title, String description, boolean privateThread) {
        Instant now = Instant.now();
        Thread thread = new Thread(id, authorId, title, description, privateThread, now, now,
                MembershipSet.empty("tweet"));
        thread.record(new ThreadCreated(id.value(), authorId.value(), title, description, privateThread, now));
        return thread;
    }

    public static Thread fromSnapshot(Snapshot snapshot) {
        Thread thread = new Thread(
            ThreadId.of(snapshot.id()),
            UserId.of(snapshot.authorId()),
            snapshot.title(),
            snapshot.description(),
            snapshot.privateThread(),
            snapshot.createdAt(),
            snapshot.updatedAt(),
            MembershipSet.of("tweet", snapshot.tweetIds().stream().map(TweetId::of).toList())
        );
        thread.archivedAt = snapshot.archivedAt();
        return thread;
    }

    public Snapshot toSnapshot() {
        return new Snapshot(id.value(), authorId.value(), title, description, privateThread, createdAt, updatedAt,
                archivedAt, tweets.asList().stream().map(TweetId::value).toList());
    }

    public void addTweet(TweetId tweetId) {
        Guard.requireNonNull("tweetId", tweetId);
        if (isArchived()) {
            throw new InvalidStateException("THREAD_ARCHIVED", "Cannot add tweet to archived thread " + id.value());
        }
        if (tweets.contains(tweetId)) {
            throw new AlreadyExistsException("TWEET_ALREADY_IN_THREAD",
                    "Tweet " + tweetId.value() + " is already in thread " + id.value());
        }
        tweets.add(tweetId);
        this.updatedAt = Instant.now();
        record(new TweetAddedToThread(id.value(), tweetId.value(), authorId.value(), tweets.size() - 1, updatedAt));
    }

    public void removeTweet(TweetId tweetId) {
        tweets.remove(tweetId);
        this.updatedAt = Instant.now();
    }

    /**
     * Accepts only a permutation of the current tweets. A rejected order leaves the thread unchanged.
     */
    public void reorderTweets(List<TweetId> newOrder) {
        tweets.reorder(newOrder);
        this.updatedAt = Instant.now();
    }

    public void archive() {
        if (isArchived()) {
            throw new InvalidStateException("ALREADY_ARCHIVED", "Thread " + id.value() + " is already archived");
        }
        this.archivedAt = Instant.now();
        record(new ThreadArchived(id.value(), authorId.value(), archivedAt));
    }

    public void unarchive() {
        this.archivedAt = null;
    }

    public void updateMetadata(String title, String description) {
        this.title = title;
        this.description = description;
        this.updatedAt = Instant.now();
    }

    public void makePrivate() {
        this.privateThread = true;
        this.updatedAt = Instant.now();
    }

    public void makePublic() {
        this.privateThread = false;
        this.updatedAt = Instant.now();
    }

    public boolean isArchived() {
        return archivedAt != null;
    }

    public boolean isEmpty() {
        return tweets.isEmpty();
    }

    public Optional<TweetId> getFirstTweet() {
        return tweets.isEmpty() ? Optional.empty() : Optional.of(tweets.asList().get(0));
    }

    public Optional<TweetId> getLastTweet() {
        return tweets.isEmpty() ? Optional.empty() : Optional.of(tweets.asList().get(tweets.size() - 1));
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public ThreadId getId() {
        return id;
    }

    // Getters
    public UserId getAuthorId() { return authorId; }
    public Optional<String> getTitle() { return Optional.ofNullable(title); }
    public Optional<String> getDescription() { return Optional.ofNullable(description); }
    public boolean isPrivateThread() { return privateThread; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Optional<Instant> getArchivedAt() { return Optional.ofNullable(archivedAt); }
    public List<TweetId> getTweetIds() { return tweets.asList(); }
    public int getTweetCount() { return tweets.size(); }

    public record Snapshot(
        String id,
        String authorId,
        String title,
        String description,
        boolean privateThread,
        Instant createdAt,
        Instant updatedAt,
        Instant archivedAt,
        List<String> tweetIds
    ) {
    }
}

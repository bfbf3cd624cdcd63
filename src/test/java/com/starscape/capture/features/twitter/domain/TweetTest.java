package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.common.exception.ValidationException;
import com.starscape.capture.features.twitter.domain.events.TweetLiked;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TweetTest {

    private Tweet tweet;

    private static TweetAttributes attributes(boolean retweet, String originalTweetId) {
        return new TweetAttributes("Shipping day", List.of(), List.of("release"), List.of(), Instant.now(),
                retweet, originalTweetId, null, false, null, "en", "web");
    }

    @BeforeEach
    void setUp() {
        tweet = Tweet.capture(TweetId.of("1790000000000000001"), UserId.of("author-1"),
                attributes(false, null), TweetCounters.zero(), null);
        tweet.pullDomainEvents();
    }

    @Test
    void retweetRequiresOriginalTweet() {
        ValidationException ex = assertThrows(ValidationException.class, () -> attributes(true, null));
        assertEquals("originalTweetId", ex.getField());
    }

    @Test
    void derivedFlagsFollowAttributes() {
        TweetAttributes reply = new TweetAttributes("Agreed", List.of("https://pbs.example.com/1.jpg"), List.of(),
                List.of(), Instant.now(), false, null, "1790000000000000000", false, null, null, null);

        assertTrue(reply.isReply());
        assertTrue(reply.hasMedia());
        assertFalse(tweet.getAttributes().isReply());
        assertFalse(tweet.getAttributes().hasMedia());
    }

    @Test
    void likeOnceIncrementsCounter() {
        tweet.like();

        TweetLiked liked = assertInstanceOf(TweetLiked.class, tweet.pullDomainEvents().get(0));
        assertEquals(1, liked.likeCount());
        assertEquals(1, tweet.getCounters().likes());
    }

    @Test
    void duplicateLikeAndRetweetAreRejected() {
        tweet.like();
        tweet.retweet();
        tweet.pullDomainEvents();

        assertThrows(AlreadyExistsException.class, tweet::like);
        assertThrows(AlreadyExistsException.class, tweet::retweet);
        assertEquals(1, tweet.getCounters().likes());
        assertEquals(1, tweet.getCounters().retweets());
        assertTrue(tweet.pullDomainEvents().isEmpty());
    }

    @Test
    void hashtagsAndMentionsAreAddedOnce() {
        tweet.addHashtag("release");
        tweet.addHashtag("java");
        tweet.addMention("teammate");
        tweet.addMention("teammate");

        assertEquals(List.of("release", "java"), tweet.getAttributes().hashtags());
        assertEquals(List.of("teammate"), tweet.getAttributes().mentions());
    }
}

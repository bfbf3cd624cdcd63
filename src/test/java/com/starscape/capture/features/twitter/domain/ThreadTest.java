package com.starscape.capture.features.twitter.domain;

import com.starscape.capture.common.exception.AlreadyExistsException;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.features.twitter.domain.events.TweetAddedToThread;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThreadTest {

    private static final TweetId FIRST = TweetId.of("1");
    private static final TweetId SECOND = TweetId.of("2");
    private static final TweetId THIRD = TweetId.of("3");

    private Thread thread;

    @BeforeEach
    void setUp() {
        thread = Thread.create(ThreadId.of("thread-1"), UserId.of("author-1"), "Release notes", null, false);
        thread.addTweet(FIRST);
        thread.addTweet(SECOND);
        thread.addTweet(THIRD);
        thread.pullDomainEvents();
    }

    @Test
    void addedTweetCarriesItsPosition() {
        thread.addTweet(TweetId.of("4"));

        TweetAddedToThread added = assertInstanceOf(TweetAddedToThread.class, thread.pullDomainEvents().get(0));
        assertEquals(3, added.position());
        assertEquals(TweetId.of("4"), thread.getLastTweet().orElseThrow());
    }

    @Test
    void duplicateTweetIsRejected() {
        assertThrows(AlreadyExistsException.class, () -> thread.addTweet(SECOND));
        assertEquals(3, thread.getTweetCount());
    }

    @Test
    void reorderWithForeignIdLeavesOrderUnchanged() {
        List<TweetId> before = thread.getTweetIds();

        assertThrows(InvalidStateException.class, () -> thread.reorderTweets(List.of(THIRD, FIRST, TweetId.of("99"))));

        assertEquals(before, thread.getTweetIds());
    }

    @Test
    void reorderWithPermutationIsApplied() {
        thread.reorderTweets(List.of(THIRD, FIRST, SECOND));

        assertEquals(THIRD, thread.getFirstTweet().orElseThrow());
        assertEquals(SECOND, thread.getLastTweet().orElseThrow());
    }

    @Test
    void archivedThreadRejectsNewTweets() {
        thread.archive();

        InvalidStateException ex = assertThrows(InvalidStateException.class, () -> thread.addTweet(TweetId.of("4")));
        assertEquals("THREAD_ARCHIVED", ex.getCode());

        thread.unarchive();
        thread.addTweet(TweetId.of("4"));
        assertEquals(4, thread.getTweetCount());
    }
}

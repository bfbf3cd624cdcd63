package com.starscape.capture.features.twitter.app;

import com.starscape.capture.common.app.AggregateCommandExecutor;
import com.starscape.capture.features.twitter.api.dto.EngagementMetricsRequest;
import com.starscape.capture.features.twitter.api.dto.EngagementTrackRequest;
import com.starscape.capture.features.twitter.api.dto.ThreadCaptureRequest;
import com.starscape.capture.features.twitter.api.dto.TweetCaptureRequest;
import com.starscape.capture.features.twitter.api.dto.UserCaptureRequest;
import com.starscape.capture.features.twitter.api.dto.UserProfileRequest;
import com.starscape.capture.features.twitter.api.dto.UserStatsRequest;
import com.starscape.capture.features.twitter.domain.Engagement;
import com.starscape.capture.features.twitter.domain.EngagementPeriod;
import com.starscape.capture.features.twitter.domain.EngagementRepository;
import com.starscape.capture.features.twitter.domain.Thread;
import com.starscape.capture.features.twitter.domain.ThreadId;
import com.starscape.capture.features.twitter.domain.ThreadRepository;
import com.starscape.capture.features.twitter.domain.Tweet;
import com.starscape.capture.features.twitter.domain.TweetCounters;
import com.starscape.capture.features.twitter.domain.TweetId;
import com.starscape.capture.features.twitter.domain.TweetRepository;
import com.starscape.capture.features.twitter.domain.TwitterUser;
import com.starscape.capture.features.twitter.domain.TwitterUserRepository;
import com.starscape.capture.features.twitter.domain.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

import static java.util.Objects.requireNonNullElse;

/**
 * Capture and lifecycle commands for tweets, threads, accounts and engagement analytics.
 * Thread membership changes also point the member tweet at its thread when that tweet was captured.
 */
@Service
public class TwitterContentService {

    private static final Logger log = LoggerFactory.getLogger(TwitterContentService.class);

    private final TweetRepository tweetRepository;
    private final ThreadRepository threadRepository;
    private final TwitterUserRepository userRepository;
    private final EngagementRepository engagementRepository;
    private final AggregateCommandExecutor executor;

    public TwitterContentService(
            TweetRepository tweetRepository,
            ThreadRepository threadRepository,
            TwitterUserRepository userRepository,
            EngagementRepository engagementRepository,
            AggregateCommandExecutor executor) {
        this.tweetRepository = tweetRepository;
        this.threadRepository = threadRepository;
        this.userRepository = userRepository;
        this.engagementRepository = engagementRepository;
        this.executor = executor;
    }

    public Tweet captureTweet(TweetCaptureRequest request) {
        TweetId id = TweetId.of(request.id());
        UserId authorId = UserId.of(request.authorId());
        ThreadId threadId = request.threadId() != null ? ThreadId.of(request.threadId()) : null;
        var attributes = TwitterPayloads.tweetAttributes(request);
        var counters = TwitterPayloads.tweetCounters(request);
        return executor.create(tweetRepository, id, () -> Tweet.capture(id, authorId, attributes, counters, threadId));
    }

    public Thread createThread(ThreadCaptureRequest request) {
        ThreadId id = ThreadId.of(request.id());
        UserId authorId = UserId.of(request.authorId());
        boolean privateThread = Boolean.TRUE.equals(request.privateThread());
        return executor.create(threadRepository, id,
                () -> Thread.create(id, authorId, request.title(), request.description(), privateThread));
    }

    public TwitterUser captureUser(UserCaptureRequest request) {
        UserId id = UserId.of(request.id());
        var profile = TwitterPayloads.profile(request);
        var stats = TwitterPayloads.stats(request);
        boolean verified = Boolean.TRUE.equals(request.verified());
        boolean protectedAccount = Boolean.TRUE.equals(request.protectedAccount());
        return executor.create(userRepository, id,
                () -> TwitterUser.create(id, profile, stats, verified, protectedAccount));
    }

    public Engagement trackEngagement(EngagementTrackRequest request) {
        TweetId tweetId = TweetId.of(request.tweetId());
        UserId authorId = UserId.of(request.authorId());
        var metrics = TwitterPayloads.metrics(request.metrics());
        EngagementPeriod period = EngagementPeriod.fromValue(requireNonNullElse(request.period(), "day"));
        Instant startDate = request.startDate();
        Instant endDate = request.endDate();
        return executor.create(engagementRepository, tweetId,
                () -> Engagement.track(tweetId, authorId, metrics, period, startDate, endDate));
    }

    public Tweet likeTweet(String tweetId) {
        return executor.update(tweetRepository, TweetId.of(tweetId), Tweet::like);
    }

    public Tweet retweet(String tweetId) {
        return executor.update(tweetRepository, TweetId.of(tweetId), Tweet::retweet);
    }

    public Tweet updateTweetEngagement(String tweetId, TweetCounters counters) {
        log.debug("Refreshing engagement of tweet {}", tweetId);
        return executor.update(tweetRepository, TweetId.of(tweetId), tweet -> tweet.updateEngagement(counters));
    }

    public Tweet addHashtag(String tweetId, String hashtag) {
        return executor.update(tweetRepository, TweetId.of(tweetId), tweet -> tweet.addHashtag(hashtag));
    }

    public Tweet addMention(String tweetId, String mention) {
        return executor.update(tweetRepository, TweetId.of(tweetId), tweet -> tweet.addMention(mention));
    }

    public Thread addTweetToThread(String threadId, String tweetId) {
        ThreadId thread = ThreadId.of(threadId);
        TweetId tweet = TweetId.of(tweetId);
        Thread updated = executor.update(threadRepository, thread, t -> t.addTweet(tweet));
        if (tweetRepository.findById(tweet).isPresent()) {
            executor.update(tweetRepository, tweet, t -> t.addToThread(thread));
        }
        return updated;
    }

    public Thread removeTweetFromThread(String threadId, String tweetId) {
        TweetId tweet = TweetId.of(tweetId);
        Thread updated = executor.update(threadRepository, ThreadId.of(threadId), t -> t.removeTweet(tweet));
        if (tweetRepository.findById(tweet).isPresent()) {
            executor.update(tweetRepository, tweet, Tweet::removeFromThread);
        }
        return updated;
    }

    public Thread reorderThread(String threadId, List<String> tweetIds) {
        List<TweetId> newOrder = tweetIds == null ? null : tweetIds.stream().map(TweetId::of).toList();
        return executor.update(threadRepository, ThreadId.of(threadId), thread -> thread.reorderTweets(newOrder));
    }

    public Thread archiveThread(String threadId) {
        return executor.update(threadRepository, ThreadId.of(threadId), Thread::archive);
    }

    public Thread unarchiveThread(String threadId) {
        return executor.update(threadRepository, ThreadId.of(threadId), Thread::unarchive);
    }

    public Thread updateThreadMetadata(String threadId, String title, String description) {
        return executor.update(threadRepository, ThreadId.of(threadId),
                thread -> thread.updateMetadata(title, description));
    }

    public Thread setThreadVisibility(String threadId, boolean privateThread) {
        return executor.update(threadRepository, ThreadId.of(threadId),
                thread -> {
                    if (privateThread) {
                        thread.makePrivate();
                    } else {
                        thread.makePublic();
                    }
                });
    }

    public TwitterUser followUser(String userId) {
        return executor.update(userRepository, UserId.of(userId), TwitterUser::follow);
    }

    public TwitterUser unfollowUser(String userId) {
        return executor.update(userRepository, UserId.of(userId), TwitterUser::unfollow);
    }

    public TwitterUser updateUserProfile(String userId, UserProfileRequest request) {
        var profile = TwitterPayloads.profile(request);
        return executor.update(userRepository, UserId.of(userId), user -> user.updateProfile(profile));
    }

    public TwitterUser updateUserStats(String userId, UserStatsRequest request) {
        var stats = TwitterPayloads.stats(request);
        return executor.update(userRepository, UserId.of(userId), user -> user.updateStats(stats));
    }

    public TwitterUser verifyUser(String userId) {
        return executor.update(userRepository, UserId.of(userId), TwitterUser::verify);
    }

    public TwitterUser setUserProtection(String userId, boolean protectedAccount) {
        return executor.update(userRepository, UserId.of(userId),
                user -> {
                    if (protectedAccount) {
                        user.protect();
                    } else {
                        user.unprotect();
                    }
                });
    }

    public Engagement updateEngagementMetrics(String tweetId, EngagementMetricsRequest request) {
        log.debug("Refreshing engagement metrics of tweet {}", tweetId);
        return executor.update(engagementRepository, TweetId.of(tweetId),
                engagement -> engagement.updateMetrics(TwitterPayloads.mergeMetrics(engagement.getMetrics(), request)));
    }

    public Engagement analyzeEngagement(String tweetId) {
        return executor.update(engagementRepository, TweetId.of(tweetId), Engagement::analyze);
    }

    public Engagement addEngagementInsight(String tweetId, String insight) {
        return executor.update(engagementRepository, TweetId.of(tweetId),
                engagement -> engagement.addCustomInsight(insight));
    }

    public Engagement removeEngagementInsight(String tweetId, String insight) {
        return executor.update(engagementRepository, TweetId.of(tweetId),
                engagement -> engagement.removeInsight(insight));
    }
}

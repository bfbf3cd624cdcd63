package com.starscape.capture.features.instagram.app;

import com.starscape.capture.common.app.AggregateCommandExecutor;
import com.starscape.capture.common.config.CaptureProperties;
import com.starscape.capture.features.instagram.api.dto.PostCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.ReelCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.StoryCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.UserCaptureRequest;
import com.starscape.capture.features.instagram.api.dto.UserProfileRequest;
import com.starscape.capture.features.instagram.api.dto.UserStatsRequest;
import com.starscape.capture.features.instagram.domain.InstagramUser;
import com.starscape.capture.features.instagram.domain.InstagramUserRepository;
import com.starscape.capture.features.instagram.domain.Post;
import com.starscape.capture.features.instagram.domain.PostId;
import com.starscape.capture.features.instagram.domain.PostRepository;
import com.starscape.capture.features.instagram.domain.Reel;
import com.starscape.capture.features.instagram.domain.ReelId;
import com.starscape.capture.features.instagram.domain.ReelRepository;
import com.starscape.capture.features.instagram.domain.Story;
import com.starscape.capture.features.instagram.domain.StoryId;
import com.starscape.capture.features.instagram.domain.StoryRepository;
import com.starscape.capture.features.instagram.domain.UserId;
import com.starscape.capture.features.instagram.domain.UserStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Capture and lifecycle commands for Instagram posts, reels, stories and accounts.
 */
@Service
public class InstagramContentService {

    private static final Logger log = LoggerFactory.getLogger(InstagramContentService.class);

    private final PostRepository postRepository;
    private final ReelRepository reelRepository;
    private final StoryRepository storyRepository;
    private final InstagramUserRepository userRepository;
    private final AggregateCommandExecutor executor;
    private final CaptureProperties properties;

    public InstagramContentService(
            PostRepository postRepository,
            ReelRepository reelRepository,
            StoryRepository storyRepository,
            InstagramUserRepository userRepository,
            AggregateCommandExecutor executor,
            CaptureProperties properties) {
        this.postRepository = postRepository;
        this.reelRepository = reelRepository;
        this.storyRepository = storyRepository;
        this.userRepository = userRepository;
        this.executor = executor;
        this.properties = properties;
    }

    public Post capturePost(PostCaptureRequest request) {
        PostId id = PostId.of(request.id());
        UserId authorId = UserId.of(request.authorId());
        var metadata = InstagramPayloads.postMetadata(request);
        return executor.create(postRepository, id, () -> Post.capture(id, authorId, metadata));
    }

    public Reel captureReel(ReelCaptureRequest request) {
        ReelId id = ReelId.of(request.id());
        UserId authorId = UserId.of(request.authorId());
        var attributes = InstagramPayloads.reelAttributes(request);
        return executor.create(reelRepository, id, () -> Reel.capture(id, authorId, attributes));
    }

    public Story captureStory(StoryCaptureRequest request) {
        StoryId id = StoryId.of(request.id());
        UserId authorId = UserId.of(request.authorId());
        var attributes = InstagramPayloads.storyAttributes(request, properties.getStoryLifetime());
        return executor.create(storyRepository, id, () -> Story.capture(id, authorId, attributes));
    }

    public InstagramUser captureUser(UserCaptureRequest request) {
        UserId id = UserId.of(request.id());
        var profile = InstagramPayloads.userProfile(request);
        var stats = InstagramPayloads.userStats(request);
        boolean verified = Boolean.TRUE.equals(request.verified());
        boolean privateAccount = Boolean.TRUE.equals(request.privateAccount());
        return executor.create(userRepository, id,
                () -> InstagramUser.create(id, profile, stats, verified, privateAccount));
    }

    public Post updatePostEngagement(String postId, long likesCount, long commentsCount) {
        log.debug("Refreshing engagement of post {}", postId);
        return executor.update(postRepository, PostId.of(postId),
                post -> post.updateEngagement(likesCount, commentsCount));
    }

    public Reel shareReel(String reelId) {
        return executor.update(reelRepository, ReelId.of(reelId), Reel::share);
    }

    public Reel updateReelEngagement(String reelId, long viewsCount, long likesCount, long commentsCount) {
        log.debug("Refreshing engagement of reel {}", reelId);
        return executor.update(reelRepository, ReelId.of(reelId),
                reel -> reel.updateEngagement(viewsCount, likesCount, commentsCount));
    }

    public Reel addReelHashtag(String reelId, String hashtag) {
        return executor.update(reelRepository, ReelId.of(reelId), reel -> reel.addHashtag(hashtag));
    }

    public Reel removeReelHashtag(String reelId, String hashtag) {
        return executor.update(reelRepository, ReelId.of(reelId), reel -> reel.removeHashtag(hashtag));
    }

    public Story viewStory(String storyId) {
        return executor.update(storyRepository, StoryId.of(storyId), Story::markAsViewed);
    }

    public Story archiveStory(String storyId) {
        return executor.update(storyRepository, StoryId.of(storyId), Story::archive);
    }

    public Story highlightStory(String storyId, boolean highlighted) {
        return executor.update(storyRepository, StoryId.of(storyId),
                story -> {
                    if (highlighted) {
                        story.highlight();
                    } else {
                        story.removeHighlight();
                    }
                });
    }

    public InstagramUser followUser(String userId) {
        return executor.update(userRepository, UserId.of(userId), InstagramUser::follow);
    }

    public InstagramUser unfollowUser(String userId) {
        return executor.update(userRepository, UserId.of(userId), InstagramUser::unfollow);
    }

    public InstagramUser updateUserProfile(String userId, UserProfileRequest request) {
        var profile = InstagramPayloads.userProfile(request);
        return executor.update(userRepository, UserId.of(userId), user -> user.updateProfile(profile));
    }

    public InstagramUser updateUserStats(String userId, UserStatsRequest request) {
        UserStats stats = InstagramPayloads.userStats(request);
        return executor.update(userRepository, UserId.of(userId), user -> user.updateStats(stats));
    }

    public InstagramUser verifyUser(String userId) {
        return executor.update(userRepository, UserId.of(userId), InstagramUser::verify);
    }

    public InstagramUser setUserVisibility(String userId, boolean privateAccount) {
        return executor.update(userRepository, UserId.of(userId),
                user -> {
                    if (privateAccount) {
                        user.makePrivate();
                    } else {
                        user.makePublic();
                    }
                });
    }
}

package com.starscape.capture.features.twitter.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.twitter.domain.Tweet;
import com.starscape.capture.features.twitter.domain.TweetId;
import com.starscape.capture.features.twitter.domain.TweetRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTweetRepository extends InMemorySnapshotRepository<Tweet, TweetId, Tweet.Snapshot>
        implements TweetRepository {

    @Override
    protected Tweet.Snapshot toSnapshot(Tweet aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Tweet fromSnapshot(Tweet.Snapshot snapshot) {
        return Tweet.fromSnapshot(snapshot);
    }
}

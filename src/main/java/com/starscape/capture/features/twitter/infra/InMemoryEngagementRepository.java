package com.starscape.capture.features.twitter.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.twitter.domain.Engagement;
import com.starscape.capture.features.twitter.domain.TweetId;
import com.starscape.capture.features.twitter.domain.EngagementRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryEngagementRepository extends InMemorySnapshotRepository<Engagement, TweetId, Engagement.Snapshot>
        implements EngagementRepository {

    @Override
    protected Engagement.Snapshot toSnapshot(Engagement aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Engagement fromSnapshot(Engagement.Snapshot snapshot) {
        return Engagement.fromSnapshot(snapshot);
    }
}

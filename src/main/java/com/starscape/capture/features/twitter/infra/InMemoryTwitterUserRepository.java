package com.starscape.capture.features.twitter.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.twitter.domain.TwitterUser;
import com.starscape.capture.features.twitter.domain.UserId;
import com.starscape.capture.features.twitter.domain.TwitterUserRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTwitterUserRepository extends InMemorySnapshotRepository<TwitterUser, UserId, TwitterUser.Snapshot>
        implements TwitterUserRepository {

    @Override
    protected TwitterUser.Snapshot toSnapshot(TwitterUser aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected TwitterUser fromSnapshot(TwitterUser.Snapshot snapshot) {
        return TwitterUser.fromSnapshot(snapshot);
    }
}

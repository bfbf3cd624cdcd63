package com.starscape.capture.features.instagram.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.instagram.domain.InstagramUser;
import com.starscape.capture.features.instagram.domain.UserId;
import com.starscape.capture.features.instagram.domain.InstagramUserRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryInstagramUserRepository extends InMemorySnapshotRepository<InstagramUser, UserId, InstagramUser.Snapshot>
        implements InstagramUserRepository {

    @Override
    protected InstagramUser.Snapshot toSnapshot(InstagramUser aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected InstagramUser fromSnapshot(InstagramUser.Snapshot snapshot) {
        return InstagramUser.fromSnapshot(snapshot);
    }
}

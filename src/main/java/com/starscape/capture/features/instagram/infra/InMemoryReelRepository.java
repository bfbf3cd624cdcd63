package com.starscape.capture.features.instagram.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.instagram.domain.Reel;
import com.starscape.capture.features.instagram.domain.ReelId;
import com.starscape.capture.features.instagram.domain.ReelRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryReelRepository extends InMemorySnapshotRepository<Reel, ReelId, Reel.Snapshot>
        implements ReelRepository {

    @Override
    protected Reel.Snapshot toSnapshot(Reel aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Reel fromSnapshot(Reel.Snapshot snapshot) {
        return Reel.fromSnapshot(snapshot);
    }
}

package com.starscape.capture.features.twitter.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.twitter.domain.Thread;
import com.starscape.capture.features.twitter.domain.ThreadId;
import com.starscape.capture.features.twitter.domain.ThreadRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryThreadRepository extends InMemorySnapshotRepository<Thread, ThreadId, Thread.Snapshot>
        implements ThreadRepository {

    @Override
    protected Thread.Snapshot toSnapshot(Thread aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Thread fromSnapshot(Thread.Snapshot snapshot) {
        return Thread.fromSnapshot(snapshot);
    }
}

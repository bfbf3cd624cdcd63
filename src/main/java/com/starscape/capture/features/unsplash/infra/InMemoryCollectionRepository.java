package com.starscape.capture.features.unsplash.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.unsplash.domain.Collection;
import com.starscape.capture.features.unsplash.domain.CollectionId;
import com.starscape.capture.features.unsplash.domain.CollectionRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCollectionRepository extends InMemorySnapshotRepository<Collection, CollectionId, Collection.Snapshot>
        implements CollectionRepository {

    @Override
    protected Collection.Snapshot toSnapshot(Collection aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Collection fromSnapshot(Collection.Snapshot snapshot) {
        return Collection.fromSnapshot(snapshot);
    }
}

package com.starscape.capture.features.unsplash.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.unsplash.domain.Photo;
import com.starscape.capture.features.unsplash.domain.PhotoId;
import com.starscape.capture.features.unsplash.domain.PhotoRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryPhotoRepository extends InMemorySnapshotRepository<Photo, PhotoId, Photo.Snapshot>
        implements PhotoRepository {

    @Override
    protected Photo.Snapshot toSnapshot(Photo aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Photo fromSnapshot(Photo.Snapshot snapshot) {
        return Photo.fromSnapshot(snapshot);
    }
}

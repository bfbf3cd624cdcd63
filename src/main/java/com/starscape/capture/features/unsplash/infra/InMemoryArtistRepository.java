package com.starscape.capture.features.unsplash.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.unsplash.domain.Artist;
import com.starscape.capture.features.unsplash.domain.ArtistId;
import com.starscape.capture.features.unsplash.domain.ArtistRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryArtistRepository extends InMemorySnapshotRepository<Artist, ArtistId, Artist.Snapshot>
        implements ArtistRepository {

    @Override
    protected Artist.Snapshot toSnapshot(Artist aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Artist fromSnapshot(Artist.Snapshot snapshot) {
        return Artist.fromSnapshot(snapshot);
    }
}

package com.starscape.capture.features.video.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.video.domain.Playlist;
import com.starscape.capture.features.video.domain.PlaylistId;
import com.starscape.capture.features.video.domain.PlaylistRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryPlaylistRepository extends InMemorySnapshotRepository<Playlist, PlaylistId, Playlist.Snapshot>
        implements PlaylistRepository {

    @Override
    protected Playlist.Snapshot toSnapshot(Playlist aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Playlist fromSnapshot(Playlist.Snapshot snapshot) {
        return Playlist.fromSnapshot(snapshot);
    }
}

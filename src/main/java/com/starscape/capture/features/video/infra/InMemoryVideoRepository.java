package com.starscape.capture.features.video.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.video.domain.Video;
import com.starscape.capture.features.video.domain.VideoId;
import com.starscape.capture.features.video.domain.VideoRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryVideoRepository extends InMemorySnapshotRepository<Video, VideoId, Video.Snapshot>
        implements VideoRepository {

    @Override
    protected Video.Snapshot toSnapshot(Video aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Video fromSnapshot(Video.Snapshot snapshot) {
        return Video.fromSnapshot(snapshot);
    }
}

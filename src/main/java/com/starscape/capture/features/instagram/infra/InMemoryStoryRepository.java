package com.starscape.capture.features.instagram.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.instagram.domain.Story;
import com.starscape.capture.features.instagram.domain.StoryId;
import com.starscape.capture.features.instagram.domain.StoryRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryStoryRepository extends InMemorySnapshotRepository<Story, StoryId, Story.Snapshot>
        implements StoryRepository {

    @Override
    protected Story.Snapshot toSnapshot(Story aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Story fromSnapshot(Story.Snapshot snapshot) {
        return Story.fromSnapshot(snapshot);
    }
}

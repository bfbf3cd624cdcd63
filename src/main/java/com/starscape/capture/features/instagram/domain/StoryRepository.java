package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.DownloadableRepository;

public interface StoryRepository extends DownloadableRepository<Story, StoryId> {

    @Override
    default String aggregateType() {
        return Story.AGGREGATE_TYPE;
    }

    @Override
    default StoryId parseId(String rawId) {
        return StoryId.of(rawId);
    }
}

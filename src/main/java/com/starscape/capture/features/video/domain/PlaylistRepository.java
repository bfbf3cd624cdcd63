package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface PlaylistRepository extends AggregateRepository<Playlist, PlaylistId> {

    @Override
    default String aggregateType() {
        return Playlist.AGGREGATE_TYPE;
    }
}

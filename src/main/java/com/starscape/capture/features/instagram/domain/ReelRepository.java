package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.DownloadableRepository;

public interface ReelRepository extends DownloadableRepository<Reel, ReelId> {

    @Override
    default String aggregateType() {
        return Reel.AGGREGATE_TYPE;
    }

    @Override
    default ReelId parseId(String rawId) {
        return ReelId.of(rawId);
    }
}

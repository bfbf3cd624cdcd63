package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.DownloadableRepository;

public interface PinRepository extends DownloadableRepository<Pin, PinId> {

    @Override
    default String aggregateType() {
        return Pin.AGGREGATE_TYPE;
    }

    @Override
    default PinId parseId(String rawId) {
        return PinId.of(rawId);
    }
}

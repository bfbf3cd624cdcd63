package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.AggregateRepository;

public interface LicenseRepository extends AggregateRepository<License, LicenseId> {

    @Override
    default String aggregateType() {
        return License.AGGREGATE_TYPE;
    }
}

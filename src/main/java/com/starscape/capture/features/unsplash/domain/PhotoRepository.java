package com.starscape.capture.features.unsplash.domain;

import com.starscape.capture.common.domain.DownloadableRepository;

public interface PhotoRepository extends DownloadableRepository<Photo, PhotoId> {

    @Override
    default String aggregateType() {
        return Photo.AGGREGATE_TYPE;
    }

    @Override
    default PhotoId parseId(String rawId) {
        return PhotoId.of(rawId);
    }
}

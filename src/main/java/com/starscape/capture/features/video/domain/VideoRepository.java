package com.starscape.capture.features.video.domain;

import com.starscape.capture.common.domain.DownloadableRepository;

public interface VideoRepository extends DownloadableRepository<Video, VideoId> {

    @Override
    default String aggregateType() {
        return Video.AGGREGATE_TYPE;
    }

    @Override
    default VideoId parseId(String rawId) {
        return VideoId.of(rawId);
    }
}

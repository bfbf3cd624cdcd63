package com.starscape.capture.features.instagram.domain;

import com.starscape.capture.common.domain.DownloadableRepository;

public interface PostRepository extends DownloadableRepository<Post, PostId> {

    @Override
    default String aggregateType() {
        return Post.AGGREGATE_TYPE;
    }

    @Override
    default PostId parseId(String rawId) {
        return PostId.of(rawId);
    }
}

package com.starscape.capture.features.instagram.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.instagram.domain.Post;
import com.starscape.capture.features.instagram.domain.PostId;
import com.starscape.capture.features.instagram.domain.PostRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryPostRepository extends InMemorySnapshotRepository<Post, PostId, Post.Snapshot>
        implements PostRepository {

    @Override
    protected Post.Snapshot toSnapshot(Post aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Post fromSnapshot(Post.Snapshot snapshot) {
        return Post.fromSnapshot(snapshot);
    }
}

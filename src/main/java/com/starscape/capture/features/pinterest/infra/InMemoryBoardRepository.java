package com.starscape.capture.features.pinterest.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.pinterest.domain.Board;
import com.starscape.capture.features.pinterest.domain.BoardId;
import com.starscape.capture.features.pinterest.domain.BoardRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBoardRepository extends InMemorySnapshotRepository<Board, BoardId, Board.Snapshot>
        implements BoardRepository {

    @Override
    protected Board.Snapshot toSnapshot(Board aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Board fromSnapshot(Board.Snapshot snapshot) {
        return Board.fromSnapshot(snapshot);
    }
}

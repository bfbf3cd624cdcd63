package com.starscape.capture.features.pinterest.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.pinterest.domain.Pin;
import com.starscape.capture.features.pinterest.domain.PinId;
import com.starscape.capture.features.pinterest.domain.PinRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryPinRepository extends InMemorySnapshotRepository<Pin, PinId, Pin.Snapshot>
        implements PinRepository {

    @Override
    protected Pin.Snapshot toSnapshot(Pin aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected Pin fromSnapshot(Pin.Snapshot snapshot) {
        return Pin.fromSnapshot(snapshot);
    }
}

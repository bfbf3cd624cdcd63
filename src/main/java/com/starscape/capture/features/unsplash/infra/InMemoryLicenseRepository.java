package com.starscape.capture.features.unsplash.infra;

import com.starscape.capture.common.persistence.InMemorySnapshotRepository;
import com.starscape.capture.features.unsplash.domain.License;
import com.starscape.capture.features.unsplash.domain.LicenseId;
import com.starscape.capture.features.unsplash.domain.LicenseRepository;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryLicenseRepository extends InMemorySnapshotRepository<License, LicenseId, License.Snapshot>
        implements LicenseRepository {

    @Override
    protected License.Snapshot toSnapshot(License aggregate) {
        return aggregate.toSnapshot();
    }

    @Override
    protected License fromSnapshot(License.Snapshot snapshot) {
        return License.fromSnapshot(snapshot);
    }
}

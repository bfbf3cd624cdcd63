package com.starscape.capture.common.persistence;

import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Identifier;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps aggregates as immutable snapshots. Every load rebuilds a fresh instance,
 * so two callers never share one aggregate for in-place mutation. Pending events
 * are not part of a snapshot.
 */
public abstract class InMemorySnapshotRepository<A extends AggregateRoot<ID>, ID extends Identifier, S> {

    private final ConcurrentMap<String, S> snapshots = new ConcurrentHashMap<>();

    protected abstract S toSnapshot(A aggregate);

    protected abstract A fromSnapshot(S snapshot);

    public A save(A aggregate) {
        snapshots.put(aggregate.getId().value(), toSnapshot(aggregate));
        return aggregate;
    }

    public Optional<A> findById(ID id) {
        return Optional.ofNullable(snapshots.get(id.value())).map(this::fromSnapshot);
    }
}

package com.starscape.capture.common.domain;

import java.util.Optional;

public interface AggregateRepository<A extends AggregateRoot<ID>, ID extends Identifier> {

    String aggregateType();

    A save(A aggregate);

    Optional<A> findById(ID id);
}

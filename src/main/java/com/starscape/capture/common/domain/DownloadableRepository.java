package com.starscape.capture.common.domain;

/**
 * Repository of downloadable content, addressable by content type and raw id
 * so that completion notices can be routed without knowing the concrete aggregate.
 */
public interface DownloadableRepository<A extends AggregateRoot<ID> & Downloadable, ID extends Identifier>
        extends AggregateRepository<A, ID> {

    ID parseId(String rawId);
}

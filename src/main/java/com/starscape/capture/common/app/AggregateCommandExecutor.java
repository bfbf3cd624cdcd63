package com.starscape.capture.common.app;

import com.starscape.capture.common.concurrency.AggregateLocks;
import com.starscape.capture.common.domain.AggregateRepository;
import com.starscape.capture.common.domain.AggregateRoot;
import com.starscape.capture.common.domain.Identifier;
import com.starscape.capture.common.exception.InvalidStateException;
import com.starscape.capture.common.exception.NotFoundException;
import com.starscape.capture.common.observability.MdcKeys;
import com.starscape.capture.common.outbox.OutboxService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs one command against one aggregate: lock by id, load, mutate, save, drain events.
 * Events are serialized before the aggregate is saved, so a rejected command or an
 * unserializable event leaves both the stored snapshot and the outbox as they were.
 */
@Component
public class AggregateCommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(AggregateCommandExecutor.class);

    private final AggregateLocks locks;
    private final OutboxService outboxService;

    public AggregateCommandExecutor(AggregateLocks locks, OutboxService outboxService) {
        this.locks = locks;
        this.outboxService = outboxService;
    }

    /**
     * Create the aggregate unless one with the same id is already stored, in which case
     * the stored one is returned unchanged.
     */
    public <A extends AggregateRoot<ID>, ID extends Identifier> A create(
            AggregateRepository<A, ID> repository, ID id, Supplier<A> factory) {
        return locks.withLock(repository.aggregateType(), id.value(), () -> {
            var existing = repository.findById(id);
            if (existing.isPresent()) {
                log.debug("{} {} already captured, keeping stored state", repository.aggregateType(), id.value());
                return existing.get();
            }
            A aggregate = factory.get();
            var events = outboxService.prepare(aggregate);
            repository.save(aggregate);
            outboxService.store(events);
            log.info("Captured {} {}", repository.aggregateType(), id.value());
            return aggregate;
        });
    }

    public <A extends AggregateRoot<ID>, ID extends Identifier> A update(
            AggregateRepository<A, ID> repository, ID id, Consumer<? super A> command) {
        return locks.withLock(repository.aggregateType(), id.value(), () -> {
            MDC.put(MdcKeys.AGGREGATE_TYPE, repository.aggregateType());
            MDC.put(MdcKeys.AGGREGATE_ID, id.value());
            try {
                A aggregate = load(repository, id);
                command.accept(aggregate);
                var events = outboxService.prepare(aggregate);
                repository.save(aggregate);
                outboxService.store(events);
                events.forEach(e -> log.info("{} {}: {}", repository.aggregateType(), id.value(), e.getEventType()));
                return aggregate;
            } catch (InvalidStateException e) {
                log.warn("Rejected command on {} {}: {}", repository.aggregateType(), id.value(), e.getMessage());
                throw e;
            } finally {
                MDC.remove(MdcKeys.AGGREGATE_TYPE);
                MDC.remove(MdcKeys.AGGREGATE_ID);
            }
        });
    }

    public <A extends AggregateRoot<ID>, ID extends Identifier> A load(AggregateRepository<A, ID> repository, ID id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException(repository.aggregateType() + " not found: " + id.value()));
    }
}

package dk.cloudcreate.streamstore.aggregates.repository;

import dk.cloudcreate.streamstore.aggregates.EventSource;
import dk.cloudcreate.streamstore.aggregates.correlated.CorrelatedAggregate;
import dk.cloudcreate.streamstore.common.correlation.CorrelatedMessage;

import java.util.*;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.*;

/**
 * {@link CorrelatedRepository} that delegates persistence to another {@link Repository} (typically a {@link StreamStoreRepository}).<br>
 * Before saving, every pending {@link CorrelatedMessage} event is checked for a complete set of tracing identifiers.
 */
public final class CorrelatedStreamStoreRepository implements CorrelatedRepository {
    private final Repository delegate;

    public CorrelatedStreamStoreRepository(Repository delegate) {
        this.delegate = checkNotNull(delegate, "No delegate repository provided");
    }

    @Override
    public <ID, AGGREGATE extends CorrelatedAggregate<ID, AGGREGATE>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId, CorrelatedMessage source) {
        checkNotNull(source, "No source provided");
        return delegate.getById(aggregateType, aggregateId).source(source);
    }

    @Override
    public <ID, AGGREGATE extends CorrelatedAggregate<ID, AGGREGATE>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId, int version, CorrelatedMessage source) {
        checkNotNull(source, "No source provided");
        return delegate.getById(aggregateType, aggregateId, version).source(source);
    }

    @Override
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId) {
        return delegate.getById(aggregateType, aggregateId);
    }

    @Override
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId, int version) {
        return delegate.getById(aggregateType, aggregateId, version);
    }

    @Override
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE updateToCurrent(AGGREGATE aggregate) {
        return delegate.updateToCurrent(aggregate);
    }

    /**
     * @throws IllegalStateException if a pending {@link CorrelatedMessage} event is missing its messageId, correlationId or causationId
     */
    @Override
    public <ID> void save(EventSource<ID> aggregate, UUID commitId, Consumer<Map<String, Object>> updateHeaders) {
        checkNotNull(aggregate, "No aggregate provided");
        for (var event : aggregate.pendingEvents()) {
            if (event instanceof CorrelatedMessage) {
                var message = (CorrelatedMessage) event;
                checkState(message.messageId() != null && message.correlationId() != null && message.causationId() != null,
                           "Event '%s' raised by aggregate '%s' with id '%s' is missing tracing identifiers (messageId: %s, correlationId: %s, causationId: %s)",
                           event.getClass().getName(),
                           aggregate.getClass().getName(),
                           aggregate.aggregateId(),
                           message.messageId(),
                           message.correlationId(),
                           message.causationId());
            }
        }
        delegate.save(aggregate, commitId, updateHeaders);
    }

    @Override
    public <ID> void delete(EventSource<ID> aggregate) {
        delegate.delete(aggregate);
    }

    @Override
    public <ID> void hardDelete(EventSource<ID> aggregate) {
        delegate.hardDelete(aggregate);
    }
}

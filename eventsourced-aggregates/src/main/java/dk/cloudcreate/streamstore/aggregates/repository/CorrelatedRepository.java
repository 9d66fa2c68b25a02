package dk.cloudcreate.streamstore.aggregates.repository;

import dk.cloudcreate.streamstore.aggregates.*;
import dk.cloudcreate.streamstore.aggregates.correlated.CorrelatedAggregate;
import dk.cloudcreate.streamstore.common.correlation.CorrelatedMessage;

import java.util.Optional;

/**
 * {@link Repository} for {@link CorrelatedAggregate}s that loads aggregates with the message that causes the events they are about to raise
 */
public interface CorrelatedRepository extends Repository {
    /**
     * Load the latest version of an aggregate and set its {@link CorrelatedAggregate#source(CorrelatedMessage) source}
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the aggregate id
     * @param source        the message that will cause the events raised by the aggregate
     * @return the hydrated aggregate
     * @throws AggregateNotFoundException if the aggregate doesn't exist ({@link AggregateDeletedException} if it has been deleted)
     */
    <ID, AGGREGATE extends CorrelatedAggregate<ID, AGGREGATE>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId, CorrelatedMessage source);

    /**
     * Same as {@link #getById(Class, Object, CorrelatedMessage)} but loads the aggregate as it was after its first <code>version</code> events
     *
     * @throws AggregateVersionException if the aggregate's stream contains fewer than <code>version</code> events
     */
    <ID, AGGREGATE extends CorrelatedAggregate<ID, AGGREGATE>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId, int version, CorrelatedMessage source);

    default <ID, AGGREGATE extends CorrelatedAggregate<ID, AGGREGATE>> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, ID aggregateId, CorrelatedMessage source) {
        try {
            return Optional.of(getById(aggregateType, aggregateId, source));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    default <ID, AGGREGATE extends CorrelatedAggregate<ID, AGGREGATE>> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, ID aggregateId, int version, CorrelatedMessage source) {
        try {
            return Optional.of(getById(aggregateType, aggregateId, version, source));
        } catch (AggregateNotFoundException | AggregateVersionException e) {
            return Optional.empty();
        }
    }
}

package dk.cloudcreate.streamstore.aggregates.repository;

import dk.cloudcreate.streamstore.aggregates.*;

import java.util.*;
import java.util.function.Consumer;

/**
 * Loads and persists {@link EventSource} aggregates, one stream per aggregate instance.
 *
 * @see StreamStoreRepository
 * @see CorrelatedStreamStoreRepository
 * @see CachingRepository
 */
public interface Repository {
    /**
     * Load the latest version of an aggregate
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the aggregate id
     * @return the hydrated aggregate
     * @throws AggregateNotFoundException if the aggregate doesn't exist ({@link AggregateDeletedException} if it has been deleted)
     */
    <ID, AGGREGATE extends EventSource<ID>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId);

    /**
     * Load an aggregate as it was after its first <code>version</code> events had been applied.
     * The {@link EventSource#version()} of the returned aggregate is <code>version - 1</code>
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the aggregate id
     * @param version       the number of events to apply (must be &gt; 0)
     * @return the hydrated aggregate
     * @throws AggregateNotFoundException if the aggregate doesn't exist ({@link AggregateDeletedException} if it has been deleted)
     * @throws AggregateVersionException  if the aggregate's stream contains fewer than <code>version</code> events
     */
    <ID, AGGREGATE extends EventSource<ID>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId, int version);

    /**
     * Same as {@link #getById(Class, Object)}, except that a missing or deleted aggregate results in {@link Optional#empty()}
     */
    default <ID, AGGREGATE extends EventSource<ID>> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, ID aggregateId) {
        try {
            return Optional.of(getById(aggregateType, aggregateId));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Same as {@link #getById(Class, Object, int)}, except that a missing or deleted aggregate, or a stream with fewer
     * than <code>version</code> events, results in {@link Optional#empty()}
     */
    default <ID, AGGREGATE extends EventSource<ID>> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, ID aggregateId, int version) {
        try {
            return Optional.of(getById(aggregateType, aggregateId, version));
        } catch (AggregateNotFoundException | AggregateVersionException e) {
            return Optional.empty();
        }
    }

    /**
     * Apply the events persisted after the aggregate's current version to the aggregate
     *
     * @param aggregate an aggregate without pending events
     * @return the same aggregate instance
     * @throws AggregateNotFoundException if the aggregate's stream no longer exists
     * @throws IllegalStateException      if the aggregate has pending events
     */
    <ID, AGGREGATE extends EventSource<ID>> AGGREGATE updateToCurrent(AGGREGATE aggregate);

    /**
     * Persist the aggregate's pending events using a new commit id
     *
     * @see #save(EventSource, UUID, Consumer)
     */
    default <ID> void save(EventSource<ID> aggregate) {
        save(aggregate, UUID.randomUUID(), headers -> {
        });
    }

    /**
     * @see #save(EventSource, UUID, Consumer)
     */
    default <ID> void save(EventSource<ID> aggregate, UUID commitId) {
        save(aggregate, commitId, headers -> {
        });
    }

    /**
     * Persist the aggregate's pending events. Nothing happens if there are none.<br>
     * The aggregate's pending events are only taken once all of them have been persisted
     *
     * @param aggregate     the aggregate
     * @param commitId      stored in the <code>CommitId</code> header of every event persisted by this call
     * @param updateHeaders may add custom headers, which are stored in the metadata of every event
     * @throws AggregateAlreadyExistsException         if the aggregate is new and its stream already exists
     * @throws OptimisticAggregateConcurrencyException if the aggregate's stream has been changed since the aggregate was loaded
     * @throws AggregateDeletedException               if the aggregate's stream has been hard deleted
     * @throws AggregatePartiallySavedException        if only some of the appends a large save was split into succeeded
     */
    <ID> void save(EventSource<ID> aggregate, UUID commitId, Consumer<Map<String, Object>> updateHeaders);

    /**
     * Soft delete the aggregate's stream. The aggregate can be created again later with the same id
     *
     * @param aggregate a loaded aggregate without pending events
     * @throws OptimisticAggregateConcurrencyException if the aggregate's stream has been changed since the aggregate was loaded
     */
    <ID> void delete(EventSource<ID> aggregate);

    /**
     * Permanently delete the aggregate's stream. The aggregate's id can never be used again
     *
     * @param aggregate a loaded aggregate without pending events
     * @throws OptimisticAggregateConcurrencyException if the aggregate's stream has been changed since the aggregate was loaded
     */
    <ID> void hardDelete(EventSource<ID> aggregate);
}

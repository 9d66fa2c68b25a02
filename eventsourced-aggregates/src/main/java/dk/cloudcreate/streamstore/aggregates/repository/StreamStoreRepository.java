package dk.cloudcreate.streamstore.aggregates.repository;

import com.google.common.collect.Lists;
import dk.cloudcreate.streamstore.aggregates.*;
import dk.cloudcreate.streamstore.connection.*;
import dk.cloudcreate.streamstore.naming.StreamNameBuilder;
import dk.cloudcreate.streamstore.serializer.*;
import org.slf4j.*;

import java.util.*;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * {@link Repository} that persists each aggregate instance in its own stream of a {@link StreamStoreConnection}.<br>
 * The stream name is resolved using the {@link StreamNameBuilder}, events are converted using the {@link EventSerializer}
 * and empty aggregate instances are created using the {@link AggregateInstanceFactory}.
 * <p>
 * Loading reads the stream in pages of {@link RepositoryConfiguration#readPageSize} events. Saving appends the pending events with the
 * aggregate's loaded version as expected version, split into appends of at most {@link RepositoryConfiguration#maxAppendBatchSize} events.
 * Every event persisted by the same save shares the same <code>CommitId</code> header.
 */
public final class StreamStoreRepository implements Repository {
    private static final Logger log = LoggerFactory.getLogger(StreamStoreRepository.class);

    private final StreamStoreConnection    connection;
    private final StreamNameBuilder        streamNameBuilder;
    private final EventSerializer          serializer;
    private final AggregateInstanceFactory aggregateInstanceFactory;
    private final RepositoryConfiguration  configuration;

    /**
     * Create a repository using {@link AggregateInstanceFactory#defaultConstructorFactory()} and {@link RepositoryConfiguration#defaultConfiguration()}
     */
    public StreamStoreRepository(StreamStoreConnection connection,
                                 StreamNameBuilder streamNameBuilder,
                                 EventSerializer serializer) {
        this(connection,
             streamNameBuilder,
             serializer,
             AggregateInstanceFactory.defaultConstructorFactory(),
             RepositoryConfiguration.defaultConfiguration());
    }

    public StreamStoreRepository(StreamStoreConnection connection,
                                 StreamNameBuilder streamNameBuilder,
                                 EventSerializer serializer,
                                 AggregateInstanceFactory aggregateInstanceFactory,
                                 RepositoryConfiguration configuration) {
        this.connection = checkNotNull(connection, "No connection provided");
        this.streamNameBuilder = checkNotNull(streamNameBuilder, "No streamNameBuilder provided");
        this.serializer = checkNotNull(serializer, "No serializer provided");
        this.aggregateInstanceFactory = checkNotNull(aggregateInstanceFactory, "No aggregateInstanceFactory provided");
        this.configuration = checkNotNull(configuration, "No configuration provided");
    }

    @Override
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId) {
        checkNotNull(aggregateType, "No aggregateType provided");
        checkNotNull(aggregateId, "No aggregateId provided");
        var streamName = streamNameBuilder.generateForAggregate(aggregateType, aggregateId);
        var events     = readEvents(aggregateType, aggregateId, streamName, 0, Long.MAX_VALUE);
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(aggregateType, aggregateId, streamName);
        }
        return hydrate(aggregateType, aggregateId, events);
    }

    @Override
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE getById(Class<AGGREGATE> aggregateType, ID aggregateId, int version) {
        checkNotNull(aggregateType, "No aggregateType provided");
        checkNotNull(aggregateId, "No aggregateId provided");
        checkArgument(version > 0, "version must be > 0, was %s", version);
        var streamName = streamNameBuilder.generateForAggregate(aggregateType, aggregateId);
        var events     = readEvents(aggregateType, aggregateId, streamName, 0, version);
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(aggregateType, aggregateId, streamName);
        }
        if (events.size() < version) {
            throw new AggregateVersionException(lenientFormat("Aggregate '%s' with id '%s' has %s event(s), so version %s can't be loaded",
                                                              aggregateType.getName(),
                                                              aggregateId,
                                                              events.size(),
                                                              version),
                                                aggregateType,
                                                aggregateId,
                                                version,
                                                events.size());
        }
        return hydrate(aggregateType, aggregateId, events);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <ID, AGGREGATE extends EventSource<ID>> AGGREGATE updateToCurrent(AGGREGATE aggregate) {
        checkNotNull(aggregate, "No aggregate provided");
        checkState(!aggregate.hasPendingEvents(),
                   "Cannot update aggregate '%s' with id '%s' since it has pending events",
                   aggregate.getClass().getName(),
                   aggregate.aggregateId());
        checkState(aggregate.aggregateId() != null, "Cannot update aggregate '%s' without an aggregateId", aggregate.getClass().getName());
        var aggregateType = (Class<AGGREGATE>) aggregate.getClass();
        var streamName    = streamNameBuilder.generateForAggregate(aggregateType, aggregate.aggregateId());
        var version       = aggregate.version();
        var events        = readEvents(aggregateType, aggregate.aggregateId(), streamName, version + 1, Long.MAX_VALUE);
        aggregate.updateWithEvents(events, version);
        if (!events.isEmpty()) {
            log.debug("[{}] Updated aggregate '{}' with id '{}' from version {} to {}",
                      connection.connectionName(),
                      aggregateType.getName(),
                      aggregate.aggregateId(),
                      version,
                      aggregate.version());
        }
        return aggregate;
    }

    @Override
    public <ID> void save(EventSource<ID> aggregate, UUID commitId, Consumer<Map<String, Object>> updateHeaders) {
        checkNotNull(aggregate, "No aggregate provided");
        checkNotNull(commitId, "No commitId provided");
        checkNotNull(updateHeaders, "No updateHeaders provided");
        if (!aggregate.hasPendingEvents()) {
            return;
        }
        var aggregateType = aggregate.getClass();
        var aggregateId   = aggregate.aggregateId();
        checkState(aggregateId != null, "Cannot save aggregate '%s' since it doesn't have an aggregateId", aggregateType.getName());

        var pendingEvents   = aggregate.pendingEvents();
        var expectedVersion = aggregate.version() - pendingEvents.size();
        var streamName      = streamNameBuilder.generateForAggregate(aggregateType, aggregateId);

        var headers = new HashMap<String, Object>();
        headers.put(EventMetaData.COMMIT_ID, commitId.toString());
        headers.put(EventMetaData.AGGREGATE_JAVA_TYPE, aggregateType.getName());
        headers.put(EventMetaData.AGGREGATE_TYPE, aggregateType.getSimpleName());
        updateHeaders.accept(headers);

        var eventData = new ArrayList<EventData>(pendingEvents.size());
        for (var event : pendingEvents) {
            eventData.add(serializer.serialize(event, headers));
        }

        if (expectedVersion == ExpectedVersion.NO_STREAM) {
            // A soft deleted stream can be recreated, so only a stream with events means the aggregate exists
            var existing = connection.readStreamForward(streamName, 0, 1);
            if (existing.status == SliceReadStatus.SUCCESS && !existing.events.isEmpty()) {
                throw new AggregateAlreadyExistsException(aggregateType, aggregateId, streamName);
            }
        }

        var nextExpectedVersion = expectedVersion;
        var persistedEvents     = 0;
        try {
            for (var batch : Lists.partition(eventData, configuration.maxAppendBatchSize)) {
                var result = connection.appendToStream(streamName, nextExpectedVersion, batch);
                nextExpectedVersion = result.nextExpectedVersion;
                persistedEvents += batch.size();
            }
        } catch (RuntimeException e) {
            if (persistedEvents > 0) {
                throw new AggregatePartiallySavedException(aggregateType, aggregateId, persistedEvents, eventData.size(), e);
            }
            throw translateWriteException(aggregateType, aggregateId, streamName, expectedVersion, e);
        }

        aggregate.takeEvents();
        log.debug("[{}] Saved {} event(s) for aggregate '{}' with id '{}' in stream '{}' with commitId '{}'. Stream version is now {}",
                  connection.connectionName(),
                  eventData.size(),
                  aggregateType.getName(),
                  aggregateId,
                  streamName,
                  commitId,
                  nextExpectedVersion);
    }

    @Override
    public <ID> void delete(EventSource<ID> aggregate) {
        var streamName = streamNameForDeletion(aggregate);
        try {
            connection.deleteStream(streamName, aggregate.version());
        } catch (RuntimeException e) {
            throw translateWriteException(aggregate.getClass(), aggregate.aggregateId(), streamName, aggregate.version(), e);
        }
        log.debug("[{}] Deleted aggregate '{}' with id '{}'", connection.connectionName(), aggregate.getClass().getName(), aggregate.aggregateId());
    }

    @Override
    public <ID> void hardDelete(EventSource<ID> aggregate) {
        var streamName = streamNameForDeletion(aggregate);
        try {
            connection.hardDeleteStream(streamName, aggregate.version());
        } catch (RuntimeException e) {
            throw translateWriteException(aggregate.getClass(), aggregate.aggregateId(), streamName, aggregate.version(), e);
        }
        log.debug("[{}] Hard deleted aggregate '{}' with id '{}'", connection.connectionName(), aggregate.getClass().getName(), aggregate.aggregateId());
    }

    private String streamNameForDeletion(EventSource<?> aggregate) {
        checkNotNull(aggregate, "No aggregate provided");
        checkState(!aggregate.hasPendingEvents(),
                   "Cannot delete aggregate '%s' with id '%s' since it has pending events",
                   aggregate.getClass().getName(),
                   aggregate.aggregateId());
        checkState(aggregate.aggregateId() != null && aggregate.version() >= 0,
                   "Cannot delete aggregate '%s' since it hasn't been loaded",
                   aggregate.getClass().getName());
        return streamNameBuilder.generateForAggregate(aggregate.getClass(), aggregate.aggregateId());
    }

    private RuntimeException translateWriteException(Class<?> aggregateType, Object aggregateId, String streamName, long expectedVersion, RuntimeException e) {
        if (e instanceof WrongExpectedVersionException) {
            var wrongVersion = (WrongExpectedVersionException) e;
            if (expectedVersion == ExpectedVersion.NO_STREAM) {
                return new AggregateAlreadyExistsException(aggregateType, aggregateId, streamName, e);
            }
            return new OptimisticAggregateConcurrencyException(aggregateType, aggregateId, expectedVersion, wrongVersion.actualVersion, e);
        }
        if (e instanceof StreamDeletedException) {
            return new AggregateDeletedException(aggregateType, aggregateId, streamName);
        }
        return e;
    }

    private <AGGREGATE extends EventSource<?>> AGGREGATE hydrate(Class<AGGREGATE> aggregateType, Object aggregateId, List<Object> events) {
        var aggregate = aggregateInstanceFactory.create(aggregateType);
        if (aggregate == null) {
            throw new AggregateException(lenientFormat("The aggregate instance factory returned null for aggregate type '%s'", aggregateType.getName()));
        }
        aggregate.restoreFromEvents(events);
        if (!Objects.equals(aggregate.aggregateId(), aggregateId)) {
            throw new AggregateException(lenientFormat("Loaded aggregate '%s' with id '%s' but its events resulted in id '%s'",
                                                       aggregateType.getName(),
                                                       aggregateId,
                                                       aggregate.aggregateId()));
        }
        log.trace("[{}] Loaded aggregate '{}' with id '{}' at version {}",
                  connection.connectionName(),
                  aggregateType.getName(),
                  aggregateId,
                  aggregate.version());
        return aggregate;
    }

    /**
     * Read and deserialize at most <code>maxEvents</code> events starting at <code>fromEventNumber</code>
     *
     * @throws AggregateNotFoundException if the stream doesn't exist
     * @throws AggregateDeletedException  if the stream has been deleted
     */
    private List<Object> readEvents(Class<?> aggregateType, Object aggregateId, String streamName, long fromEventNumber, long maxEvents) {
        var events          = new ArrayList<Object>();
        var nextEventNumber = fromEventNumber;
        while (events.size() < maxEvents) {
            var pageSize = (int) Math.min(configuration.readPageSize, maxEvents - events.size());
            var slice    = connection.readStreamForward(streamName, nextEventNumber, pageSize);
            switch (slice.status) {
                case STREAM_NOT_FOUND:
                    throw new AggregateNotFoundException(aggregateType, aggregateId, streamName);
                case STREAM_DELETED:
                    throw new AggregateDeletedException(aggregateType, aggregateId, streamName);
                default:
                    break;
            }
            for (var recordedEvent : slice.events) {
                events.add(serializer.deserialize(recordedEvent));
            }
            if (slice.isEndOfStream || slice.events.isEmpty()) {
                break;
            }
            nextEventNumber = slice.nextEventNumber;
        }
        return events;
    }
}

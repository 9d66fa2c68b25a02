package dk.cloudcreate.streamstore.connection.postgresql;

import com.google.common.base.Throwables;
import dk.cloudcreate.streamstore.bus.*;
import dk.cloudcreate.streamstore.connection.*;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.transaction.TransactionIsolationLevel;
import org.slf4j.*;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;
import static dk.cloudcreate.streamstore.connection.postgresql.RecordedEventRowMapper.*;

/**
 * {@link StreamStoreConnection} that stores streams in two PostgreSQL tables:
 * <ul>
 *     <li>{@link PostgresqlStreamStoreConfiguration#streamsTableName} - one row per stream containing the event number of the
 *     last event and the stream's deletion state. Appends and deletes lock this row (<code>SELECT ... FOR UPDATE</code>), which
 *     serializes concurrent writers to the same stream</li>
 *     <li>{@link PostgresqlStreamStoreConfiguration#eventsTableName} - the events of all streams. The <code>global_order</code> identity
 *     column provides the order of the <code>$ce-</code> and <code>$et-</code> projection streams</li>
 * </ul>
 * The tables are created by {@link #start()} if they don't already exist.
 */
public class PostgresqlStreamStoreConnection implements StreamStoreConnection {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlStreamStoreConnection.class);

    private static final String SOFT_DELETED = "SOFT";
    private static final String HARD_DELETED = "HARD";

    private final Jdbi                               jdbi;
    private final PostgresqlStreamStoreConfiguration configuration;
    private final StreamStoreLocalEventBus           localEventBus;
    private final RecordedEventRowMapper             rowMapper = new RecordedEventRowMapper();
    private volatile boolean                         started;

    public PostgresqlStreamStoreConnection(Jdbi jdbi) {
        this(jdbi, PostgresqlStreamStoreConfiguration.defaultConfiguration());
    }

    public PostgresqlStreamStoreConnection(Jdbi jdbi, PostgresqlStreamStoreConfiguration configuration) {
        this.jdbi = checkNotNull(jdbi, "No jdbi instance provided");
        this.configuration = checkNotNull(configuration, "No configuration provided");
        this.localEventBus = new StreamStoreLocalEventBus(configuration.connectionName, 3);
        jdbi.setSqlLogger(new StreamStoreSqlLogger());
    }

    @Override
    public String connectionName() {
        return configuration.connectionName;
    }

    public PostgresqlStreamStoreConfiguration configuration() {
        return configuration;
    }

    @Override
    public void start() {
        if (!started) {
            log.info("[{}] Starting using {}", configuration.connectionName, configuration);
            jdbi.useHandle(this::initializeStorage);
            localEventBus.start();
            started = true;
            log.info("[{}] Started", configuration.connectionName);
        } else {
            log.debug("[{}] Was already started", configuration.connectionName);
        }
    }

    @Override
    public void stop() {
        if (started) {
            started = false;
            localEventBus.stop();
            log.info("[{}] Stopped", configuration.connectionName);
        } else {
            log.debug("[{}] Was already stopped", configuration.connectionName);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public StreamStoreLocalEventBus localEventBus() {
        return localEventBus;
    }

    private void initializeStorage(Handle handle) {
        log.info("[{}] Ensuring tables '{}' and '{}' exist", configuration.connectionName, configuration.streamsTableName, configuration.eventsTableName);
        handle.execute(lenientFormat("CREATE TABLE IF NOT EXISTS %s (\n" +
                                             "    stream_name       TEXT PRIMARY KEY,\n" +
                                             "    category          TEXT NOT NULL,\n" +
                                             "    last_event_number BIGINT NOT NULL,\n" +
                                             "    deleted           TEXT\n" +
                                             ")",
                                     configuration.streamsTableName));
        handle.execute(lenientFormat("CREATE TABLE IF NOT EXISTS %s (\n" +
                                             "    global_order BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                             "    stream_name  TEXT NOT NULL,\n" +
                                             "    category     TEXT NOT NULL,\n" +
                                             "    event_number BIGINT NOT NULL,\n" +
                                             "    event_id     UUID NOT NULL,\n" +
                                             "    event_type   TEXT NOT NULL,\n" +
                                             "    payload      BYTEA NOT NULL,\n" +
                                             "    metadata     BYTEA NOT NULL,\n" +
                                             "    is_json      BOOLEAN NOT NULL,\n" +
                                             "    created      TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                             "    UNIQUE (stream_name, event_number)\n" +
                                             ")",
                                     configuration.eventsTableName));
        handle.execute(lenientFormat("CREATE INDEX IF NOT EXISTS %s_category ON %s (category, global_order)", configuration.eventsTableName, configuration.eventsTableName));
        handle.execute(lenientFormat("CREATE INDEX IF NOT EXISTS %s_event_type ON %s (event_type, global_order)", configuration.eventsTableName, configuration.eventsTableName));
    }

    @Override
    public StreamEventsSlice readStreamForward(String streamName, long fromEventNumber, int maxCount) {
        checkNotNull(streamName, "No streamName provided");
        checkArgument(fromEventNumber >= 0, "fromEventNumber must be >= 0, was %s", fromEventNumber);
        checkArgument(maxCount > 0, "maxCount must be > 0, was %s", maxCount);
        requireStarted();

        if (SystemStreams.isSystemStream(streamName)) {
            return readProjectionStream(streamName, fromEventNumber, maxCount);
        }
        return jdbi.inTransaction(TransactionIsolationLevel.REPEATABLE_READ, handle -> {
            var header = loadStreamHeader(handle, streamName, false);
            if (header.isEmpty() || (header.get().deleted == null && header.get().lastEventNumber == ExpectedVersion.NO_STREAM)) {
                return StreamEventsSlice.notFound(streamName, fromEventNumber);
            }
            if (header.get().deleted != null) {
                return StreamEventsSlice.deleted(streamName, fromEventNumber);
            }
            var events = handle.createQuery(lenientFormat("SELECT * FROM %s WHERE stream_name = :streamName AND event_number >= :fromEventNumber ORDER BY event_number LIMIT :maxCount",
                                                          configuration.eventsTableName))
                               .bind("streamName", streamName)
                               .bind("fromEventNumber", fromEventNumber)
                               .bind("maxCount", maxCount)
                               .map(rowMapper)
                               .list();
            return StreamEventsSlice.success(streamName, fromEventNumber, events, header.get().lastEventNumber);
        });
    }

    private StreamEventsSlice readProjectionStream(String streamName, long fromEventNumber, int maxCount) {
        String filterColumn;
        if (SystemStreams.isCategoryStream(streamName)) {
            filterColumn = "category";
        } else if (SystemStreams.isEventTypeStream(streamName)) {
            filterColumn = EVENT_TYPE_COLUMN;
        } else {
            return StreamEventsSlice.notFound(streamName, fromEventNumber);
        }
        var projectedName = SystemStreams.projectedName(streamName);

        return jdbi.inTransaction(TransactionIsolationLevel.REPEATABLE_READ, handle -> {
            var numberOfEvents = handle.createQuery(lenientFormat("SELECT count(*) FROM %s WHERE %s = :projectedName", configuration.eventsTableName, filterColumn))
                                       .bind("projectedName", projectedName)
                                       .mapTo(Long.class)
                                       .one();
            if (numberOfEvents == 0) {
                return StreamEventsSlice.notFound(streamName, fromEventNumber);
            }
            var events = handle.createQuery(lenientFormat("SELECT * FROM %s WHERE %s = :projectedName ORDER BY global_order OFFSET :fromEventNumber LIMIT :maxCount",
                                                          configuration.eventsTableName,
                                                          filterColumn))
                               .bind("projectedName", projectedName)
                               .bind("fromEventNumber", fromEventNumber)
                               .bind("maxCount", maxCount)
                               .map(rowMapper)
                               .list();
            return StreamEventsSlice.success(streamName, fromEventNumber, events, numberOfEvents - 1);
        });
    }

    @Override
    public WriteResult appendToStream(String streamName, long expectedVersion, List<EventData> events) {
        checkNotNull(streamName, "No streamName provided");
        checkNotNull(events, "No events provided");
        checkArgument(!SystemStreams.isSystemStream(streamName), "Cannot append to system stream '%s'", streamName);
        events.forEach(eventData -> checkNotNull(eventData, "events must not contain null elements"));
        requireStarted();

        var writeResult = jdbi.inTransaction(TransactionIsolationLevel.READ_COMMITTED, handle -> {
            var currentVersion = lockStreamForWriting(handle, streamName, expectedVersion);
            if (events.isEmpty()) {
                return new WriteResult(currentVersion, List.of());
            }

            var category = SystemStreams.categoryOf(streamName);
            var created  = OffsetDateTime.now(configuration.clock).truncatedTo(ChronoUnit.MICROS);
            var batch = handle.prepareBatch(lenientFormat("INSERT INTO %s (stream_name, category, event_number, event_id, event_type, payload, metadata, is_json, created) " +
                                                                  "VALUES (:streamName, :category, :eventNumber, :eventId, :eventType, :payload, :metadata, :isJson, :created)",
                                                          configuration.eventsTableName));
            var appended    = new ArrayList<RecordedEvent>(events.size());
            var eventNumber = currentVersion;
            for (var eventData : events) {
                var recordedEvent = RecordedEvent.from(eventData, streamName, ++eventNumber, created);
                batch.bind("streamName", streamName)
                     .bind("category", category)
                     .bind("eventNumber", recordedEvent.eventNumber)
                     .bind("eventId", recordedEvent.eventId)
                     .bind("eventType", recordedEvent.eventType)
                     .bind("payload", recordedEvent.payload)
                     .bind("metadata", recordedEvent.metadata)
                     .bind("isJson", recordedEvent.isJson)
                     .bind("created", recordedEvent.created)
                     .add();
                appended.add(recordedEvent);
            }
            try {
                batch.execute();
            } catch (RuntimeException e) {
                var cause = Throwables.getRootCause(e);
                if (cause.getMessage() != null &&
                        cause.getMessage().contains("duplicate key value violates unique constraint") &&
                        cause.getMessage().contains(configuration.eventsTableName + "_stream_name_event_number_key")) {
                    throw new WrongExpectedVersionException(streamName, expectedVersion, currentVersion);
                }
                throw new StreamStoreException(lenientFormat("[%s] Failed to append %s event(s) to stream '%s'", configuration.connectionName, events.size(), streamName), e);
            }

            handle.createUpdate(lenientFormat("UPDATE %s SET last_event_number = :lastEventNumber, deleted = NULL WHERE stream_name = :streamName", configuration.streamsTableName))
                  .bind("lastEventNumber", eventNumber)
                  .bind("streamName", streamName)
                  .execute();
            return new WriteResult(eventNumber, appended);
        });

        if (!writeResult.appendedEvents.isEmpty()) {
            log.debug("[{}] Appended {} event(s) to stream '{}' with expected version {}. Stream version is now {}",
                      configuration.connectionName,
                      writeResult.appendedEvents.size(),
                      streamName,
                      ExpectedVersion.describe(expectedVersion),
                      writeResult.nextExpectedVersion);
            localEventBus.publish(new EventsAppended(configuration.connectionName, streamName, writeResult.appendedEvents));
        }
        return writeResult;
    }

    @Override
    public void deleteStream(String streamName, long expectedVersion) {
        delete(streamName, expectedVersion, SOFT_DELETED);
    }

    @Override
    public void hardDeleteStream(String streamName, long expectedVersion) {
        delete(streamName, expectedVersion, HARD_DELETED);
    }

    private void delete(String streamName, long expectedVersion, String deletionMarker) {
        checkNotNull(streamName, "No streamName provided");
        checkArgument(!SystemStreams.isSystemStream(streamName), "Cannot delete system stream '%s'", streamName);
        requireStarted();

        jdbi.useTransaction(TransactionIsolationLevel.READ_COMMITTED, handle -> {
            var currentVersion = lockStreamForWriting(handle, streamName, expectedVersion);
            var removedEvents = handle.createUpdate(lenientFormat("DELETE FROM %s WHERE stream_name = :streamName", configuration.eventsTableName))
                                      .bind("streamName", streamName)
                                      .execute();
            handle.createUpdate(lenientFormat("UPDATE %s SET last_event_number = :lastEventNumber, deleted = :deleted WHERE stream_name = :streamName", configuration.streamsTableName))
                  .bind("lastEventNumber", ExpectedVersion.NO_STREAM)
                  .bind("deleted", deletionMarker)
                  .bind("streamName", streamName)
                  .execute();
            log.debug("[{}] {} stream '{}' at version {} removing {} event(s)",
                      configuration.connectionName,
                      HARD_DELETED.equals(deletionMarker) ? "Hard deleted" : "Deleted",
                      streamName,
                      currentVersion,
                      removedEvents);
        });
    }

    /**
     * Ensure the stream's header row exists, lock it for the remainder of the transaction and verify the <code>expectedVersion</code>
     *
     * @return the current version of the stream
     */
    private long lockStreamForWriting(Handle handle, String streamName, long expectedVersion) {
        handle.createUpdate(lenientFormat("INSERT INTO %s (stream_name, category, last_event_number) VALUES (:streamName, :category, :lastEventNumber) " +
                                                  "ON CONFLICT (stream_name) DO NOTHING",
                                          configuration.streamsTableName))
              .bind("streamName", streamName)
              .bind("category", SystemStreams.categoryOf(streamName))
              .bind("lastEventNumber", ExpectedVersion.NO_STREAM)
              .execute();
        var header = loadStreamHeader(handle, streamName, true)
                .orElseThrow(() -> new StreamStoreException(lenientFormat("[%s] Couldn't lock stream '%s'", configuration.connectionName, streamName)));
        if (HARD_DELETED.equals(header.deleted)) {
            throw new StreamDeletedException(streamName);
        }
        if (!ExpectedVersion.matches(expectedVersion, header.lastEventNumber)) {
            throw new WrongExpectedVersionException(streamName, expectedVersion, header.lastEventNumber);
        }
        return header.lastEventNumber;
    }

    private Optional<StreamHeader> loadStreamHeader(Handle handle, String streamName, boolean forUpdate) {
        return handle.createQuery(lenientFormat("SELECT last_event_number, deleted FROM %s WHERE stream_name = :streamName%s",
                                                configuration.streamsTableName,
                                                forUpdate ? " FOR UPDATE" : ""))
                     .bind("streamName", streamName)
                     .map((rs, ctx) -> new StreamHeader(rs.getLong("last_event_number"), rs.getString("deleted")))
                     .findOne();
    }

    private void requireStarted() {
        if (!started) {
            throw new StreamStoreConnectionException("Connection '" + configuration.connectionName + "' hasn't been started");
        }
    }

    private static class StreamHeader {
        final long   lastEventNumber;
        final String deleted;

        StreamHeader(long lastEventNumber, String deleted) {
            this.lastEventNumber = lastEventNumber;
            this.deleted = deleted;
        }
    }
}

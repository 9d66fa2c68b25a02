package dk.cloudcreate.streamstore.connection.inmemory;

import dk.cloudcreate.streamstore.bus.*;
import dk.cloudcreate.streamstore.connection.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.*;

/**
 * Thread safe, in-process {@link StreamStoreConnection}. All reads and writes are serialized on a single lock.<br>
 * Projection streams (<code>$ce-</code> and <code>$et-</code>) are maintained on every append and lose the events of a stream
 * when the stream is deleted.
 */
public class InMemoryStreamStoreConnection implements StreamStoreConnection {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStreamStoreConnection.class);

    private enum Tombstone {
        SOFT_DELETED,
        HARD_DELETED
    }

    private final String                             connectionName;
    private final Clock                              clock;
    private final StreamStoreLocalEventBus           localEventBus;
    private final ReentrantLock                      lock              = new ReentrantLock();
    private final Map<String, List<RecordedEvent>>   streams           = new HashMap<>();
    private final Map<String, Tombstone>             deletedStreams    = new HashMap<>();
    /**
     * Key: projection stream name (<code>$ce-{category}</code> or <code>$et-{eventType}</code>)
     */
    private final Map<String, List<RecordedEvent>>   projectionStreams = new HashMap<>();
    private volatile boolean                         started;

    public InMemoryStreamStoreConnection() {
        this("InMemoryStreamStore");
    }

    public InMemoryStreamStoreConnection(String connectionName) {
        this(connectionName, Clock.systemUTC());
    }

    public InMemoryStreamStoreConnection(String connectionName, Clock clock) {
        this.connectionName = checkNotNull(connectionName, "No connectionName provided");
        this.clock = checkNotNull(clock, "No clock provided");
        this.localEventBus = new StreamStoreLocalEventBus(connectionName, 3);
    }

    @Override
    public String connectionName() {
        return connectionName;
    }

    @Override
    public void start() {
        if (!started) {
            localEventBus.start();
            started = true;
            log.info("[{}] Started", connectionName);
        } else {
            log.debug("[{}] Was already started", connectionName);
        }
    }

    @Override
    public void stop() {
        if (started) {
            started = false;
            localEventBus.stop();
            log.info("[{}] Stopped", connectionName);
        } else {
            log.debug("[{}] Was already stopped", connectionName);
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

    @Override
    public StreamEventsSlice readStreamForward(String streamName, long fromEventNumber, int maxCount) {
        checkNotNull(streamName, "No streamName provided");
        checkArgument(fromEventNumber >= 0, "fromEventNumber must be >= 0, was %s", fromEventNumber);
        checkArgument(maxCount > 0, "maxCount must be > 0, was %s", maxCount);
        requireStarted();

        lock.lock();
        try {
            if (SystemStreams.isSystemStream(streamName)) {
                var projection = projectionStreams.get(streamName);
                if (projection == null || projection.isEmpty()) {
                    return StreamEventsSlice.notFound(streamName, fromEventNumber);
                }
                return slice(streamName, projection, fromEventNumber, maxCount);
            }

            if (deletedStreams.containsKey(streamName)) {
                return StreamEventsSlice.deleted(streamName, fromEventNumber);
            }
            var stream = streams.get(streamName);
            if (stream == null) {
                return StreamEventsSlice.notFound(streamName, fromEventNumber);
            }
            return slice(streamName, stream, fromEventNumber, maxCount);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WriteResult appendToStream(String streamName, long expectedVersion, List<EventData> events) {
        checkNotNull(streamName, "No streamName provided");
        checkNotNull(events, "No events provided");
        checkArgument(!SystemStreams.isSystemStream(streamName), "Cannot append to system stream '%s'", streamName);
        requireStarted();

        WriteResult writeResult;
        lock.lock();
        try {
            if (deletedStreams.get(streamName) == Tombstone.HARD_DELETED) {
                throw new StreamDeletedException(streamName);
            }
            var currentVersion = currentVersion(streamName);
            if (!ExpectedVersion.matches(expectedVersion, currentVersion)) {
                throw new WrongExpectedVersionException(streamName, expectedVersion, currentVersion);
            }
            if (events.isEmpty()) {
                return new WriteResult(currentVersion, List.of());
            }
            if (deletedStreams.remove(streamName) != null) {
                log.debug("[{}] Re-creating soft deleted stream '{}'", connectionName, streamName);
            }

            var stream      = streams.computeIfAbsent(streamName, name -> new ArrayList<>());
            var now         = OffsetDateTime.now(clock);
            var category    = SystemStreams.categoryStream(SystemStreams.categoryOf(streamName));
            var appended    = new ArrayList<RecordedEvent>(events.size());
            var eventNumber = currentVersion;
            for (var eventData : events) {
                checkNotNull(eventData, "events must not contain null elements");
                var recordedEvent = RecordedEvent.from(eventData, streamName, ++eventNumber, now);
                stream.add(recordedEvent);
                projectionStreams.computeIfAbsent(category, name -> new ArrayList<>()).add(recordedEvent);
                projectionStreams.computeIfAbsent(SystemStreams.eventTypeStream(eventData.eventType), name -> new ArrayList<>()).add(recordedEvent);
                appended.add(recordedEvent);
            }
            writeResult = new WriteResult(eventNumber, appended);
            log.debug("[{}] Appended {} event(s) to stream '{}' with expected version {}. Stream version is now {}",
                      connectionName,
                      appended.size(),
                      streamName,
                      ExpectedVersion.describe(expectedVersion),
                      eventNumber);
        } finally {
            lock.unlock();
        }

        localEventBus.publish(new EventsAppended(connectionName, streamName, writeResult.appendedEvents));
        return writeResult;
    }

    @Override
    public void deleteStream(String streamName, long expectedVersion) {
        delete(streamName, expectedVersion, Tombstone.SOFT_DELETED);
    }

    @Override
    public void hardDeleteStream(String streamName, long expectedVersion) {
        delete(streamName, expectedVersion, Tombstone.HARD_DELETED);
    }

    private void delete(String streamName, long expectedVersion, Tombstone tombstone) {
        checkNotNull(streamName, "No streamName provided");
        checkArgument(!SystemStreams.isSystemStream(streamName), "Cannot delete system stream '%s'", streamName);
        requireStarted();

        lock.lock();
        try {
            if (deletedStreams.get(streamName) == Tombstone.HARD_DELETED) {
                throw new StreamDeletedException(streamName);
            }
            var currentVersion = currentVersion(streamName);
            if (!ExpectedVersion.matches(expectedVersion, currentVersion)) {
                throw new WrongExpectedVersionException(streamName, expectedVersion, currentVersion);
            }
            var removed = streams.remove(streamName);
            deletedStreams.put(streamName, tombstone);
            if (removed != null) {
                projectionStreams.values().forEach(projection -> projection.removeIf(recordedEvent -> recordedEvent.streamName.equals(streamName)));
            }
            log.debug("[{}] {} stream '{}' at version {}", connectionName, tombstone == Tombstone.HARD_DELETED ? "Hard deleted" : "Deleted", streamName, currentVersion);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Must be called while holding the lock
     */
    private long currentVersion(String streamName) {
        var stream = streams.get(streamName);
        return stream == null ? ExpectedVersion.NO_STREAM : stream.size() - 1;
    }

    private static StreamEventsSlice slice(String streamName, List<RecordedEvent> events, long fromEventNumber, int maxCount) {
        var lastEventNumber = events.size() - 1L;
        if (fromEventNumber > lastEventNumber) {
            return StreamEventsSlice.success(streamName, fromEventNumber, List.of(), lastEventNumber);
        }
        var toExclusive = (int) Math.min(events.size(), fromEventNumber + maxCount);
        return StreamEventsSlice.success(streamName,
                                         fromEventNumber,
                                         new ArrayList<>(events.subList((int) fromEventNumber, toExclusive)),
                                         lastEventNumber);
    }

    private void requireStarted() {
        if (!started) {
            throw new StreamStoreConnectionException("Connection '" + connectionName + "' hasn't been started");
        }
    }
}

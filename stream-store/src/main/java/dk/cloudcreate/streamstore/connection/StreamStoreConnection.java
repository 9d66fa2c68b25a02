package dk.cloudcreate.streamstore.connection;

import dk.cloudcreate.streamstore.bus.StreamStoreLocalEventBus;
import dk.cloudcreate.streamstore.common.Lifecycle;

import java.util.List;

/**
 * Connection to an append-only, versioned event log where events are organized in named streams.<br>
 * Every stream is an ordered sequence of events with zero based event numbers. Each append is guarded by an
 * expected version (see {@link ExpectedVersion}) which provides optimistic concurrency control per stream.<br>
 * Besides the streams written by clients, a connection answers reads for the projection streams described in {@link SystemStreams}.
 * <p>
 * A connection must be {@link #start() started} before use; operations on a connection that isn't started
 * fail with {@link StreamStoreConnectionException}. Implementations must be thread safe.
 */
public interface StreamStoreConnection extends Lifecycle {
    /**
     * The name of this connection (used for logging)
     */
    String connectionName();

    /**
     * Read events from a stream in ascending event number order
     *
     * @param streamName      the name of the stream (may be a projection stream)
     * @param fromEventNumber the event number (inclusive) to start reading from
     * @param maxCount        the maximum number of events to return
     * @return the slice read. A stream that doesn't exist results in a {@link SliceReadStatus#STREAM_NOT_FOUND} slice,
     * a soft or hard deleted stream results in a {@link SliceReadStatus#STREAM_DELETED} slice
     */
    StreamEventsSlice readStreamForward(String streamName, long fromEventNumber, int maxCount);

    /**
     * Append events to a stream. All events are appended in the order given or none are
     *
     * @param streamName      the name of the stream
     * @param expectedVersion the event number of the last event in the stream or one of the {@link ExpectedVersion} sentinels
     * @param events          the events to append
     * @return the result of the append
     * @throws WrongExpectedVersionException if the stream's actual version doesn't match <code>expectedVersion</code>
     * @throws StreamDeletedException        if the stream has been hard deleted
     */
    WriteResult appendToStream(String streamName, long expectedVersion, List<EventData> events);

    /**
     * Soft delete a stream. Reads will report {@link SliceReadStatus#STREAM_DELETED} until the stream is re-created
     * by appending with {@link ExpectedVersion#NO_STREAM} or {@link ExpectedVersion#ANY}, in which case event numbers start over from 0
     *
     * @param streamName      the name of the stream
     * @param expectedVersion the expected version of the stream
     * @throws WrongExpectedVersionException if the stream's actual version doesn't match <code>expectedVersion</code>
     * @throws StreamDeletedException        if the stream has been hard deleted
     */
    void deleteStream(String streamName, long expectedVersion);

    /**
     * Permanently delete a stream. The stream can never be written to again
     *
     * @param streamName      the name of the stream
     * @param expectedVersion the expected version of the stream
     * @throws WrongExpectedVersionException if the stream's actual version doesn't match <code>expectedVersion</code>
     * @throws StreamDeletedException        if the stream has already been hard deleted
     */
    void hardDeleteStream(String streamName, long expectedVersion);

    /**
     * The bus on which {@link dk.cloudcreate.streamstore.bus.EventsAppended} notifications are published after every successful append.<br>
     * The bus is started and stopped together with the connection.
     */
    StreamStoreLocalEventBus localEventBus();

    /**
     * Same as {@link #start()}
     */
    default StreamStoreConnection connect() {
        start();
        return this;
    }
}

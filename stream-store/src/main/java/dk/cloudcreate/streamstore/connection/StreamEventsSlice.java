package dk.cloudcreate.streamstore.connection;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A page of events read forward from a stream
 */
public final class StreamEventsSlice {
    public final SliceReadStatus     status;
    public final String              streamName;
    public final long                fromEventNumber;
    public final List<RecordedEvent> events;
    /**
     * The position to continue reading from
     */
    public final long                nextEventNumber;
    /**
     * The position of the last event in the stream or {@link ExpectedVersion#NO_STREAM}
     */
    public final long                lastEventNumber;
    public final boolean             isEndOfStream;

    public StreamEventsSlice(SliceReadStatus status,
                             String streamName,
                             long fromEventNumber,
                             List<RecordedEvent> events,
                             long nextEventNumber,
                             long lastEventNumber,
                             boolean isEndOfStream) {
        this.status = checkNotNull(status, "No status provided");
        this.streamName = checkNotNull(streamName, "No streamName provided");
        this.fromEventNumber = fromEventNumber;
        this.events = List.copyOf(checkNotNull(events, "No events provided"));
        this.nextEventNumber = nextEventNumber;
        this.lastEventNumber = lastEventNumber;
        this.isEndOfStream = isEndOfStream;
    }

    public static StreamEventsSlice notFound(String streamName, long fromEventNumber) {
        return new StreamEventsSlice(SliceReadStatus.STREAM_NOT_FOUND, streamName, fromEventNumber, List.of(), fromEventNumber, ExpectedVersion.NO_STREAM, true);
    }

    public static StreamEventsSlice deleted(String streamName, long fromEventNumber) {
        return new StreamEventsSlice(SliceReadStatus.STREAM_DELETED, streamName, fromEventNumber, List.of(), fromEventNumber, ExpectedVersion.NO_STREAM, true);
    }

    /**
     * Create a {@link SliceReadStatus#SUCCESS} slice
     *
     * @param streamName      the stream that was read
     * @param fromEventNumber the position the read started from
     * @param events          the events read (in ascending order)
     * @param lastEventNumber the position of the last event currently in the stream
     * @return the slice
     */
    public static StreamEventsSlice success(String streamName, long fromEventNumber, List<RecordedEvent> events, long lastEventNumber) {
        var nextEventNumber = fromEventNumber + events.size();
        return new StreamEventsSlice(SliceReadStatus.SUCCESS,
                                     streamName,
                                     fromEventNumber,
                                     events,
                                     nextEventNumber,
                                     lastEventNumber,
                                     nextEventNumber > lastEventNumber);
    }

    @Override
    public String toString() {
        return "StreamEventsSlice{" +
                "status=" + status +
                ", streamName='" + streamName + '\'' +
                ", fromEventNumber=" + fromEventNumber +
                ", events=" + events.size() +
                ", nextEventNumber=" + nextEventNumber +
                ", lastEventNumber=" + lastEventNumber +
                ", isEndOfStream=" + isEndOfStream +
                '}';
    }
}

package dk.cloudcreate.streamstore.connection;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Result of a successful {@link StreamStoreConnection#appendToStream(String, long, List)}
 */
public final class WriteResult {
    /**
     * The event number of the last event in the stream after the append, i.e. the expected version to use for the next append
     */
    public final long                nextExpectedVersion;
    public final List<RecordedEvent> appendedEvents;

    public WriteResult(long nextExpectedVersion, List<RecordedEvent> appendedEvents) {
        this.nextExpectedVersion = nextExpectedVersion;
        this.appendedEvents = List.copyOf(checkNotNull(appendedEvents, "No appendedEvents provided"));
    }

    @Override
    public String toString() {
        return "WriteResult{" +
                "nextExpectedVersion=" + nextExpectedVersion +
                ", appendedEvents=" + appendedEvents.size() +
                '}';
    }
}

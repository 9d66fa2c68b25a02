package dk.cloudcreate.streamstore.bus;

import dk.cloudcreate.streamstore.connection.RecordedEvent;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Encapsulates all events appended to a stream in a single append operation
 */
public final class EventsAppended {
    public final String              connectionName;
    public final String              streamName;
    public final List<RecordedEvent> events;

    public EventsAppended(String connectionName, String streamName, List<RecordedEvent> events) {
        this.connectionName = checkNotNull(connectionName, "No connectionName provided");
        this.streamName = checkNotNull(streamName, "No streamName provided");
        this.events = List.copyOf(checkNotNull(events, "No events provided"));
    }

    @Override
    public String toString() {
        return "EventsAppended{" +
                "connectionName='" + connectionName + '\'' +
                ", streamName='" + streamName + '\'' +
                ", events=" + events.size() +
                '}';
    }
}

package dk.cloudcreate.streamstore.connection;

import java.time.OffsetDateTime;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An event as it has been persisted in a stream
 */
public final class RecordedEvent {
    /**
     * The stream the event was appended to
     */
    public final String         streamName;
    /**
     * Zero based position of the event within {@link #streamName}
     */
    public final long           eventNumber;
    public final UUID           eventId;
    public final String         eventType;
    public final byte[]         payload;
    public final byte[]         metadata;
    public final boolean        isJson;
    public final OffsetDateTime created;

    public RecordedEvent(String streamName,
                         long eventNumber,
                         UUID eventId,
                         String eventType,
                         byte[] payload,
                         byte[] metadata,
                         boolean isJson,
                         OffsetDateTime created) {
        this.streamName = checkNotNull(streamName, "No streamName provided");
        this.eventNumber = eventNumber;
        this.eventId = checkNotNull(eventId, "No eventId provided");
        this.eventType = checkNotNull(eventType, "No eventType provided");
        this.payload = checkNotNull(payload, "No payload provided");
        this.metadata = checkNotNull(metadata, "No metadata provided");
        this.isJson = isJson;
        this.created = checkNotNull(created, "No created timestamp provided");
    }

    public static RecordedEvent from(EventData eventData, String streamName, long eventNumber, OffsetDateTime created) {
        checkNotNull(eventData, "No eventData provided");
        return new RecordedEvent(streamName,
                                 eventNumber,
                                 eventData.eventId,
                                 eventData.eventType,
                                 eventData.payload,
                                 eventData.metadata,
                                 eventData.isJson,
                                 created);
    }

    @Override
    public String toString() {
        return "RecordedEvent{" +
                "streamName='" + streamName + '\'' +
                ", eventNumber=" + eventNumber +
                ", eventId=" + eventId +
                ", eventType='" + eventType + '\'' +
                ", created=" + created +
                '}';
    }
}

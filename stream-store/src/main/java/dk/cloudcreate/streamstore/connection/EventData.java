package dk.cloudcreate.streamstore.connection;

import java.util.UUID;

import static com.google.common.base.Preconditions.*;

/**
 * A serialized event ready to be appended to a stream
 */
public final class EventData {
    public final UUID    eventId;
    public final String  eventType;
    public final byte[]  payload;
    public final byte[]  metadata;
    public final boolean isJson;

    public EventData(UUID eventId, String eventType, byte[] payload, byte[] metadata, boolean isJson) {
        this.eventId = checkNotNull(eventId, "No eventId provided");
        this.eventType = checkNotNull(eventType, "No eventType provided");
        checkArgument(!eventType.isBlank(), "eventType must not be blank");
        this.payload = checkNotNull(payload, "No payload provided");
        this.metadata = metadata != null ? metadata : new byte[0];
        this.isJson = isJson;
    }

    @Override
    public String toString() {
        return "EventData{" +
                "eventId=" + eventId +
                ", eventType='" + eventType + '\'' +
                ", payload=" + payload.length + " bytes" +
                ", isJson=" + isJson +
                '}';
    }
}

package dk.cloudcreate.streamstore.serializer;

import dk.cloudcreate.streamstore.connection.*;

import java.util.Map;

/**
 * Converts between in-memory events and the {@link EventData} appended to / {@link RecordedEvent} read from a stream
 */
public interface EventSerializer {
    /**
     * Serialize an event
     *
     * @param event   the event
     * @param headers custom headers that will be stored in the event's metadata. The tracing ids of a
     *                {@link dk.cloudcreate.streamstore.common.correlation.CorrelatedMessage} event replace any custom header with the same name
     * @return the serialized event
     */
    EventData serialize(Object event, Map<String, Object> headers);

    default EventData serialize(Object event) {
        return serialize(event, Map.of());
    }

    /**
     * Deserialize an event
     *
     * @param eventType the event type tag
     * @param payload   the serialized payload
     * @param metadata  the serialized metadata
     * @return the event
     * @throws dk.cloudcreate.streamstore.serializer.json.UnknownEventTypeException  if the event type can't be resolved to a Java type
     * @throws dk.cloudcreate.streamstore.serializer.json.JSONDeserializationException if the payload can't be deserialized
     */
    Object deserialize(String eventType, byte[] payload, byte[] metadata);

    default Object deserialize(RecordedEvent recordedEvent) {
        return deserialize(recordedEvent.eventType, recordedEvent.payload, recordedEvent.metadata);
    }

    EventMetaData deserializeMetaData(byte[] metadata);

    /**
     * @param eventType the Java type of an event
     * @return the event type tag events of this type are stored with
     */
    String eventTypeOf(Class<?> eventType);
}

package dk.cloudcreate.streamstore.serializer.json;

/**
 * Thrown when a stored event type tag can't be resolved to a Java type
 */
public class UnknownEventTypeException extends JSONDeserializationException {
    public final String eventType;

    public UnknownEventTypeException(String eventType, String message) {
        super(message);
        this.eventType = eventType;
    }

    public UnknownEventTypeException(String eventType, String message, Exception cause) {
        super(message, cause);
        this.eventType = eventType;
    }
}

package dk.cloudcreate.streamstore.aggregates;

/**
 * Thrown by {@link EventSource#updateWithEvents(java.util.List, long)} when the events are expected to follow another version
 * than the aggregate's current version
 */
public class AggregateVersionMismatchException extends AggregateException {
    public final Class<?> aggregateType;
    public final Object   aggregateId;
    public final long     expectedVersion;
    public final long     actualVersion;

    public AggregateVersionMismatchException(String message, Class<?> aggregateType, Object aggregateId, long expectedVersion, long actualVersion) {
        super(message);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}

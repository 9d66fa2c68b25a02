package dk.cloudcreate.streamstore.aggregates;

/**
 * Thrown when a specific version of an aggregate was requested but the aggregate's stream contains fewer events
 */
public class AggregateVersionException extends AggregateException {
    public final Class<?> aggregateType;
    public final Object   aggregateId;
    public final long     requiredVersion;
    public final long     actualVersion;

    public AggregateVersionException(String message, Class<?> aggregateType, Object aggregateId, long requiredVersion, long actualVersion) {
        super(message);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.requiredVersion = requiredVersion;
        this.actualVersion = actualVersion;
    }
}

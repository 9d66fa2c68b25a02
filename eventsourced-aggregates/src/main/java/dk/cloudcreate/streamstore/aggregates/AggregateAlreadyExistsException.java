package dk.cloudcreate.streamstore.aggregates;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when saving a new aggregate whose stream already contains events
 */
public class AggregateAlreadyExistsException extends AggregateException {
    public final Class<?> aggregateType;
    public final Object   aggregateId;
    public final String   streamName;

    public AggregateAlreadyExistsException(Class<?> aggregateType, Object aggregateId, String streamName) {
        this(aggregateType, aggregateId, streamName, null);
    }

    public AggregateAlreadyExistsException(Class<?> aggregateType, Object aggregateId, String streamName, Throwable cause) {
        super(lenientFormat("Cannot create aggregate '%s' with id '%s' since stream '%s' already exists", aggregateType.getName(), aggregateId, streamName), cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.streamName = streamName;
    }
}

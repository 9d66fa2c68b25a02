package dk.cloudcreate.streamstore.aggregates;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when no stream exists for the requested aggregate, or the stream exists but contains no events
 */
public class AggregateNotFoundException extends AggregateException {
    public final Class<?> aggregateType;
    public final Object   aggregateId;
    public final String   streamName;

    public AggregateNotFoundException(Class<?> aggregateType, Object aggregateId, String streamName) {
        this(lenientFormat("Aggregate '%s' with id '%s' wasn't found in stream '%s'", aggregateType.getName(), aggregateId, streamName),
             aggregateType,
             aggregateId,
             streamName);
    }

    protected AggregateNotFoundException(String message, Class<?> aggregateType, Object aggregateId, String streamName) {
        super(message);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.streamName = streamName;
    }
}

package dk.cloudcreate.streamstore.aggregates;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when the stream of the requested aggregate has been soft or hard deleted.<br>
 * Callers that don't care about the difference between a deleted and an absent aggregate can catch {@link AggregateNotFoundException}
 */
public class AggregateDeletedException extends AggregateNotFoundException {
    public AggregateDeletedException(Class<?> aggregateType, Object aggregateId, String streamName) {
        super(lenientFormat("Aggregate '%s' with id '%s' has been deleted (stream '%s')", aggregateType.getName(), aggregateId, streamName),
              aggregateType,
              aggregateId,
              streamName);
    }
}

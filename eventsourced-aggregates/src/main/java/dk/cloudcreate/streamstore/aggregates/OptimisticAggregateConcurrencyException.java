package dk.cloudcreate.streamstore.aggregates;

import dk.cloudcreate.streamstore.connection.ExpectedVersion;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when an aggregate is saved or deleted based on a version that is no longer the latest version of its stream,
 * i.e. another writer has appended to the stream since the aggregate was loaded.<br>
 * The aggregate is left untouched (its pending events are kept); reload it and retry the command.
 */
public class OptimisticAggregateConcurrencyException extends AggregateException {
    public final Class<?> aggregateType;
    public final Object   aggregateId;
    public final long     expectedVersion;
    public final long     actualVersion;

    public OptimisticAggregateConcurrencyException(Class<?> aggregateType, Object aggregateId, long expectedVersion, long actualVersion, Throwable cause) {
        super(lenientFormat("Expected version '%s' for aggregate '%s' with id '%s' but the stream's version was '%s'",
                            ExpectedVersion.describe(expectedVersion),
                            aggregateType.getName(),
                            aggregateId,
                            ExpectedVersion.describe(actualVersion)),
              cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}

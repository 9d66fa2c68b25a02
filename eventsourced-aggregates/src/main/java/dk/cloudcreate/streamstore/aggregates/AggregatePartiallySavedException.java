package dk.cloudcreate.streamstore.aggregates;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when a save that had to be split into several appends failed after at least one append succeeded.<br>
 * The stream then contains the first {@link #persistedEvents} of the aggregate's {@link #totalEvents} pending events.
 * The aggregate instance still holds all of its pending events and must be discarded and reloaded.
 */
public class AggregatePartiallySavedException extends AggregateException {
    public final Class<?> aggregateType;
    public final Object   aggregateId;
    public final int      persistedEvents;
    public final int      totalEvents;

    public AggregatePartiallySavedException(Class<?> aggregateType, Object aggregateId, int persistedEvents, int totalEvents, Throwable cause) {
        super(lenientFormat("Only %s of %s events were appended for aggregate '%s' with id '%s'",
                            persistedEvents,
                            totalEvents,
                            aggregateType.getName(),
                            aggregateId),
              cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.persistedEvents = persistedEvents;
        this.totalEvents = totalEvents;
    }
}

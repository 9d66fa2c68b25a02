package dk.cloudcreate.streamstore.aggregates;

import java.util.List;

/**
 * An aggregate whose state is derived entirely from an ordered sequence of events.<br>
 * The events raised since the aggregate was loaded (its pending events) are handed to a repository using {@link #takeEvents()}.
 *
 * @param <ID> the aggregate id type
 * @see EventSourcedAggregate
 */
public interface EventSource<ID> {
    /**
     * @return the id of the aggregate or <code>null</code> until the event that creates the aggregate has been applied
     */
    ID aggregateId();

    /**
     * Zero based version of the aggregate, i.e. the number of events applied minus one.<br>
     * {@link EventSourcedAggregate#NO_EVENTS_HAVE_BEEN_APPLIED} if no events have been applied
     */
    long version();

    boolean hasPendingEvents();

    /**
     * @return read-only view of the events raised but not yet taken, in the order they were raised
     */
    List<Object> pendingEvents();

    /**
     * Return the pending events and clear them
     *
     * @return the pending events in the order they were raised (empty if there were none)
     */
    List<Object> takeEvents();

    /**
     * Apply historic events to the aggregate. The version advances once per event
     *
     * @param events the events in the order they were persisted
     * @throws IllegalStateException if the aggregate has pending events
     */
    void restoreFromEvents(Iterable<?> events);

    /**
     * Same as {@link #restoreFromEvents(Iterable)} after verifying that the aggregate's {@link #version()} is <code>expectedVersion</code>
     *
     * @param events          the events persisted after <code>expectedVersion</code>
     * @param expectedVersion the version the aggregate must have
     * @throws AggregateVersionMismatchException if the aggregate's version differs from <code>expectedVersion</code>
     * @throws IllegalStateException     if the aggregate has pending events
     */
    void updateWithEvents(List<?> events, long expectedVersion);
}

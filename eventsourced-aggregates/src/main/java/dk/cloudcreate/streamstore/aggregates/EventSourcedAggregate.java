package dk.cloudcreate.streamstore.aggregates;

import java.util.*;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Base class for mutable, event sourced aggregates.<br>
 * A domain method validates its command against the current state and then calls {@link #raise(Object)} with the resulting event.
 * The event is applied to the aggregate immediately (so the state is up to date for subsequent validations in the same call chain),
 * the {@link #version()} is incremented and the event is added to the {@link #pendingEvents()} until a repository
 * {@link #takeEvents() takes} and persists them.<br>
 * Historic events are applied using {@link #restoreFromEvents(Iterable)} / {@link #updateWithEvents(List, long)}.
 * <p>
 * Events are applied using the aggregate type's {@link EventRoutes}: the explicit routes passed to {@link #EventSourcedAggregate(EventRoutes)}
 * or, when using the no-arguments constructor, the routes derived from the aggregate's {@link EventHandler} annotated methods.
 * The handler of the event that creates the aggregate must call {@link #aggregateId(Object)}.
 * <pre>{@code
 * public class Account extends EventSourcedAggregate<UUID, Account> {
 *     private BigDecimal balance;
 *
 *     private Account() {
 *     }
 *
 *     public Account(UUID id) {
 *         raise(new AccountCreated(id));
 *     }
 *
 *     public void credit(BigDecimal amount) {
 *         raise(new AccountCredited(aggregateId(), amount));
 *     }
 *
 *     @EventHandler
 *     private void on(AccountCreated e) {
 *         aggregateId(e.getAccountId());
 *         balance = BigDecimal.ZERO;
 *     }
 *
 *     @EventHandler
 *     private void on(AccountCredited e) {
 *         balance = balance.add(e.getAmount());
 *     }
 * }
 * }</pre>
 * Instances may be created without running any constructor (see {@link AggregateInstanceFactory#objenesisFactory()}),
 * which is why the internal fields are initialized lazily. Such instances always use the annotated routes.
 *
 * @param <ID>   the aggregate id type
 * @param <SELF> the concrete aggregate type
 */
public abstract class EventSourcedAggregate<ID, SELF extends EventSourcedAggregate<ID, SELF>> implements EventSource<ID> {
    public static final long NO_EVENTS_HAVE_BEEN_APPLIED = -1;

    private EventRoutes<SELF> routes;
    private ID                aggregateId;
    private List<Object>      pendingEvents;
    /**
     * Zero based version. <code>null</code> means {@link #NO_EVENTS_HAVE_BEEN_APPLIED}
     */
    private Long              version;

    /**
     * Create an aggregate that applies events using its {@link EventHandler} annotated methods
     */
    protected EventSourcedAggregate() {
        routes = annotatedRoutes();
    }

    /**
     * Create an aggregate that applies events using explicitly registered routes
     *
     * @param routes the aggregate type's routes (typically kept in a static field)
     */
    protected EventSourcedAggregate(EventRoutes<SELF> routes) {
        this.routes = checkNotNull(routes, "No routes provided");
        checkArgument(routes.aggregateType().isInstance(this),
                      "The routes are for '%s' and can't be used by '%s'",
                      routes.aggregateType().getName(),
                      getClass().getName());
    }

    /**
     * Apply a new event to the aggregate and add it to the pending events
     *
     * @param event the event
     * @throws IllegalArgumentException if the event is null
     */
    protected void raise(Object event) {
        checkArgument(event != null, "You must supply an event");
        applyEvent(event);
        version = version() + 1;
        _pendingEvents().add(event);
    }

    @Override
    public void restoreFromEvents(Iterable<?> events) {
        checkNotNull(events, "No events provided");
        checkState(!hasPendingEvents(),
                   "Cannot restore events into aggregate '%s' with id '%s' since it has %s pending event(s)",
                   getClass().getName(),
                   aggregateId,
                   _pendingEvents().size());
        for (var event : events) {
            checkArgument(event != null, "Cannot restore a null event into aggregate '%s'", getClass().getName());
            applyEvent(event);
            version = version() + 1;
        }
    }

    @Override
    public void updateWithEvents(List<?> events, long expectedVersion) {
        checkNotNull(events, "No events provided");
        if (version() != expectedVersion) {
            throw new AggregateVersionMismatchException(lenientFormat("Cannot update aggregate '%s' with id '%s' at version %s with events expected to follow version %s",
                                                                      getClass().getName(),
                                                                      aggregateId,
                                                                      version(),
                                                                      expectedVersion),
                                                        getClass(),
                                                        aggregateId,
                                                        expectedVersion,
                                                        version());
        }
        restoreFromEvents(events);
    }

    @Override
    public List<Object> takeEvents() {
        var events = List.copyOf(_pendingEvents());
        pendingEvents = new ArrayList<>();
        return events;
    }

    @Override
    public List<Object> pendingEvents() {
        return Collections.unmodifiableList(_pendingEvents());
    }

    @Override
    public boolean hasPendingEvents() {
        return !_pendingEvents().isEmpty();
    }

    @Override
    public ID aggregateId() {
        return aggregateId;
    }

    /**
     * Set the id of the aggregate. Must be called by the handler of the event that creates the aggregate
     *
     * @param aggregateId the aggregate id
     * @throws IllegalStateException if the aggregate already has a different id
     */
    protected void aggregateId(ID aggregateId) {
        checkNotNull(aggregateId, "No aggregateId provided");
        checkState(this.aggregateId == null || this.aggregateId.equals(aggregateId),
                   "Aggregate '%s' already has id '%s' and can't change it to '%s'",
                   getClass().getName(),
                   this.aggregateId,
                   aggregateId);
        this.aggregateId = aggregateId;
    }

    @Override
    public long version() {
        if (version == null) {
            version = NO_EVENTS_HAVE_BEEN_APPLIED;
        }
        return version;
    }

    @SuppressWarnings("unchecked")
    private void applyEvent(Object event) {
        if (routes == null) {
            routes = annotatedRoutes();
        }
        routes.apply((SELF) this, event);
    }

    @SuppressWarnings("unchecked")
    private EventRoutes<SELF> annotatedRoutes() {
        return EventRoutes.annotated((Class<SELF>) getClass());
    }

    private List<Object> _pendingEvents() {
        if (pendingEvents == null) {
            pendingEvents = new ArrayList<>();
        }
        return pendingEvents;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId +
                ", version=" + version() +
                ", pendingEvents=" + _pendingEvents().size() +
                '}';
    }
}

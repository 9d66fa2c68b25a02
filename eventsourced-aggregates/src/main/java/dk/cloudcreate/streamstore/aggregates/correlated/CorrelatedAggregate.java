package dk.cloudcreate.streamstore.aggregates.correlated;

import dk.cloudcreate.streamstore.aggregates.*;
import dk.cloudcreate.streamstore.common.correlation.*;

import java.util.*;

import static com.google.common.base.Preconditions.*;

/**
 * {@link EventSourcedAggregate} whose events are caused by a source message (typically the command being handled).<br>
 * Before raising events the aggregate must be given its {@link #source(CorrelatedMessage) source}, either directly or by loading it through
 * {@link dk.cloudcreate.streamstore.aggregates.repository.CorrelatedRepository}. Domain methods pass {@link #correlation()} to the
 * constructor of each {@link CorrelatedEvent} they raise, and {@link #raise(Object)} verifies that the event carries that correlation.
 *
 * @param <ID>   the aggregate id type
 * @param <SELF> the concrete aggregate type
 */
public abstract class CorrelatedAggregate<ID, SELF extends CorrelatedAggregate<ID, SELF>> extends EventSourcedAggregate<ID, SELF> {
    private CorrelatedMessage source;

    protected CorrelatedAggregate() {
    }

    protected CorrelatedAggregate(EventRoutes<SELF> routes) {
        super(routes);
    }

    /**
     * Set the message that causes the events raised from now on
     *
     * @param source the source message
     * @return this aggregate
     * @throws IllegalStateException if the aggregate has pending events caused by a different source
     */
    @SuppressWarnings("unchecked")
    public SELF source(CorrelatedMessage source) {
        checkNotNull(source, "No source provided");
        checkArgument(source.messageId() != null, "The source message must have a messageId");
        checkArgument(source.correlationId() != null, "The source message '%s' must have a correlationId", source.messageId());
        if (this.source != null && this.source.messageId().equals(source.messageId())) {
            return (SELF) this;
        }
        checkState(!hasPendingEvents(),
                   "Cannot change the source of aggregate '%s' with id '%s' to '%s' since it has pending events caused by '%s'",
                   getClass().getName(),
                   aggregateId(),
                   source.messageId(),
                   this.source != null ? this.source.messageId() : null);
        this.source = source;
        return (SELF) this;
    }

    public Optional<CorrelatedMessage> source() {
        return Optional.ofNullable(source);
    }

    /**
     * The correlation every event raised by this aggregate must carry: the source's correlation id and, as causation id, the source's message id
     *
     * @throws IllegalStateException if no source has been set
     */
    protected Correlation correlation() {
        checkState(source != null, "Aggregate '%s' with id '%s' has no source message", getClass().getName(), aggregateId());
        return source.causedCorrelation();
    }

    /**
     * @throws IllegalStateException if no source has been set, the event isn't a {@link CorrelatedMessage}, or the event's correlation
     *                               doesn't match {@link #correlation()}
     */
    @Override
    protected void raise(Object event) {
        checkArgument(event != null, "You must supply an event");
        checkState(event instanceof CorrelatedMessage,
                   "Aggregate '%s' can only raise CorrelatedMessage events, not '%s'",
                   getClass().getName(),
                   event.getClass().getName());
        var correlation = correlation();
        checkState(correlation.isCarriedBy((CorrelatedMessage) event),
                   "Event '%s' must carry %s",
                   event.getClass().getName(),
                   correlation);
        super.raise(event);
    }
}

package dk.cloudcreate.streamstore.aggregates.correlated;

import dk.cloudcreate.streamstore.common.correlation.*;
import dk.cloudcreate.streamstore.common.types.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class for events raised by a {@link CorrelatedAggregate}.<br>
 * The correlation id and causation id are passed to the constructor (see {@link CorrelatedAggregate#correlation()}) and are never changed afterwards.
 * Each event gets a new {@link MessageId}.
 * <pre>{@code
 * public class AccountCredited extends CorrelatedEvent {
 *     private UUID       accountId;
 *     private BigDecimal amount;
 *
 *     private AccountCredited() {
 *     }
 *
 *     public AccountCredited(Correlation correlation, UUID accountId, BigDecimal amount) {
 *         super(correlation);
 *         this.accountId = accountId;
 *         this.amount = amount;
 *     }
 * }
 * }</pre>
 */
public abstract class CorrelatedEvent implements CorrelatedMessage {
    private MessageId     messageId;
    private CorrelationId correlationId;
    private MessageId     causationId;

    /**
     * For deserialization
     */
    protected CorrelatedEvent() {
    }

    protected CorrelatedEvent(Correlation correlation) {
        checkNotNull(correlation, "No correlation provided");
        this.messageId = MessageId.random();
        this.correlationId = correlation.correlationId;
        this.causationId = correlation.causationId;
    }

    @Override
    public MessageId messageId() {
        return messageId;
    }

    @Override
    public CorrelationId correlationId() {
        return correlationId;
    }

    @Override
    public MessageId causationId() {
        return causationId;
    }
}

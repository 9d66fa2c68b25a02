package dk.cloudcreate.streamstore.common.correlation;

import dk.cloudcreate.streamstore.common.types.*;

/**
 * A message (command or event) that carries the tracing identifiers linking it to the chain of messages that caused it.
 * <ul>
 *     <li>{@link #messageId()} - the unique id of this message</li>
 *     <li>{@link #correlationId()} - the id shared by every message in the same chain</li>
 *     <li>{@link #causationId()} - the {@link #messageId()} of the message that directly caused this message.
 *     For the first message in a chain this is <code>null</code></li>
 * </ul>
 */
public interface CorrelatedMessage {
    MessageId messageId();

    CorrelationId correlationId();

    MessageId causationId();

    /**
     * The {@link Correlation} that messages caused by this message must carry
     */
    default Correlation causedCorrelation() {
        return Correlation.causedBy(this);
    }
}

package dk.cloudcreate.streamstore.common.correlation;

import dk.cloudcreate.streamstore.common.types.*;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The correlation id / causation id pair that a message receives from the message that caused it
 */
public final class Correlation {
    public final CorrelationId correlationId;
    public final MessageId     causationId;

    private Correlation(CorrelationId correlationId, MessageId causationId) {
        this.correlationId = checkNotNull(correlationId, "No correlationId provided");
        this.causationId = checkNotNull(causationId, "No causationId provided");
    }

    public static Correlation of(CorrelationId correlationId, MessageId causationId) {
        return new Correlation(correlationId, causationId);
    }

    /**
     * Resolve the {@link Correlation} of a message caused by <code>source</code>:
     * the correlation id is inherited from the source and the causation id is the source's message id
     *
     * @param source the message that caused the new message
     * @return the correlation for the new message
     */
    public static Correlation causedBy(CorrelatedMessage source) {
        checkNotNull(source, "No source message provided");
        checkNotNull(source.correlationId(), "Source message '%s' has no correlationId", source.messageId());
        return new Correlation(source.correlationId(), checkNotNull(source.messageId(), "Source message has no messageId"));
    }

    /**
     * Does the <code>message</code> carry exactly this correlation
     */
    public boolean isCarriedBy(CorrelatedMessage message) {
        return message != null &&
                correlationId.equals(message.correlationId()) &&
                causationId.equals(message.causationId());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Correlation)) return false;
        var that = (Correlation) o;
        return correlationId.equals(that.correlationId) && causationId.equals(that.causationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(correlationId, causationId);
    }

    @Override
    public String toString() {
        return "Correlation{" +
                "correlationId=" + correlationId +
                ", causationId=" + causationId +
                '}';
    }
}

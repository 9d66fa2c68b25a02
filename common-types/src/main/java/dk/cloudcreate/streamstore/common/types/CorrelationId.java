package dk.cloudcreate.streamstore.common.types;

import com.fasterxml.jackson.annotation.*;

import java.util.UUID;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Identifier shared by every message in the same cause-and-effect chain
 */
public final class CorrelationId implements Comparable<CorrelationId> {
    private final UUID value;

    private CorrelationId(UUID value) {
        this.value = checkNotNull(value, "No value provided");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CorrelationId of(UUID value) {
        return new CorrelationId(value);
    }

    public static CorrelationId of(String value) {
        checkNotNull(value, "No value provided");
        return new CorrelationId(UUID.fromString(value));
    }

    /**
     * Start a new correlation chain whose id is the id of the message that starts it
     */
    public static CorrelationId startedBy(MessageId messageId) {
        checkNotNull(messageId, "No messageId provided");
        return new CorrelationId(messageId.value());
    }

    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID());
    }

    @JsonValue
    public UUID value() {
        return value;
    }

    @Override
    public int compareTo(CorrelationId o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationId)) return false;
        return value.equals(((CorrelationId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}

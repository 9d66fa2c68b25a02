package dk.cloudcreate.streamstore.common.types;

import com.fasterxml.jackson.annotation.*;

import java.util.UUID;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Unique identifier of a single message (command or event)
 */
public final class MessageId implements Comparable<MessageId> {
    private final UUID value;

    private MessageId(UUID value) {
        this.value = checkNotNull(value, "No value provided");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MessageId of(UUID value) {
        return new MessageId(value);
    }

    public static MessageId of(String value) {
        checkNotNull(value, "No value provided");
        return new MessageId(UUID.fromString(value));
    }

    public static MessageId random() {
        return new MessageId(UUID.randomUUID());
    }

    @JsonValue
    public UUID value() {
        return value;
    }

    @Override
    public int compareTo(MessageId o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageId)) return false;
        return value.equals(((MessageId) o).value);
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

package dk.cloudcreate.streamstore.serializer;

import dk.cloudcreate.streamstore.common.types.*;

import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The metadata stored alongside an event's payload: the well known headers defined as constants on this class
 * plus any custom headers supplied when the event was saved
 */
public final class EventMetaData {
    /**
     * Shared by all events persisted by the same save/append call
     */
    public static final String COMMIT_ID           = "CommitId";
    public static final String MESSAGE_ID          = "MessageId";
    public static final String CORRELATION_ID      = "CorrelationId";
    public static final String CAUSATION_ID        = "CausationId";
    /**
     * Fully qualified class name of the event
     */
    public static final String EVENT_JAVA_TYPE     = "EventJavaType";
    /**
     * Fully qualified class name of the aggregate that raised the event
     */
    public static final String AGGREGATE_JAVA_TYPE = "AggregateJavaType";
    /**
     * Simple class name of the aggregate that raised the event
     */
    public static final String AGGREGATE_TYPE      = "AggregateType";

    private static final EventMetaData EMPTY = new EventMetaData(Map.of());

    private final Map<String, Object> headers;

    private EventMetaData(Map<String, Object> headers) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static EventMetaData of(Map<String, Object> headers) {
        checkNotNull(headers, "No headers provided");
        return headers.isEmpty() ? EMPTY : new EventMetaData(headers);
    }

    public static EventMetaData empty() {
        return EMPTY;
    }

    /**
     * Get the value of a header as a String
     *
     * @param header the header name
     * @return the header value or {@link Optional#empty()} if the header isn't present
     */
    public Optional<String> get(String header) {
        checkNotNull(header, "No header provided");
        return Optional.ofNullable(headers.get(header))
                       .map(Object::toString);
    }

    public boolean contains(String header) {
        return headers.containsKey(header);
    }

    public Optional<UUID> commitId() {
        return get(COMMIT_ID).map(UUID::fromString);
    }

    public Optional<MessageId> messageId() {
        return get(MESSAGE_ID).map(MessageId::of);
    }

    public Optional<CorrelationId> correlationId() {
        return get(CORRELATION_ID).map(CorrelationId::of);
    }

    public Optional<MessageId> causationId() {
        return get(CAUSATION_ID).map(MessageId::of);
    }

    public Optional<String> eventJavaType() {
        return get(EVENT_JAVA_TYPE);
    }

    public Optional<String> aggregateJavaType() {
        return get(AGGREGATE_JAVA_TYPE);
    }

    public Map<String, Object> asMap() {
        return headers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMetaData)) return false;
        return headers.equals(((EventMetaData) o).headers);
    }

    @Override
    public int hashCode() {
        return headers.hashCode();
    }

    @Override
    public String toString() {
        return "EventMetaData" + headers;
    }
}

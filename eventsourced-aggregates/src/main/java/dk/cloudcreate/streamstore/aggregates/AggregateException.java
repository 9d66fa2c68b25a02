package dk.cloudcreate.streamstore.aggregates;

/**
 * Base type for failures raised while loading, hydrating or persisting an {@link EventSource}
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}

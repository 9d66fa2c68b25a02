package dk.cloudcreate.streamstore.connection;

/**
 * Thrown when a {@link StreamStoreConnection} is used before it has been started or after it has been stopped
 */
public class StreamStoreConnectionException extends StreamStoreException {
    public StreamStoreConnectionException(String message) {
        super(message);
    }
}

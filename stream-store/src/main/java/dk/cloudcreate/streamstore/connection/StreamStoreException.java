package dk.cloudcreate.streamstore.connection;

public class StreamStoreException extends RuntimeException {
    public StreamStoreException(String message) {
        super(message);
    }

    public StreamStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StreamStoreException(Throwable cause) {
        super(cause);
    }
}

package dk.cloudcreate.streamstore.serializer.json;

import dk.cloudcreate.streamstore.connection.StreamStoreException;

public class JSONDeserializationException extends StreamStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}

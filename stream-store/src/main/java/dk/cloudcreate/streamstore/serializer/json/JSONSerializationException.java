package dk.cloudcreate.streamstore.serializer.json;

import dk.cloudcreate.streamstore.connection.StreamStoreException;

public class JSONSerializationException extends StreamStoreException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}

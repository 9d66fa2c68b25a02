package dk.cloudcreate.streamstore.connection;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when writing to (or deleting) a stream that has been hard deleted
 */
public class StreamDeletedException extends StreamStoreException {
    public final String streamName;

    public StreamDeletedException(String streamName) {
        super(lenientFormat("Stream '%s' has been hard deleted", streamName));
        this.streamName = streamName;
    }
}

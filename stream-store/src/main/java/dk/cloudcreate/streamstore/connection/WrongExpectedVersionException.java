package dk.cloudcreate.streamstore.connection;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Thrown when the expected version supplied to {@link StreamStoreConnection#appendToStream(String, long, java.util.List)}
 * or one of the delete operations doesn't match the actual version of the stream
 */
public class WrongExpectedVersionException extends StreamStoreException {
    public final String streamName;
    public final long   expectedVersion;
    public final long   actualVersion;

    public WrongExpectedVersionException(String streamName, long expectedVersion, long actualVersion) {
        super(lenientFormat("Wrong expected version for stream '%s'. Expected version %s but the actual version was %s",
                            streamName,
                            ExpectedVersion.describe(expectedVersion),
                            ExpectedVersion.describe(actualVersion)));
        this.streamName = streamName;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}

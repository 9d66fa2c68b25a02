package dk.cloudcreate.streamstore.connection;

/**
 * Expected version sentinels used when appending to or deleting a stream.<br>
 * Any value &gt;= 0 means "the event number of the last event in the stream must be exactly this value".
 */
public final class ExpectedVersion {
    /**
     * The stream must not exist (or must have been soft deleted)
     */
    public static final long NO_STREAM     = -1;
    /**
     * Skip the version check. Only intended for writers that aren't concurrency sensitive
     */
    public static final long ANY           = -2;
    /**
     * The stream must exist, regardless of its version
     */
    public static final long STREAM_EXISTS = -4;

    private ExpectedVersion() {
    }

    /**
     * Check if the <code>expectedVersion</code> is satisfied by a stream whose last event number is <code>currentVersion</code>
     *
     * @param expectedVersion the caller's expected version (a sentinel or a concrete event number)
     * @param currentVersion  the event number of the last event in the stream or {@link #NO_STREAM} if the stream doesn't exist
     * @return true if the append/delete may proceed
     */
    public static boolean matches(long expectedVersion, long currentVersion) {
        if (expectedVersion == ANY) {
            return true;
        }
        if (expectedVersion == NO_STREAM) {
            return currentVersion == NO_STREAM;
        }
        if (expectedVersion == STREAM_EXISTS) {
            return currentVersion > NO_STREAM;
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("Unsupported expected version " + expectedVersion);
        }
        return expectedVersion == currentVersion;
    }

    public static String describe(long version) {
        if (version == NO_STREAM) {
            return "NoStream";
        } else if (version == ANY) {
            return "Any";
        } else if (version == STREAM_EXISTS) {
            return "StreamExists";
        }
        return String.valueOf(version);
    }
}

package dk.cloudcreate.streamstore.connection;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Naming rules for the read-only projection streams that a {@link StreamStoreConnection} maintains:
 * <ul>
 *     <li><code>$ce-{category}</code> - every event appended to a stream named <code>{category}-{id}</code></li>
 *     <li><code>$et-{eventType}</code> - every event with the given event type</li>
 * </ul>
 */
public final class SystemStreams {
    public static final String SYSTEM_STREAM_PREFIX   = "$";
    public static final String CATEGORY_STREAM_PREFIX = "$ce-";
    public static final String EVENT_TYPE_PREFIX      = "$et-";
    public static final char   CATEGORY_SEPARATOR     = '-';

    private SystemStreams() {
    }

    public static boolean isSystemStream(String streamName) {
        return checkNotNull(streamName, "No streamName provided").startsWith(SYSTEM_STREAM_PREFIX);
    }

    public static boolean isCategoryStream(String streamName) {
        return checkNotNull(streamName, "No streamName provided").startsWith(CATEGORY_STREAM_PREFIX);
    }

    public static boolean isEventTypeStream(String streamName) {
        return checkNotNull(streamName, "No streamName provided").startsWith(EVENT_TYPE_PREFIX);
    }

    /**
     * The category of a stream is the part of its name before the first {@link #CATEGORY_SEPARATOR}
     * (or the full name if it doesn't contain a separator)
     */
    public static String categoryOf(String streamName) {
        checkNotNull(streamName, "No streamName provided");
        var separatorIndex = streamName.indexOf(CATEGORY_SEPARATOR);
        return separatorIndex < 0 ? streamName : streamName.substring(0, separatorIndex);
    }

    public static String categoryStream(String category) {
        return CATEGORY_STREAM_PREFIX + checkNotNull(category, "No category provided");
    }

    public static String eventTypeStream(String eventType) {
        return EVENT_TYPE_PREFIX + checkNotNull(eventType, "No eventType provided");
    }

    /**
     * @param projectionStreamName a <code>$ce-</code> or <code>$et-</code> stream name
     * @return the category or event type the projection stream covers
     */
    public static String projectedName(String projectionStreamName) {
        if (isCategoryStream(projectionStreamName)) {
            return projectionStreamName.substring(CATEGORY_STREAM_PREFIX.length());
        }
        if (isEventTypeStream(projectionStreamName)) {
            return projectionStreamName.substring(EVENT_TYPE_PREFIX.length());
        }
        throw new IllegalArgumentException("'" + projectionStreamName + "' is not a projection stream");
    }
}

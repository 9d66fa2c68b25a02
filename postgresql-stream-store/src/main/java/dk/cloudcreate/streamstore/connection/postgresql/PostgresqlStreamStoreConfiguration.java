package dk.cloudcreate.streamstore.connection.postgresql;

import java.time.Clock;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.*;

/**
 * Configuration for {@link PostgresqlStreamStoreConnection}
 */
public final class PostgresqlStreamStoreConfiguration {
    public static final String DEFAULT_CONNECTION_NAME    = "PostgresqlStreamStore";
    public static final String DEFAULT_STREAMS_TABLE_NAME = "streams";
    public static final String DEFAULT_EVENTS_TABLE_NAME  = "stream_events";

    /**
     * Table names are concatenated into the SQL statements, so only plain (unquoted) PostgreSQL identifiers are accepted
     */
    private static final Pattern VALID_TABLE_NAME = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

    public final String connectionName;
    /**
     * Contains one row per stream with the stream's current version and deletion state
     */
    public final String streamsTableName;
    /**
     * Contains the events of all streams
     */
    public final String eventsTableName;
    public final Clock  clock;

    private PostgresqlStreamStoreConfiguration(String connectionName, String streamsTableName, String eventsTableName, Clock clock) {
        this.connectionName = checkNotNull(connectionName, "No connectionName provided");
        this.streamsTableName = validateTableName(streamsTableName);
        this.eventsTableName = validateTableName(eventsTableName);
        checkArgument(!streamsTableName.equals(eventsTableName), "streamsTableName and eventsTableName must be different");
        this.clock = checkNotNull(clock, "No clock provided");
    }

    public static PostgresqlStreamStoreConfiguration defaultConfiguration() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static String validateTableName(String tableName) {
        checkNotNull(tableName, "No tableName provided");
        checkArgument(VALID_TABLE_NAME.matcher(tableName).matches(),
                      "Invalid table name '%s'. Table names must be lower case, start with a letter or '_', only contain letters, digits and '_' and be at most 63 characters long",
                      tableName);
        return tableName;
    }

    @Override
    public String toString() {
        return "PostgresqlStreamStoreConfiguration{" +
                "connectionName='" + connectionName + '\'' +
                ", streamsTableName='" + streamsTableName + '\'' +
                ", eventsTableName='" + eventsTableName + '\'' +
                '}';
    }

    public static final class Builder {
        private String connectionName   = DEFAULT_CONNECTION_NAME;
        private String streamsTableName = DEFAULT_STREAMS_TABLE_NAME;
        private String eventsTableName  = DEFAULT_EVENTS_TABLE_NAME;
        private Clock  clock            = Clock.systemUTC();

        private Builder() {
        }

        public Builder connectionName(String connectionName) {
            this.connectionName = connectionName;
            return this;
        }

        public Builder streamsTableName(String streamsTableName) {
            this.streamsTableName = streamsTableName;
            return this;
        }

        public Builder eventsTableName(String eventsTableName) {
            this.eventsTableName = eventsTableName;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PostgresqlStreamStoreConfiguration build() {
            return new PostgresqlStreamStoreConfiguration(connectionName, streamsTableName, eventsTableName, clock);
        }
    }
}

package dk.cloudcreate.streamstore.connection.postgresql;

import dk.cloudcreate.streamstore.connection.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;
import java.util.UUID;

import static com.google.common.base.Strings.lenientFormat;

class RecordedEventRowMapper implements RowMapper<RecordedEvent> {
    static final String STREAM_NAME_COLUMN  = "stream_name";
    static final String EVENT_NUMBER_COLUMN = "event_number";
    static final String EVENT_ID_COLUMN     = "event_id";
    static final String EVENT_TYPE_COLUMN   = "event_type";
    static final String PAYLOAD_COLUMN      = "payload";
    static final String METADATA_COLUMN     = "metadata";
    static final String IS_JSON_COLUMN      = "is_json";
    static final String CREATED_COLUMN      = "created";

    @Override
    public RecordedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventType = rs.getString(EVENT_TYPE_COLUMN);
        if (eventType == null || eventType.isBlank()) {
            throw new StreamStoreException(lenientFormat("Row %s of stream '%s' - Column '%s' was empty or blank",
                                                         rs.getRow(),
                                                         rs.getString(STREAM_NAME_COLUMN),
                                                         EVENT_TYPE_COLUMN));
        }
        return new RecordedEvent(rs.getString(STREAM_NAME_COLUMN),
                                 rs.getLong(EVENT_NUMBER_COLUMN),
                                 rs.getObject(EVENT_ID_COLUMN, UUID.class),
                                 eventType,
                                 rs.getBytes(PAYLOAD_COLUMN),
                                 rs.getBytes(METADATA_COLUMN),
                                 rs.getBoolean(IS_JSON_COLUMN),
                                 rs.getObject(CREATED_COLUMN, OffsetDateTime.class));
    }
}

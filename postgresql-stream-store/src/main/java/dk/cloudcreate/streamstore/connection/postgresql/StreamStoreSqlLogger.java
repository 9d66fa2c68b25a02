package dk.cloudcreate.streamstore.connection.postgresql;

import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;

import static com.google.common.base.Strings.lenientFormat;

/**
 * Logs the SQL executed by {@link PostgresqlStreamStoreConnection} on the <code>StreamStore.Sql</code> logger:
 * successful statements at trace level and failed statements at error level
 */
public class StreamStoreSqlLogger implements SqlLogger {
    private final Logger log;

    public StreamStoreSqlLogger() {
        log = LoggerFactory.getLogger("StreamStore.Sql");
    }

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Execution time: {} ms - {}", Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis(), context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        log.error(lenientFormat("Failed execution after %s ms - %s", Duration.between(context.getExecutionMoment(), context.getExceptionMoment()).toMillis(), context.getRenderedSql()), ex);
    }
}

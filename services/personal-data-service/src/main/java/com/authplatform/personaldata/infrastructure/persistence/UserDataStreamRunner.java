package com.authplatform.personaldata.infrastructure.persistence;

import com.authplatform.personaldata.infrastructure.logging.RedactingLoggerRegistry;
import com.authplatform.personaldata.shared.exception.PersonalDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.sql.SQLException;

/**
 * Streams the configured table through the redacting logger once at startup.
 */
@Component
@ConditionalOnProperty(name = "app.stream.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class UserDataStreamRunner implements CommandLineRunner {

    private final RedactingLoggerRegistry loggerRegistry;
    private final UserRowStreamer streamer;

    @Value("${app.redaction.logger-name:user_data}")
    private String loggerName;

    @Override
    public void run(String... args) {
        TableSchema schema = streamer.getSchema();
        for (String column : SensitiveColumnAudit.unredactedColumns(schema, loggerRegistry.getFields())) {
            log.warn("Column '{}' of table '{}' looks sensitive but is not redacted", column, schema.table());
        }

        Logger target = loggerRegistry.getOrCreate(loggerName);
        try {
            long rows = streamer.stream(target);
            log.info("Streamed {} row(s) from '{}' to logger '{}'", rows, schema.table(), loggerName);
        } catch (RuntimeException e) {
            // Driver messages can quote row data, so only codes go to this unredacted logger
            log.error("Streaming '{}' aborted: {}", schema.table(), describe(e));
            throw e;
        }
    }

    private static String describe(RuntimeException e) {
        String code = e instanceof PersonalDataException failure ? failure.getErrorCode() : e.getClass().getSimpleName();
        if (e.getCause() instanceof SQLException sql) {
            return code + " (SQLState " + sql.getSQLState() + ", vendor code " + sql.getErrorCode() + ")";
        }
        return code;
    }
}

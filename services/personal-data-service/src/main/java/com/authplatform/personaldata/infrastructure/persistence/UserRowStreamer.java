package com.authplatform.personaldata.infrastructure.persistence;

import com.authplatform.personaldata.shared.exception.DataSourceException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Reads every row of a table and logs it as one {@code column=value;column=value;} message.
 *
 * <p>Column names are not checked against any field set: masking is the job of the
 * logger's formatter. Any connection or query failure aborts the whole run.
 */
@Slf4j
public class UserRowStreamer {

    private final DataSource dataSource;
    private final TableSchema schema;
    private final char separator;

    public UserRowStreamer(DataSource dataSource, TableSchema schema, char separator) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.separator = separator;
    }

    /**
     * Streams all rows to {@code target} at INFO level.
     *
     * @return number of rows logged
     * @throws DataSourceException if the connection or query fails
     */
    public long stream(Logger target) {
        String sql = schema.selectSql();
        long rows = 0;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement statement = conn.prepareStatement(sql);
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                target.info(formatRow(rs));
                rows++;
            }
        } catch (SQLException e) {
            throw new DataSourceException("Failed to stream rows from table '" + schema.table() + "' after "
                    + rows + " row(s): " + e.getMessage(), e);
        }
        log.debug("Streamed {} row(s) from {}", rows, schema.table());
        return rows;
    }

    String formatRow(ResultSet rs) throws SQLException {
        List<String> columns = schema.columns();
        StringBuilder message = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            String value = rs.getString(i + 1);
            message.append(columns.get(i)).append('=')
                    .append(value == null ? "" : value)
                    .append(separator);
        }
        return message.toString();
    }

    public TableSchema getSchema() {
        return schema;
    }
}

package com.authplatform.personaldata.infrastructure.persistence;

import com.authplatform.personaldata.shared.exception.ConfigurationException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Table name plus the fixed column order rows are read in.
 */
public record TableSchema(String table, List<String> columns) {

    public static final TableSchema USERS = new TableSchema("users",
            List.of("name", "email", "phone", "ssn", "password", "ip", "last_login", "user_agent"));

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public TableSchema {
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new ConfigurationException("app.stream.table", "Invalid table name: " + table);
        }
        if (columns == null || columns.isEmpty()) {
            throw new ConfigurationException("app.stream.columns", "At least one column must be selected");
        }
        for (String column : columns) {
            if (column == null || !IDENTIFIER.matcher(column).matches()) {
                throw new ConfigurationException("app.stream.columns", "Invalid column name: " + column);
            }
        }
        columns = List.copyOf(columns);
    }

    public String selectSql() {
        return "SELECT " + String.join(", ", columns) + " FROM " + table;
    }
}

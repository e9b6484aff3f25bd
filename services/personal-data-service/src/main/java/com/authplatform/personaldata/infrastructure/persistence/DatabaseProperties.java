package com.authplatform.personaldata.infrastructure.persistence;

import com.authplatform.personaldata.shared.exception.ConfigurationException;

/**
 * Connection settings for the personal data database, sourced from the
 * {@code PERSONAL_DATA_DB_*} environment variables.
 */
public record DatabaseProperties(String host, int port, String username, String password, String name) {

    public DatabaseProperties {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("PERSONAL_DATA_DB_NAME",
                    "Database name must be specified in the environment variable PERSONAL_DATA_DB_NAME");
        }
        if (host == null || host.isBlank()) {
            host = "localhost";
        }
        if (username == null || username.isBlank()) {
            username = "root";
        }
        if (password == null) {
            password = "";
        }
    }

    public String jdbcUrl() {
        return "jdbc:mysql://" + host + ":" + port + "/" + name;
    }

    @Override
    public String toString() {
        return "DatabaseProperties[host=" + host + ", port=" + port + ", username=" + username
                + ", password=***, name=" + name + "]";
    }
}

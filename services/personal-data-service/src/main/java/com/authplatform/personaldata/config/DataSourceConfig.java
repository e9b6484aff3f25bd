package com.authplatform.personaldata.config;

import com.authplatform.personaldata.infrastructure.persistence.DatabaseProperties;
import com.authplatform.personaldata.infrastructure.persistence.TableSchema;
import com.authplatform.personaldata.infrastructure.persistence.UserRowStreamer;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.Arrays;

@Configuration
@Slf4j
public class DataSourceConfig {

    @Bean
    public DatabaseProperties databaseProperties(
            @Value("${PERSONAL_DATA_DB_HOST:localhost}") String host,
            @Value("${PERSONAL_DATA_DB_PORT:3306}") int port,
            @Value("${PERSONAL_DATA_DB_USERNAME:root}") String username,
            @Value("${PERSONAL_DATA_DB_PASSWORD:}") String password,
            @Value("${PERSONAL_DATA_DB_NAME:}") String name) {
        return new DatabaseProperties(host, port, username, password, name);
    }

    /**
     * Connects lazily: an unreachable server shows up on the first query, not at startup.
     */
    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(
            DatabaseProperties properties,
            @Value("${app.datasource.url:}") String urlOverride,
            @Value("${app.datasource.maximum-pool-size:2}") int maximumPoolSize) {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("personal-data");
        dataSource.setJdbcUrl(urlOverride.isBlank() ? properties.jdbcUrl() : urlOverride);
        dataSource.setUsername(properties.username());
        dataSource.setPassword(properties.password());
        dataSource.setMaximumPoolSize(maximumPoolSize);
        log.info("Personal data source configured: {}", properties);
        return dataSource;
    }

    @Bean
    public TableSchema tableSchema(
            @Value("${app.stream.table:users}") String table,
            @Value("${app.stream.columns:name,email,phone,ssn,password,ip,last_login,user_agent}") String[] columns) {
        return new TableSchema(table, Arrays.asList(columns));
    }

    @Bean
    public UserRowStreamer userRowStreamer(
            DataSource dataSource,
            TableSchema tableSchema,
            @Value("${app.redaction.separator:;}") char separator) {
        return new UserRowStreamer(dataSource, tableSchema, separator);
    }
}

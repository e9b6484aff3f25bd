package com.authplatform.personaldata.config;

import ch.qos.logback.classic.LoggerContext;
import com.authplatform.personaldata.infrastructure.logging.LogSinkFactory;
import com.authplatform.personaldata.infrastructure.logging.RedactingLoggerRegistry;
import com.authplatform.personaldata.shared.redaction.FieldSet;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.Arrays;

@Configuration
public class RedactionConfig {

    @Bean
    public FieldSet redactedFields(
            @Value("${app.redaction.fields:email,password,ssn,phone_number,address}") String[] fields) {
        return FieldSet.of(Arrays.asList(fields));
    }

    @Bean
    public LogSinkFactory logSinkFactory() {
        return LogSinkFactory.console();
    }

    @Bean(initMethod = "init", destroyMethod = "shutdown")
    public RedactingLoggerRegistry redactingLoggerRegistry(
            FieldSet redactedFields,
            LogSinkFactory logSinkFactory,
            @Value("${app.redaction.tag:HOLBERTON}") String tag,
            @Value("${app.redaction.mask:***}") String mask,
            @Value("${app.redaction.separator:;}") char separator,
            @Value("${app.redaction.zone:}") String zone) {
        ZoneId zoneId = zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
        return new RedactingLoggerRegistry(loggerContext(), logSinkFactory,
                tag, redactedFields, mask, separator, zoneId);
    }

    private static LoggerContext loggerContext() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            return context;
        }
        throw new IllegalStateException("Logback is required, found " + factory.getClass().getName());
    }
}

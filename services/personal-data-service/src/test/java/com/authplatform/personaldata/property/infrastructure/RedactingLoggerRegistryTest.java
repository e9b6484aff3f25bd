package com.authplatform.personaldata.property.infrastructure;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.authplatform.personaldata.infrastructure.logging.RedactingLoggerRegistry;
import com.authplatform.personaldata.shared.exception.ConfigurationException;
import com.authplatform.personaldata.shared.redaction.FieldSet;
import com.authplatform.personaldata.support.MemorySinkFactory;
import net.jqwik.api.*;
import org.junit.jupiter.api.Tag;
import org.slf4j.Logger;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("Feature: personal-data-service, Property 5: Logger Factory")
class RedactingLoggerRegistryTest {

    private static final String LINE = "\\[HOLBERTON] user_data INFO \\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2},\\d{3}: ";

    private final LoggerContext context = new LoggerContext();
    private final MemorySinkFactory sinks = new MemorySinkFactory();

    @Example
    @Label("Scenario: same name twice attaches one sink and emits each record once")
    void sameNameAttachesOneSink() {
        RedactingLoggerRegistry registry = startedRegistry(FieldSet.PII_FIELDS);

        Logger first = registry.getOrCreate("user_data");
        Logger second = registry.getOrCreate("user_data");
        second.info("name=Bob;email=bob@x.com;");

        assertThat(second).isSameAs(first);
        assertThat(sinks.createdSinks()).hasSize(1);
        assertThat(appenderCount(first)).isEqualTo(1);
        assertThat(sinks.lines()).hasSize(1);
        assertThat(sinks.lines().get(0)).matches(LINE + "name=Bob;email=\\*\\*\\*;");
    }

    @Example
    @Label("Records below INFO are dropped")
    void debugIsDropped() {
        Logger logger = startedRegistry(FieldSet.PII_FIELDS).getOrCreate("user_data");

        logger.debug("ssn=1;");
        logger.trace("ssn=2;");
        logger.warn("ssn=3;");

        assertThat(logger.isDebugEnabled()).isFalse();
        assertThat(logger.isInfoEnabled()).isTrue();
        assertThat(sinks.lines()).hasSize(1);
        assertThat(sinks.lines().get(0)).contains(" WARN ").endsWith(": ssn=***;");
    }

    @Example
    @Label("Records never reach ancestor loggers")
    void recordsDoNotPropagate() {
        ListAppender<ILoggingEvent> rootAppender = listAppender();
        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.TRACE);
        root.addAppender(rootAppender);
        ListAppender<ILoggingEvent> parentAppender = listAppender();
        context.getLogger("app").addAppender(parentAppender);

        Logger logger = startedRegistry(FieldSet.PII_FIELDS).getOrCreate("app.user_data");
        logger.info("password=hunter2;");

        assertThat(rootAppender.list).isEmpty();
        assertThat(parentAppender.list).isEmpty();
        assertThat(sinks.output()).contains("password=***;").doesNotContain("hunter2");
    }

    @Example
    @Label("Appenders attached before the registry took over are detached")
    void existingAppendersAreDetached() {
        ListAppender<ILoggingEvent> unredacted = listAppender();
        context.getLogger("user_data").addAppender(unredacted);

        Logger logger = startedRegistry(FieldSet.PII_FIELDS).getOrCreate("user_data");
        logger.info("email=bob@x.com;");

        assertThat(unredacted.list).isEmpty();
        assertThat(appenderCount(logger)).isEqualTo(1);
    }

    @Example
    @Label("Distinct names get distinct sinks")
    void distinctNamesGetDistinctSinks() {
        RedactingLoggerRegistry registry = startedRegistry(FieldSet.PII_FIELDS);

        registry.getOrCreate("user_data").info("email=a;");
        registry.getOrCreate("audit").info("ssn=b;");

        assertThat(sinks.createdSinks()).hasSize(2);
        assertThat(registry.isConfigured("user_data")).isTrue();
        assertThat(registry.isConfigured("audit")).isTrue();
        assertThat(registry.isConfigured("other")).isFalse();
        assertThat(sinks.lines()).hasSize(2);
    }

    @Example
    @Label("Concurrent first calls for one name attach exactly one sink")
    void concurrentCallsAttachOneSink() throws Exception {
        RedactingLoggerRegistry registry = startedRegistry(FieldSet.PII_FIELDS);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<Logger> loggers = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    loggers.add(registry.getOrCreate("user_data"));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(loggers).hasSize(1);
        assertThat(sinks.createdSinks()).hasSize(1);
    }

    @Example
    @Label("Empty field set is rejected at construction")
    void emptyFieldSetIsRejected() {
        assertThatThrownBy(() -> registry(FieldSet.of(List.of())))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("At least one field");
    }

    @Example
    @Label("Lifecycle: no loggers before init or after shutdown")
    void lifecycleIsEnforced() {
        RedactingLoggerRegistry registry = registry(FieldSet.PII_FIELDS);

        assertThatThrownBy(() -> registry.getOrCreate("user_data")).isInstanceOf(IllegalStateException.class);

        registry.init();
        assertThatThrownBy(registry::init).isInstanceOf(IllegalStateException.class);
        Logger logger = registry.getOrCreate("user_data");

        registry.shutdown();
        registry.shutdown();

        assertThat(sinks.createdSinks()).allSatisfy(sink -> assertThat(sink.isStarted()).isFalse());
        assertThat(appenderCount(logger)).isZero();
        assertThatThrownBy(() -> registry.getOrCreate("user_data")).isInstanceOf(IllegalStateException.class);
    }

    @Example
    @Label("Blank logger names are rejected")
    void blankNamesAreRejected() {
        RedactingLoggerRegistry registry = startedRegistry(FieldSet.PII_FIELDS);

        assertThatThrownBy(() -> registry.getOrCreate(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.getOrCreate(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private RedactingLoggerRegistry registry(FieldSet fields) {
        return new RedactingLoggerRegistry(context, sinks, "HOLBERTON", fields, "***", ';', ZoneOffset.UTC);
    }

    private RedactingLoggerRegistry startedRegistry(FieldSet fields) {
        RedactingLoggerRegistry registry = registry(fields);
        registry.init();
        return registry;
    }

    private ListAppender<ILoggingEvent> listAppender() {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.setContext(context);
        appender.start();
        return appender;
    }

    private static int appenderCount(Logger logger) {
        int count = 0;
        var appenders = ((ch.qos.logback.classic.Logger) logger).iteratorForAppenders();
        while (appenders.hasNext()) {
            appenders.next();
            count++;
        }
        return count;
    }
}

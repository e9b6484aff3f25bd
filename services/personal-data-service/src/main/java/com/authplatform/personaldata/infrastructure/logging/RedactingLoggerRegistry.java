package com.authplatform.personaldata.infrastructure.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import com.authplatform.personaldata.shared.redaction.FieldSet;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out loggers whose only output is a redacting sink.
 *
 * <p>Each name is configured once: level INFO, additivity off, any pre-existing appenders
 * detached and exactly one sink attached. Later calls with the same name return the same
 * logger untouched. Lifecycle is {@link #init()}, then {@link #getOrCreate(String)}, then
 * {@link #shutdown()}, which stops every sink this registry attached.
 */
@Slf4j
public class RedactingLoggerRegistry {

    private static final String SINK_PREFIX = "redacting-sink-";

    private enum State { NEW, RUNNING, STOPPED }

    private final LoggerContext loggerContext;
    private final LogSinkFactory sinkFactory;
    private final RedactingLayout layout;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ch.qos.logback.classic.Logger> loggers = new LinkedHashMap<>();
    private final Map<String, OutputStreamAppender<ILoggingEvent>> sinks = new LinkedHashMap<>();
    private volatile State state = State.NEW;

    public RedactingLoggerRegistry(LoggerContext loggerContext, LogSinkFactory sinkFactory,
                                   String tag, FieldSet fields, String mask, char separator, ZoneId zone) {
        this.loggerContext = loggerContext;
        this.sinkFactory = sinkFactory;
        this.layout = new RedactingLayout(tag, fields, mask, separator, zone);
        this.layout.setContext(loggerContext);
    }

    public void init() {
        lock.lock();
        try {
            if (state != State.NEW) {
                throw new IllegalStateException("Registry already " + state.name().toLowerCase());
            }
            layout.start();
            state = State.RUNNING;
            log.debug("Redacting logger registry initialized with fields {}", getFields().names());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the redacting logger for {@code name}, configuring it on first use.
     */
    public Logger getOrCreate(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Logger name cannot be null or blank");
        }
        lock.lock();
        try {
            if (state != State.RUNNING) {
                throw new IllegalStateException("Registry is not running (state " + state + ")");
            }
            ch.qos.logback.classic.Logger existing = loggers.get(name);
            if (existing != null) {
                return existing;
            }
            ch.qos.logback.classic.Logger logger = configure(name);
            loggers.put(name, logger);
            return logger;
        } finally {
            lock.unlock();
        }
    }

    public boolean isConfigured(String name) {
        lock.lock();
        try {
            return loggers.containsKey(name);
        } finally {
            lock.unlock();
        }
    }

    public void shutdown() {
        lock.lock();
        try {
            if (state == State.STOPPED) {
                return;
            }
            loggers.forEach((name, logger) -> {
                OutputStreamAppender<ILoggingEvent> sink = sinks.get(name);
                if (sink != null) {
                    logger.detachAppender(sink);
                    sink.stop();
                }
            });
            log.debug("Redacting logger registry stopped {} sink(s)", sinks.size());
            sinks.clear();
            loggers.clear();
            layout.stop();
            state = State.STOPPED;
        } finally {
            lock.unlock();
        }
    }

    public FieldSet getFields() {
        return layout.getRule().fields();
    }

    private ch.qos.logback.classic.Logger configure(String name) {
        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(loggerContext);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.setLayout(layout);
        encoder.start();

        OutputStreamAppender<ILoggingEvent> sink = sinkFactory.newSink(name);
        sink.setContext(loggerContext);
        sink.setName(SINK_PREFIX + name);
        sink.setEncoder(encoder);
        sink.start();

        ch.qos.logback.classic.Logger logger = loggerContext.getLogger(name);
        logger.detachAndStopAllAppenders();
        logger.setLevel(Level.INFO);
        logger.setAdditive(false);
        logger.addAppender(sink);

        sinks.put(name, sink);
        log.debug("Configured redacting logger '{}'", name);
        return logger;
    }
}

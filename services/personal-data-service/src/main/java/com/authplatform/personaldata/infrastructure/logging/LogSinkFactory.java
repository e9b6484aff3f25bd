package com.authplatform.personaldata.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.OutputStreamAppender;

/**
 * Creates the single sink a redacting logger writes to. The registry sets the
 * context, encoder and name, and starts the appender.
 */
@FunctionalInterface
public interface LogSinkFactory {

    OutputStreamAppender<ILoggingEvent> newSink(String loggerName);

    static LogSinkFactory console() {
        return loggerName -> new ConsoleAppender<>();
    }
}

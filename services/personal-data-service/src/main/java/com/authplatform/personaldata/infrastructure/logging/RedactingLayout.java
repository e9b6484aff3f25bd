package com.authplatform.personaldata.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.authplatform.personaldata.shared.redaction.FieldSet;
import com.authplatform.personaldata.shared.redaction.RedactionRule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Logback layout producing {@code [TAG] <logger> <LEVEL> <timestamp>: <message>} lines.
 * Only the message payload (and any stack trace) is redacted; tag, logger name, level
 * and timestamp are written as-is.
 */
public class RedactingLayout extends LayoutBase<ILoggingEvent> {

    public static final String DEFAULT_TAG = "HOLBERTON";

    private static final DateTimeFormatter TIMESTAMP_PATTERN = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS");

    private final String tag;
    private final RedactionRule rule;
    private final DateTimeFormatter timestampFormatter;

    public RedactingLayout(FieldSet fields) {
        this(DEFAULT_TAG, fields, RedactionRule.DEFAULT_MASK, RedactionRule.DEFAULT_SEPARATOR, ZoneId.systemDefault());
    }

    public RedactingLayout(String tag, FieldSet fields, String mask, char separator, ZoneId zone) {
        if (fields != null) {
            fields.requireUsable(separator);
        }
        this.tag = tag;
        this.rule = RedactionRule.compile(fields, mask, separator);
        this.timestampFormatter = TIMESTAMP_PATTERN.withZone(zone);
    }

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder line = new StringBuilder(128)
                .append('[').append(tag).append("] ")
                .append(event.getLoggerName()).append(' ')
                .append(event.getLevel()).append(' ')
                .append(timestampFormatter.format(Instant.ofEpochMilli(event.getTimeStamp())))
                .append(": ")
                .append(redact(event.getFormattedMessage()))
                .append(CoreConstants.LINE_SEPARATOR);

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            line.append(redact(ThrowableProxyUtil.asString(throwable)))
                    .append(CoreConstants.LINE_SEPARATOR);
        }
        return line.toString();
    }

    /**
     * Redacts a rendered message with this layout's rule.
     */
    public String redact(String message) {
        return message == null ? "" : rule.apply(message);
    }

    public RedactionRule getRule() {
        return rule;
    }
}

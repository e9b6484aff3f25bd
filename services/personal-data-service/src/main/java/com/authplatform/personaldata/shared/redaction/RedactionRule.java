package com.authplatform.personaldata.shared.redaction;

import com.authplatform.personaldata.shared.exception.ConfigurationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A field set, mask and separator compiled into a single pattern.
 * Immutable and safe to share between threads.
 */
public final class RedactionRule {

    public static final String DEFAULT_MASK = "***";
    public static final char DEFAULT_SEPARATOR = ';';

    /** Ends a segment regardless of the configured separator. */
    static final char TERMINATOR = ';';

    private final FieldSet fields;
    private final String mask;
    private final Pattern pattern;

    private RedactionRule(FieldSet fields, String mask, char separator) {
        this.fields = fields;
        this.mask = mask;
        this.pattern = fields.isEmpty() ? null : buildPattern(fields, separator);
    }

    public static RedactionRule compile(FieldSet fields, String mask, char separator) {
        if (fields == null) {
            throw new ConfigurationException("app.redaction.fields", "Field set cannot be null");
        }
        if (mask == null) {
            throw new ConfigurationException("app.redaction.mask", "Mask cannot be null");
        }
        if (separator == '=') {
            throw new ConfigurationException("app.redaction.separator", "Separator cannot be '='");
        }
        return new RedactionRule(fields, mask, separator);
    }

    /**
     * Replaces the value of every {@code field=value} segment whose field is in the set.
     * Never throws for message content; {@code null} and empty messages come back as given.
     */
    public String apply(String message) {
        if (pattern == null || message == null || message.isEmpty()) {
            return message;
        }
        Matcher matcher = pattern.matcher(message);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(match.group(1) + "=" + mask));
    }

    public FieldSet fields() {
        return fields;
    }

    // A field name matches wherever it is immediately followed by '=', e.g. inside User(email=...)
    private static Pattern buildPattern(FieldSet fields, char separator) {
        String delimiters = escape(separator) + escape(TERMINATOR);
        String alternation = fields.names().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(" + alternation + ")=[^" + delimiters + "]*");
    }

    private static String escape(char c) {
        return String.format("\\x{%x}", (int) c);
    }
}

package com.authplatform.personaldata.shared.redaction;

/**
 * Stateless entry point for one-off redaction. Callers formatting many messages
 * with the same configuration should compile a {@link RedactionRule} once instead.
 */
public final class RedactionEngine {

    private RedactionEngine() {
    }

    /**
     * Masks the value of every {@code field=value} segment in {@code message} whose field is in {@code fields}.
     * Example: {@code name=Bob;email=bob@x.com;} with {@code {email}} becomes {@code name=Bob;email=***;}
     */
    public static String redact(FieldSet fields, String mask, String message, char separator) {
        return RedactionRule.compile(fields, mask, separator).apply(message);
    }
}

package com.authplatform.personaldata.infrastructure.persistence;

import com.authplatform.personaldata.shared.redaction.FieldSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Finds columns that look like PII but would reach the log unmasked, e.g. a {@code phone}
 * column when only {@code phone_number} is redacted. Reporting only; nothing is blocked.
 */
public final class SensitiveColumnAudit {

    private SensitiveColumnAudit() {
    }

    public static List<String> unredactedColumns(TableSchema schema, FieldSet redacted) {
        List<String> suspicious = new ArrayList<>();
        for (String column : schema.columns()) {
            if (redacted.contains(column)) {
                continue;
            }
            if (looksSensitive(column, FieldSet.PII_FIELDS) || looksSensitive(column, redacted)) {
                suspicious.add(column);
            }
        }
        return suspicious;
    }

    /**
     * Compares whole {@code _}-separated tokens: a column is suspicious when it contains a field's
     * tokens as a run ({@code home_address}) or is the leading part of a field ({@code phone}).
     */
    private static boolean looksSensitive(String column, FieldSet vocabulary) {
        List<String> columnTokens = tokens(column);
        for (String field : vocabulary) {
            List<String> fieldTokens = tokens(field);
            if (Collections.indexOfSubList(columnTokens, fieldTokens) >= 0
                    || startsWith(fieldTokens, columnTokens)) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsWith(List<String> tokens, List<String> prefix) {
        return !prefix.isEmpty() && prefix.size() <= tokens.size()
                && tokens.subList(0, prefix.size()).equals(prefix);
    }

    private static List<String> tokens(String name) {
        List<String> tokens = new ArrayList<>();
        for (String token : name.toLowerCase(Locale.ROOT).split("_")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}

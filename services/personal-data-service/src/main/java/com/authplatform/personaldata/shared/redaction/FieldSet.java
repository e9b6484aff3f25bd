package com.authplatform.personaldata.shared.redaction;

import com.authplatform.personaldata.shared.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, immutable set of field names whose values must never appear unmasked in log output.
 * Duplicates are dropped keeping the first occurrence; the source collection is copied, never retained.
 */
public final class FieldSet implements Iterable<String> {

    public static final FieldSet PII_FIELDS = FieldSet.of("email", "password", "ssn", "phone_number", "address");

    private static final String SETTING = "app.redaction.fields";

    private final List<String> names;

    private FieldSet(List<String> names) {
        this.names = names;
    }

    public static FieldSet of(String... names) {
        if (names == null) {
            throw new ConfigurationException(SETTING, "Field names cannot be null");
        }
        return of(Arrays.asList(names));
    }

    public static FieldSet of(Collection<String> names) {
        if (names == null) {
            throw new ConfigurationException(SETTING, "Field names cannot be null");
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException(SETTING, "Field names cannot be null or blank");
            }
            distinct.add(name);
        }
        return new FieldSet(List.copyOf(distinct));
    }

    /**
     * Rejects sets a redacting formatter cannot work with: empty sets, and names that
     * contain {@code =}, whitespace, the separator or the segment terminator.
     */
    public FieldSet requireUsable(char separator) {
        if (names.isEmpty()) {
            throw new ConfigurationException(SETTING, "At least one field must be redacted");
        }
        for (String name : names) {
            for (int i = 0; i < name.length(); i++) {
                char c = name.charAt(i);
                if (c == '=' || c == separator || c == RedactionRule.TERMINATOR || Character.isWhitespace(c)) {
                    throw new ConfigurationException(SETTING, "Malformed field name: '" + name + "'");
                }
            }
        }
        return this;
    }

    public List<String> names() {
        return names;
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    @Override
    public Iterator<String> iterator() {
        return names.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FieldSet other && names.equals(other.names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "FieldSet" + names;
    }
}

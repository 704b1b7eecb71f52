package io.rowguard.sql.policy;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Operation kind a policy applies to. {@link #ALL} covers the four concrete kinds.
 */
public enum Operation {
    SELECT, INSERT, UPDATE, DELETE, ALL;

    public static final Set<Operation> CONCRETE = EnumSet.of(SELECT, INSERT, UPDATE, DELETE);

    public boolean covers(Operation concrete) {
        return this == ALL || this == concrete;
    }

    public boolean isWrite() {
        return this == INSERT || this == UPDATE || this == DELETE;
    }

    public static Operation parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown operation: " + value, e);
        }
    }
}

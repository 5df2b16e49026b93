package com.metrion.query.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Comparison operators a filter expression may carry. Only these six exist; any other token is
 * rejected when parsed.
 */
public enum ComparisonOperator {
    LT("lt"),
    LE("le"),
    EQ("eq"),
    NE("ne"),
    GE("ge"),
    GT("gt");

    private final String wireValue;

    ComparisonOperator(String wireValue) {
        this.wireValue = wireValue;
    }

    /** Parses a wire token. Blank or null yields {@code null} so callers can apply the default. */
    @JsonCreator
    public static ComparisonOperator fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ComparisonOperator op : values()) {
            if (op.wireValue.equals(normalized)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unsupported comparison operator: " + value);
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static ComparisonOperator defaulted(ComparisonOperator requested) {
        return requested == null ? EQ : requested;
    }

    /** True for the operators that bound a range from above. */
    public boolean isUpperBound() {
        return this == LT || this == LE;
    }

    /** True for the operators that bound a range from below. */
    public boolean isLowerBound() {
        return this == GT || this == GE;
    }

    @Override
    public String toString() {
        return wireValue;
    }
}

package com.metrion.query.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One caller-supplied filter: {@code field op value}, with an optional declared type for metadata
 * values.
 *
 * <p>The value is always carried as text. Typing happens later, and only for metadata fields.
 */
public record FilterExpression(String field, ComparisonOperator op, String value, String type) {

    @JsonCreator
    public FilterExpression(
            @JsonProperty("field") String field,
            @JsonProperty("op") ComparisonOperator op,
            @JsonProperty("value") String value,
            @JsonProperty("type") String type) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("filter field is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("filter value is required for field " + field);
        }
        this.field = field;
        this.op = ComparisonOperator.defaulted(op);
        this.value = value;
        this.type = (type == null || type.isBlank()) ? null : type;
    }

    public static FilterExpression of(String field, ComparisonOperator op, String value) {
        return new FilterExpression(field, op, value, null);
    }

    public static FilterExpression eq(String field, String value) {
        return new FilterExpression(field, ComparisonOperator.EQ, value, null);
    }

    public boolean hasDeclaredType() {
        return type != null;
    }

    @Override
    public String toString() {
        return "<Query '" + field + "' " + op + " '" + value + "' " + type + ">";
    }
}

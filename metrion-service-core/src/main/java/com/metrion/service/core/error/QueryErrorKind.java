package com.metrion.service.core.error;

/** Classified client errors raised while compiling a filter query. */
public enum QueryErrorKind {
    UNKNOWN_FIELD("query.unknown-field"),
    UNIMPLEMENTED_OPERATOR("query.unimplemented-operator"),
    NOT_AUTHORIZED("query.not-authorized"),
    UNSUPPORTED_TYPE("query.unsupported-type"),
    INVALID_VALUE("query.invalid-value"),
    UNKNOWN_ARGUMENT("query.unknown-argument");

    private final String code;

    QueryErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}

package com.metrion.service.core.error;

/**
 * Base of every client-visible query failure. Extends {@link IllegalArgumentException} so API layers
 * that already translate it into a 4xx response keep doing so.
 */
public abstract class QueryClientException extends IllegalArgumentException {

    private final QueryErrorKind kind;

    protected QueryClientException(QueryErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected QueryClientException(QueryErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public QueryErrorKind kind() {
        return kind;
    }

    public String code() {
        return kind.code();
    }
}

package com.metrion.service.core.error;

public class NotAuthorizedException extends QueryClientException {

    public NotAuthorizedException(String message) {
        super(QueryErrorKind.NOT_AUTHORIZED, message);
    }
}

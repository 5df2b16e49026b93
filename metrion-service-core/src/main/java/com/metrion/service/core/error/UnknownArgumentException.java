package com.metrion.service.core.error;

public class UnknownArgumentException extends QueryClientException {
    private final String argument;

    public UnknownArgumentException(String argument, String reason) {
        super(QueryErrorKind.UNKNOWN_ARGUMENT, "Unknown argument: \"" + argument + "\": " + reason);
        this.argument = argument;
    }

    public String argument() {
        return argument;
    }
}

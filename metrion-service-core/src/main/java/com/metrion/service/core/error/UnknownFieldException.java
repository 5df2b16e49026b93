package com.metrion.service.core.error;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

public class UnknownFieldException extends QueryClientException {
    private final String field;
    private final List<String> validKeys;

    public UnknownFieldException(String field, Collection<String> validKeys) {
        super(
                QueryErrorKind.UNKNOWN_FIELD,
                "unrecognized field in query: " + field + ", valid keys: " + new TreeSet<>(validKeys));
        this.field = field;
        this.validKeys = List.copyOf(new TreeSet<>(validKeys));
    }

    public String field() {
        return field;
    }

    public List<String> validKeys() {
        return validKeys;
    }
}

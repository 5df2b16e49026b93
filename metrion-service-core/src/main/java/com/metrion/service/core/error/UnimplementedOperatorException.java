package com.metrion.service.core.error;

import com.metrion.query.model.ComparisonOperator;

public class UnimplementedOperatorException extends QueryClientException {
    private final String field;
    private final ComparisonOperator op;

    public UnimplementedOperatorException(String field, ComparisonOperator op) {
        super(QueryErrorKind.UNIMPLEMENTED_OPERATOR, "unimplemented operator " + op + " for " + field);
        this.field = field;
        this.op = op;
    }

    public String field() {
        return field;
    }

    public ComparisonOperator op() {
        return op;
    }
}

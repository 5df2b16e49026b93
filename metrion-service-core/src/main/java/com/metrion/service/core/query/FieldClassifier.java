package com.metrion.service.core.query;

import com.metrion.query.model.ComparisonOperator;
import com.metrion.query.model.FilterExpression;
import com.metrion.service.core.catalog.AcceptedFields;
import com.metrion.service.core.error.UnimplementedOperatorException;
import com.metrion.service.core.error.UnknownFieldException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Decides how a filter field is compiled, in priority order: the {@code timestamp} control field
 * (range operators only), then (equality only) {@code search_offset}, metadata namespaces, and
 * finally plain columns after alias resolution.
 */
@Component
public class FieldClassifier {

    public static final String TIMESTAMP = "timestamp";
    public static final String SEARCH_OFFSET = "search_offset";
    public static final String METADATA_PREFIX = "metadata.";
    public static final String RESOURCE_METADATA_PREFIX = "resource_metadata.";

    /** Length of {@code "resource_"}; stripping it maps resource metadata onto the metadata namespace. */
    private static final int RESOURCE_NAMESPACE_LENGTH = 9;

    private static final Map<String, String> ALIASES =
            Map.of("user_id", "user", "project_id", "project", "resource_id", "resource");

    public FieldClassification classify(FilterExpression expression, AcceptedFields accepted) {
        String field = expression.field();
        if (TIMESTAMP.equals(field)) {
            if (!expression.op().isLowerBound() && !expression.op().isUpperBound()) {
                throw new UnimplementedOperatorException(field, expression.op());
            }
            return FieldClassification.timestamp();
        }
        if (expression.op() != ComparisonOperator.EQ) {
            throw new UnimplementedOperatorException(field, expression.op());
        }
        if (SEARCH_OFFSET.equals(field)) {
            return FieldClassification.searchOffset();
        }
        if (field.startsWith(METADATA_PREFIX)) {
            return FieldClassification.metadata(field);
        }
        if (field.startsWith(RESOURCE_METADATA_PREFIX)) {
            return FieldClassification.metadata(field.substring(RESOURCE_NAMESPACE_LENGTH));
        }
        String column = resolveAlias(field);
        if (!accepted.accepts(column)) {
            throw new UnknownFieldException(column, accepted.fields());
        }
        return FieldClassification.plain(column);
    }

    public static String resolveAlias(String field) {
        return ALIASES.getOrDefault(field, field);
    }
}

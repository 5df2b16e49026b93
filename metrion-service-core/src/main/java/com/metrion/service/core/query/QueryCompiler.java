package com.metrion.service.core.query;

import com.metrion.query.model.CallerIdentity;
import com.metrion.query.model.FilterExpression;
import com.metrion.service.core.auth.AuthorizationRewriter;
import com.metrion.service.core.auth.TenantScope;
import com.metrion.service.core.auth.TenantScopeResolver;
import com.metrion.service.core.catalog.AcceptedFields;
import com.metrion.service.core.coerce.MetadataValueCoercer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compiles caller filter expressions into a {@link QueryDescriptor} for one storage operation.
 *
 * <p>Compilation either succeeds completely or throws the first {@link
 * com.metrion.service.core.error.QueryClientException} met; nothing partial is returned. The compiler
 * holds no per-request state and is safe to share between request threads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryCompiler {

    private final TenantScopeResolver scopeResolver;
    private final AuthorizationRewriter authorizationRewriter;
    private final FieldClassifier classifier;
    private final MetadataValueCoercer coercer;
    private final TimestampWindowResolver windowResolver;

    public QueryDescriptor compile(List<FilterExpression> expressions, AcceptedFields accepted, CallerIdentity caller) {
        return compile(expressions, accepted, scopeResolver.resolve(caller));
    }

    public QueryDescriptor compile(List<FilterExpression> expressions, AcceptedFields accepted, TenantScope scope) {
        List<FilterExpression> authorized = authorizationRewriter.enforce(expressions, accepted, scope);

        Map<String, String> filters = new LinkedHashMap<>();
        Map<String, Object> metaquery = new LinkedHashMap<>();
        List<FilterExpression> timestamps = new ArrayList<>();
        String searchOffset = null;
        boolean windowRequested = false;

        for (FilterExpression expr : authorized) {
            FieldClassification classification = classifier.classify(expr, accepted);
            switch (classification.kind()) {
                case CONTROL_TIMESTAMP -> {
                    timestamps.add(expr);
                    windowRequested = true;
                }
                case CONTROL_SEARCH_OFFSET -> {
                    searchOffset = expr.value();
                    windowRequested = true;
                }
                case METADATA -> metaquery.put(classification.key(), coercer.coerce(expr));
                case PLAIN -> filters.put(classification.key(), expr.value());
            }
        }

        if (!metaquery.isEmpty() && !accepted.acceptsMetaquery()) {
            log.debug("Dropping metaquery {}: operation does not take metadata filters", metaquery.keySet());
            metaquery.clear();
        }

        TimeWindow window = null;
        if (windowRequested) {
            window = keepDeclaredOperators(windowResolver.resolve(timestamps, searchOffset, accepted), accepted);
        }

        QueryDescriptor descriptor = new QueryDescriptor(filters, metaquery, window);
        if (log.isDebugEnabled()) {
            log.debug("Compiled {} filter(s) into {}", authorized.size(), descriptor.toArguments());
        }
        return descriptor;
    }

    private static TimeWindow keepDeclaredOperators(TimeWindow window, AcceptedFields accepted) {
        boolean startOp = accepted.accepts(AcceptedFields.START_TIMESTAMP_OP);
        boolean endOp = accepted.accepts(AcceptedFields.END_TIMESTAMP_OP);
        if (startOp && endOp) {
            return window;
        }
        return new TimeWindow(
                window.start(),
                window.end(),
                window.startRaw(),
                window.endRaw(),
                startOp ? window.startOp() : null,
                endOp ? window.endOp() : null,
                window.searchOffset(),
                window.keys());
    }
}

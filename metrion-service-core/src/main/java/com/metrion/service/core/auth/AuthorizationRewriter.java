package com.metrion.service.core.auth;

import com.metrion.query.model.ComparisonOperator;
import com.metrion.query.model.FilterExpression;
import com.metrion.service.core.catalog.AcceptedFields;
import com.metrion.service.core.error.NotAuthorizedException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Project scoping for restricted callers. A restricted caller may only filter on their own project,
 * and only by equality; when no project filter is given one is added, unless the operation scopes
 * itself through {@code on_behalf_of}.
 *
 * <p>Runs before compilation so the injected filter is compiled like any other.
 */
@Component
@Slf4j
public class AuthorizationRewriter {

    public static final String PROJECT_FIELD = "project_id";

    public List<FilterExpression> enforce(
            List<FilterExpression> expressions, AcceptedFields accepted, TenantScope scope) {
        List<FilterExpression> source = expressions == null ? List.of() : expressions;
        if (!scope.isRestricted()) {
            return List.copyOf(source);
        }

        String project = scope.restrictedProject();
        boolean projectFiltered = false;
        for (FilterExpression expr : source) {
            if (!PROJECT_FIELD.equals(expr.field())) {
                continue;
            }
            projectFiltered = true;
            if (expr.op() != ComparisonOperator.EQ || !project.equals(expr.value())) {
                log.warn("Rejected query for project {} {} from caller scoped to {}", expr.op(), expr.value(), project);
                throw new NotAuthorizedException("Not Authorized to access project " + expr.op() + " " + expr.value());
            }
        }

        if (projectFiltered || accepted.scopesOnBehalfOf()) {
            return List.copyOf(source);
        }
        List<FilterExpression> rewritten = new ArrayList<>(source);
        rewritten.add(FilterExpression.eq(PROJECT_FIELD, project));
        return List.copyOf(rewritten);
    }
}

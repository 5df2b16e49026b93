package com.metrion.service.core.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.metrion.query.model.ComparisonOperator;
import com.metrion.query.model.FilterExpression;
import com.metrion.service.core.catalog.StorageOperation;
import com.metrion.service.core.error.NotAuthorizedException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AuthorizationRewriterTest {

    private final AuthorizationRewriter rewriter = new AuthorizationRewriter();

    @Test
    void privilegedCallerPassesThroughUnchanged() {
        List<FilterExpression> query = List.of(FilterExpression.eq("project_id", "other"));

        List<FilterExpression> out =
                rewriter.enforce(query, StorageOperation.METERS.acceptedFields(), TenantScope.unrestricted());

        assertThat(out).containsExactlyElementsOf(query);
    }

    @Test
    void privilegedCallerWithoutProjectFilterGetsNoInjection() {
        List<FilterExpression> out =
                rewriter.enforce(List.of(), StorageOperation.METERS.acceptedFields(), TenantScope.unrestricted());

        assertThat(out).isEmpty();
    }

    @Test
    void ownProjectFilterIsKept() {
        List<FilterExpression> query = List.of(FilterExpression.eq("project_id", "p1"));

        List<FilterExpression> out =
                rewriter.enforce(query, StorageOperation.METERS.acceptedFields(), TenantScope.restrictedTo("p1"));

        assertThat(out).containsExactly(FilterExpression.eq("project_id", "p1"));
    }

    @Test
    void foreignProjectIsRejected() {
        List<FilterExpression> query = List.of(FilterExpression.eq("project_id", "p2"));

        assertThatThrownBy(() -> rewriter.enforce(
                        query, StorageOperation.METERS.acceptedFields(), TenantScope.restrictedTo("p1")))
                .isInstanceOf(NotAuthorizedException.class)
                .hasMessage("Not Authorized to access project eq p2");
    }

    @Test
    void nonEqualityOnOwnProjectIsRejected() {
        List<FilterExpression> query = List.of(FilterExpression.of("project_id", ComparisonOperator.NE, "p1"));

        assertThatThrownBy(() -> rewriter.enforce(
                        query, StorageOperation.SAMPLES.acceptedFields(), TenantScope.restrictedTo("p1")))
                .isInstanceOf(NotAuthorizedException.class)
                .hasMessageContaining("ne p1");
    }

    @Test
    void anyForeignEntryRejectsEvenAlongsideOwnProject() {
        List<FilterExpression> query =
                List.of(FilterExpression.eq("project_id", "p1"), FilterExpression.eq("project_id", "p2"));

        assertThatThrownBy(() -> rewriter.enforce(
                        query, StorageOperation.SAMPLES.acceptedFields(), TenantScope.restrictedTo("p1")))
                .isInstanceOf(NotAuthorizedException.class);
    }

    @Test
    void missingProjectFilterIsInjectedWithoutTouchingInput() {
        List<FilterExpression> query = new ArrayList<>(List.of(FilterExpression.eq("resource_id", "r1")));

        List<FilterExpression> out =
                rewriter.enforce(query, StorageOperation.SAMPLES.acceptedFields(), TenantScope.restrictedTo("p1"));

        assertThat(out)
                .containsExactly(FilterExpression.eq("resource_id", "r1"), FilterExpression.eq("project_id", "p1"));
        assertThat(query).hasSize(1);
    }

    @Test
    void operationsScopedOnBehalfOfGetNoInjection() {
        List<FilterExpression> out = rewriter.enforce(
                List.of(), StorageOperation.ALARM_HISTORY.acceptedFields(), TenantScope.restrictedTo("p1"));

        assertThat(out).isEmpty();
    }

    @Test
    void operationsScopedOnBehalfOfStillRejectForeignProjects() {
        List<FilterExpression> query = List.of(FilterExpression.eq("project_id", "p2"));

        assertThatThrownBy(() -> rewriter.enforce(
                        query, StorageOperation.ALARM_HISTORY.acceptedFields(), TenantScope.restrictedTo("p1")))
                .isInstanceOf(NotAuthorizedException.class);
    }
}

package com.metrion.service.core.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.metrion.query.model.CallerIdentity;
import com.metrion.service.core.error.NotAuthorizedException;
import org.junit.jupiter.api.Test;

class TenantScopeResolverTest {

    private final TenantScopeResolver resolver = new TenantScopeResolver();

    @Test
    void privilegedCallerIsUnrestrictedEvenWithProject() {
        TenantScope scope = resolver.resolve(new CallerIdentity(true, "p1", "u1"));

        assertThat(scope.isRestricted()).isFalse();
        assertThat(scope.project()).isEmpty();
    }

    @Test
    void memberIsRestrictedToOwnProject() {
        TenantScope scope = resolver.resolve(CallerIdentity.member("p1", "u1"));

        assertThat(scope.isRestricted()).isTrue();
        assertThat(scope.project()).contains("p1");
    }

    @Test
    void memberWithoutProjectIsRejected() {
        assertThatThrownBy(() -> resolver.resolve(CallerIdentity.member(null, "u1")))
                .isInstanceOf(NotAuthorizedException.class);
        assertThatThrownBy(() -> resolver.resolve(null)).isInstanceOf(NotAuthorizedException.class);
    }
}

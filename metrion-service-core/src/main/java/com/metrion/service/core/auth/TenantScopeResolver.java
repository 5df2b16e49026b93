package com.metrion.service.core.auth;

import com.metrion.query.model.CallerIdentity;
import com.metrion.service.core.error.NotAuthorizedException;
import org.springframework.stereotype.Component;

@Component
public class TenantScopeResolver {

    public TenantScope resolve(CallerIdentity caller) {
        if (caller == null) {
            throw new NotAuthorizedException("Caller identity is required");
        }
        if (caller.privileged()) {
            return TenantScope.unrestricted();
        }
        if (caller.projectId() == null || caller.projectId().isBlank()) {
            throw new NotAuthorizedException("Caller is not scoped to any project");
        }
        return TenantScope.restrictedTo(caller.projectId());
    }
}

package com.metrion.service.core.auth;

import java.util.Optional;

/**
 * Project visibility of one request. An empty scope is unrestricted (privileged caller); otherwise
 * the caller may only see {@code restrictedProject}.
 */
public record TenantScope(String restrictedProject) {

    private static final TenantScope UNRESTRICTED = new TenantScope(null);

    public static TenantScope unrestricted() {
        return UNRESTRICTED;
    }

    public static TenantScope restrictedTo(String project) {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("restricted scope requires a project");
        }
        return new TenantScope(project);
    }

    public boolean isRestricted() {
        return restrictedProject != null;
    }

    public Optional<String> project() {
        return Optional.ofNullable(restrictedProject);
    }
}

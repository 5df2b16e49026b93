package com.metrion.query.model;

/**
 * Identity of an already-authenticated caller, as handed over by the API layer.
 *
 * @param privileged administrator-equivalent callers see every project
 * @param projectId the project the caller is scoped to, may be null for privileged callers
 * @param userId the calling user, informational
 */
public record CallerIdentity(boolean privileged, String projectId, String userId) {

    public static CallerIdentity admin() {
        return new CallerIdentity(true, null, null);
    }

    public static CallerIdentity member(String projectId, String userId) {
        return new CallerIdentity(false, projectId, userId);
    }
}

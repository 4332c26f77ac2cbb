package com.tasksync.shared.security;

/**
 * Decides whether the acting user may act within a tenant.
 */
public interface TenantMembershipChecker {

    /** @throws com.tasksync.shared.errors.AuthorizationException if the user is not a member */
    void checkMember(RequestContext context);
}

package com.tasksync.shared.security;

import com.tasksync.shared.errors.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Trusts the membership list the identity provider attached to the request.
 */
@Slf4j
@Component
public class AssertedMembershipChecker implements TenantMembershipChecker {

    @Override
    public void checkMember(RequestContext context) {
        if (context.getMemberships() == null || !context.getMemberships().contains(context.getTenantId())) {
            log.warn("Tenant access denied: userId={}, tenantId={}", context.getUserId(), context.getTenantId());
            throw new AuthorizationException(context.getUserId(), context.getTenantId());
        }
    }
}

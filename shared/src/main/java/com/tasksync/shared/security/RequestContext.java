package com.tasksync.shared.security;

import com.tasksync.shared.errors.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Caller identity as asserted by the identity provider in front of the services.
 * Tokens are validated upstream; these values are trusted as given.
 */
@Value
@Builder
public class RequestContext {

    public static final String TENANT_HEADER = "X-Tenant-Id";
    public static final String USER_HEADER = "X-User-Id";
    public static final String MEMBERSHIPS_HEADER = "X-Tenant-Memberships";
    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    String tenantId;
    String userId;
    Set<String> memberships;
    String correlationId;
    /** Optional; lets a caller safely re-send a command whose response it never received. */
    String idempotencyKey;

    public static RequestContext fromHeaders(String tenantId, String userId, String membershipsHeader,
                                             String correlationId, String idempotencyKey) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("Missing tenant id");
        }
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("Missing user id");
        }
        Set<String> memberships = membershipsHeader == null ? Set.of()
                : Arrays.stream(membershipsHeader.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toUnmodifiableSet());
        return RequestContext.builder()
                .tenantId(tenantId.trim())
                .userId(userId.trim())
                .memberships(memberships)
                .correlationId(correlationId)
                .idempotencyKey(idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey.trim())
                .build();
    }
}

package com.tasksync.shared.errors;

public class AuthorizationException extends TaskSyncException {

    public AuthorizationException(String userId, String tenantId) {
        super(ErrorKind.AUTHORIZATION, "User " + userId + " is not a member of tenant " + tenantId);
    }
}

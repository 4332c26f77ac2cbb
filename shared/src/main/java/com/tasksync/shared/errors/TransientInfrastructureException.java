package com.tasksync.shared.errors;

/** Throttling, timeouts, lock contention. Safe to retry with backoff. */
public class TransientInfrastructureException extends TaskSyncException {

    public TransientInfrastructureException(String message) {
        super(ErrorKind.TRANSIENT_INFRASTRUCTURE, message);
    }

    public TransientInfrastructureException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_INFRASTRUCTURE, message, cause);
    }
}

package com.tasksync.shared.errors;

/**
 * Root of the platform error taxonomy. Every failure that can reach a client or a
 * consumer carries an {@link ErrorKind}.
 */
public abstract class TaskSyncException extends RuntimeException {

    private final ErrorKind kind;

    protected TaskSyncException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TaskSyncException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}

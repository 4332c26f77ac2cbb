package com.tasksync.shared.errors;

import lombok.Getter;

/** Surfaced to callers once the bounded retry budget for version conflicts is spent. */
@Getter
public class ConcurrencyConflictException extends TaskSyncException {

    private final String taskId;
    private final int attempts;

    public ConcurrencyConflictException(String taskId, int attempts, Throwable cause) {
        super(ErrorKind.CONCURRENCY_CONFLICT,
                "Task " + taskId + " was modified concurrently; gave up after " + attempts + " attempts",
                cause);
        this.taskId = taskId;
        this.attempts = attempts;
    }

    /** A competing request, not a competing write, holds the task. */
    public ConcurrencyConflictException(String taskId, String message) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message);
        this.taskId = taskId;
        this.attempts = 0;
    }
}

package com.tasksync.shared.errors;

import lombok.Getter;

/**
 * Raised by an event store when the stored version of an aggregate no longer matches the
 * version the writer loaded. The writer must reload and decide again.
 */
@Getter
public class VersionConflictException extends TaskSyncException {

    private final String tenantId;
    private final String taskId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String tenantId, String taskId, long expectedVersion, long actualVersion) {
        super(ErrorKind.CONCURRENCY_CONFLICT, String.format(
                "Version conflict: tenantId=%s, taskId=%s, expected=%d, actual=%d",
                tenantId, taskId, expectedVersion, actualVersion));
        this.tenantId = tenantId;
        this.taskId = taskId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    /** Actual version unknown, e.g. a unique-constraint race detected only at flush time. */
    public VersionConflictException(String tenantId, String taskId, long expectedVersion, Throwable cause) {
        super(ErrorKind.CONCURRENCY_CONFLICT, String.format(
                "Version conflict: tenantId=%s, taskId=%s, expected=%d, concurrent write detected",
                tenantId, taskId, expectedVersion), cause);
        this.tenantId = tenantId;
        this.taskId = taskId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = -1;
    }

    /**
     * The stream is at the expected version but the batch's first event id does not sort after
     * the stream's last one. Consumers order by id, so the writer must re-mint and retry.
     */
    public static VersionConflictException eventIdNotAfter(String tenantId, String taskId, long version,
                                                           String lastEventId, String eventId) {
        return new VersionConflictException(tenantId, taskId, version, String.format(
                "Version conflict: tenantId=%s, taskId=%s, eventId=%s does not sort after last eventId=%s",
                tenantId, taskId, eventId, lastEventId));
    }

    private VersionConflictException(String tenantId, String taskId, long version, String message) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message);
        this.tenantId = tenantId;
        this.taskId = taskId;
        this.expectedVersion = version;
        this.actualVersion = version;
    }
}

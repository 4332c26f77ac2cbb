package com.tasksync.shared.errors;

import lombok.Getter;

/**
 * The event history of an aggregate cannot be folded into a valid state.
 * Replay stops at the offending event; the aggregate needs manual inspection.
 */
@Getter
public class CorruptStreamException extends TaskSyncException {

    private final String taskId;
    private final String eventId;

    public CorruptStreamException(String taskId, String eventId, String message) {
        super(ErrorKind.CORRUPT_STREAM, message + " (taskId=" + taskId + ", eventId=" + eventId + ")");
        this.taskId = taskId;
        this.eventId = eventId;
    }

    public CorruptStreamException(String taskId, String eventId, String message, Throwable cause) {
        super(ErrorKind.CORRUPT_STREAM, message + " (taskId=" + taskId + ", eventId=" + eventId + ")", cause);
        this.taskId = taskId;
        this.eventId = eventId;
    }
}

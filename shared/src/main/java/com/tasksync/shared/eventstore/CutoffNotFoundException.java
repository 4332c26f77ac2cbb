package com.tasksync.shared.eventstore;

/** A snapshot cutoff that is not (or no longer) part of the task's stream. */
public class CutoffNotFoundException extends RuntimeException {

    public CutoffNotFoundException(String taskId, String cutoffEventId) {
        super("Cutoff event not in stream: taskId=" + taskId + ", eventId=" + cutoffEventId);
    }
}

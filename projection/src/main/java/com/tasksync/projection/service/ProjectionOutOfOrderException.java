package com.tasksync.projection.service;

import com.tasksync.shared.errors.TransientInfrastructureException;

/**
 * An event arrived ahead of its predecessors: the task's row does not exist yet, or the row is
 * behind the event's stream version by more than one. The missing events are still in flight,
 * so the event is retried rather than dead-lettered.
 */
public class ProjectionOutOfOrderException extends TransientInfrastructureException {

    public ProjectionOutOfOrderException(String tenantId, String taskId, String eventId) {
        super("No projection row yet: tenantId=" + tenantId + ", taskId=" + taskId + ", eventId=" + eventId);
    }

    public ProjectionOutOfOrderException(String tenantId, String taskId, String eventId,
                                         long rowVersion, long streamVersion) {
        super("Projection gap: tenantId=" + tenantId + ", taskId=" + taskId + ", eventId=" + eventId
                + ", rowVersion=" + rowVersion + ", streamVersion=" + streamVersion);
    }
}

package com.tasksync.shared.snapshot;

import com.tasksync.shared.domain.TaskState;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Point-in-time copy of a task's state. Valid for replay only together with every event
 * after {@code cutoffEventId}. Never mutated; superseded snapshots get an {@code expiresAt}.
 */
@Value
@Builder
public class TaskSnapshot {
    String tenantId;
    String taskId;
    TaskState state;
    String cutoffEventId;
    long streamVersion;
    Instant createdAt;
    @With
    Instant expiresAt;

    public static TaskSnapshot of(TaskState state, Instant createdAt) {
        return TaskSnapshot.builder()
                .tenantId(state.getTenantId())
                .taskId(state.getTaskId())
                .state(state)
                .cutoffEventId(state.getLastEventId())
                .streamVersion(state.getVersion())
                .createdAt(createdAt)
                .build();
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}

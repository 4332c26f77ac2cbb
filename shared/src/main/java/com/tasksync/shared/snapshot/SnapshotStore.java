package com.tasksync.shared.snapshot;

import java.time.Instant;
import java.util.Optional;

/**
 * Snapshots keyed by (tenant, task, cutoff event id).
 */
public interface SnapshotStore {

    void save(TaskSnapshot snapshot);

    /** Highest-version snapshot that is not marked for expiry. */
    Optional<TaskSnapshot> findLatest(String tenantId, String taskId);

    /**
     * Schedules every other snapshot of the task for removal at {@code expiresAt}.
     * Readers already holding one of them can finish.
     *
     * @return number of snapshots marked
     */
    int markSupersededForExpiry(String tenantId, String taskId, String keepCutoffEventId, Instant expiresAt);

    /** @return number of snapshots removed */
    int purgeExpired(Instant now);
}

package com.tasksync.shared.eventstore;

import com.tasksync.shared.events.TaskEvent;

import java.util.List;

/**
 * Append-only log of task events, keyed by (tenant, task).
 *
 * The store is the only authority on an aggregate's version: the version is the number of
 * events in the stream, and every append is conditioned on the version the writer last saw.
 * Appended events are delivered to change-feed consumers at least once.
 */
public interface EventStore {

    /**
     * Atomically appends a batch: either every event is stored, or none is.
     *
     * @param expectedVersion version the caller loaded; 0 for a new task
     * @throws com.tasksync.shared.errors.VersionConflictException if the stored version differs
     * @throws com.tasksync.shared.errors.ValidationException if the batch is empty or fails schema checks
     */
    AppendResult append(String tenantId, String taskId, long expectedVersion, List<TaskEvent> events);

    /** All events of one task in append order; empty when the task never existed. */
    List<TaskEvent> read(String tenantId, String taskId);

    /**
     * Events strictly after {@code afterEventId}, in append order.
     *
     * @throws CutoffNotFoundException if the cutoff is not part of the stream
     */
    List<TaskEvent> readSince(String tenantId, String taskId, String afterEventId);

    /** All events of one tenant in append order. */
    List<TaskEvent> readTenant(String tenantId);

    /** 0 when the task has no events. */
    long currentVersion(String tenantId, String taskId);
}

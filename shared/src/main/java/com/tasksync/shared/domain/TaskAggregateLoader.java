package com.tasksync.shared.domain;

import com.tasksync.shared.eventstore.CutoffNotFoundException;
import com.tasksync.shared.eventstore.EventStore;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.snapshot.SnapshotStore;
import com.tasksync.shared.snapshot.TaskSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Loads the current state of a task: latest snapshot plus the events after its cutoff,
 * or a full replay when there is no usable snapshot.
 *
 * The delta is always read from the event store, so a tombstone appended after the cutoff
 * is never hidden by a stale snapshot.
 */
@Slf4j
@RequiredArgsConstructor
public class TaskAggregateLoader {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final TaskAggregateReconstructor reconstructor;

    public Optional<TaskState> load(String tenantId, String taskId) {
        Optional<TaskSnapshot> snapshot = snapshotStore.findLatest(tenantId, taskId);
        if (snapshot.isPresent()) {
            Optional<TaskState> fromSnapshot = loadFromSnapshot(snapshot.get());
            if (fromSnapshot.isPresent()) {
                return fromSnapshot;
            }
        }
        return reconstructor.reconstruct(eventStore.read(tenantId, taskId));
    }

    /** Full replay, ignoring snapshots. */
    public Optional<TaskState> replay(String tenantId, String taskId) {
        return reconstructor.reconstruct(eventStore.read(tenantId, taskId));
    }

    private Optional<TaskState> loadFromSnapshot(TaskSnapshot snapshot) {
        TaskState base = snapshot.getState();
        if (base == null || base.getVersion() != snapshot.getStreamVersion()
                || !snapshot.getCutoffEventId().equals(base.getLastEventId())) {
            log.warn("Inconsistent snapshot ignored: taskId={}, cutoff={}, streamVersion={}",
                    snapshot.getTaskId(), snapshot.getCutoffEventId(), snapshot.getStreamVersion());
            return Optional.empty();
        }
        List<TaskEvent> delta;
        try {
            delta = eventStore.readSince(snapshot.getTenantId(), snapshot.getTaskId(), snapshot.getCutoffEventId());
        } catch (CutoffNotFoundException ex) {
            log.warn("Snapshot cutoff missing from stream, replaying from genesis: taskId={}, cutoff={}",
                    snapshot.getTaskId(), snapshot.getCutoffEventId());
            return Optional.empty();
        }
        log.debug("Loaded from snapshot: taskId={}, snapshotVersion={}, deltaEvents={}",
                snapshot.getTaskId(), snapshot.getStreamVersion(), delta.size());
        return reconstructor.reconstruct(delta, base);
    }
}

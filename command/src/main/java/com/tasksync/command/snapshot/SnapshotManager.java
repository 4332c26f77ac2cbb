package com.tasksync.command.snapshot;

import com.tasksync.command.config.SnapshotProperties;
import com.tasksync.shared.domain.TaskAggregateLoader;
import com.tasksync.shared.domain.TaskState;
import com.tasksync.shared.eventstore.EventStore;
import com.tasksync.shared.snapshot.SnapshotStore;
import com.tasksync.shared.snapshot.TaskSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Takes snapshots when {@link SnapshotPolicy} asks for one.
 *
 * A new snapshot never replaces the old one in place: the previous rows are only marked to
 * expire after a grace period, so a loader that already picked one up can still finish.
 */
@Slf4j
@Service
public class SnapshotManager {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final TaskAggregateLoader loader;
    private final SnapshotPolicy policy;
    private final SnapshotProperties properties;
    private final Clock clock;
    private final Counter snapshotsTaken;

    public SnapshotManager(EventStore eventStore,
                           SnapshotStore snapshotStore,
                           TaskAggregateLoader loader,
                           SnapshotPolicy policy,
                           SnapshotProperties properties,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.loader = loader;
        this.policy = policy;
        this.properties = properties;
        this.clock = clock;
        this.snapshotsTaken = Counter.builder("tasks.snapshots.taken")
                .description("Task snapshots written")
                .register(meterRegistry);
    }

    /** @return the snapshot written, or empty when none was due */
    public Optional<TaskSnapshot> maybeSnapshot(String tenantId, String taskId) {
        Instant now = clock.instant();
        Optional<TaskSnapshot> latest = snapshotStore.findLatest(tenantId, taskId);
        long version = eventStore.currentVersion(tenantId, taskId);
        long eventsSince = version - latest.map(TaskSnapshot::getStreamVersion).orElse(0L);

        SnapshotDecision decision = policy.evaluate(latest, eventsSince, now);
        if (!decision.shouldSnapshot()) {
            return Optional.empty();
        }

        Optional<TaskState> state = loader.load(tenantId, taskId);
        if (state.isEmpty() || state.get().isDeleted()) {
            log.debug("Skipping snapshot of absent or deleted task: tenantId={}, taskId={}", tenantId, taskId);
            return Optional.empty();
        }

        TaskSnapshot snapshot = TaskSnapshot.of(state.get(), now);
        snapshotStore.save(snapshot);
        int superseded = snapshotStore.markSupersededForExpiry(tenantId, taskId,
                snapshot.getCutoffEventId(), now.plus(properties.getExpiryGrace()));
        snapshotsTaken.increment();

        log.info("Snapshot taken: tenantId={}, taskId={}, version={}, reason={}, superseded={}",
                tenantId, taskId, snapshot.getStreamVersion(), decision, superseded);
        return Optional.of(snapshot);
    }
}

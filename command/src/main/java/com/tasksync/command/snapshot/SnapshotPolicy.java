package com.tasksync.command.snapshot;

import com.tasksync.command.config.SnapshotProperties;
import com.tasksync.shared.snapshot.TaskSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides when a task deserves a fresh snapshot: after enough events, or when the last one
 * has aged out. Nothing is taken while the stream is unchanged since the last snapshot.
 */
@Component
@RequiredArgsConstructor
public class SnapshotPolicy {

    private final SnapshotProperties properties;

    public SnapshotDecision evaluate(Optional<TaskSnapshot> latest, long eventsSince, Instant now) {
        if (eventsSince <= 0) {
            return SnapshotDecision.NONE;
        }
        if (eventsSince >= properties.getEventThreshold()) {
            return SnapshotDecision.EVENT_COUNT;
        }
        if (latest.isPresent()
                && Duration.between(latest.get().getCreatedAt(), now).compareTo(properties.getMaxAge()) >= 0) {
            return SnapshotDecision.AGE;
        }
        return SnapshotDecision.NONE;
    }
}

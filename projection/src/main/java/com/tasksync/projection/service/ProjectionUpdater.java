package com.tasksync.projection.service;

import com.tasksync.projection.domain.TaskProjection;
import com.tasksync.projection.repository.TaskProjectionRepository;
import com.tasksync.shared.domain.TaskStatus;
import com.tasksync.shared.errors.TransientInfrastructureException;
import com.tasksync.shared.events.EventIds;
import com.tasksync.shared.events.EventKind;
import com.tasksync.shared.events.MalformedEventException;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEvents.*;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Folds one change-feed event into the task's projection row.
 *
 * The row's {@code version} is the stream version of the last applied event, and the relay
 * sends each event's stream version alongside it. Delivery is at-least-once, so an event at or
 * below the row's version is a duplicate and leaves the row untouched. An event more than one
 * version ahead means its predecessors have not arrived; it fails as out of order and is
 * redelivered, so no event is ever skipped. Each call is its own transaction; the row's
 * @Version column turns a concurrent writer into a retryable failure instead of a lost update.
 *
 * Permanent problems (a second created event, an event after deletion, an event id that does
 * not sort after the last applied one) raise {@link MalformedEventException} and go to the
 * dead-letter topic. Everything else that fails is transient and the event is redelivered.
 */
@Slf4j
@Service
public class ProjectionUpdater {

    private final TaskProjectionRepository repository;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public ProjectionUpdater(TaskProjectionRepository repository, Clock clock, MeterRegistry meterRegistry) {
        this.repository = repository;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Transactional
    public ApplyOutcome apply(TaskEvent event, long streamVersion) {
        if (streamVersion < 1) {
            throw new MalformedEventException("Invalid stream version " + streamVersion
                    + " for event " + event.getEventId());
        }
        try {
            ApplyOutcome outcome = doApply(event, streamVersion);
            Counter.builder("tasks.projection.events")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(meterRegistry)
                    .increment();
            return outcome;
        } catch (TransientDataAccessException e) {
            throw new TransientInfrastructureException(
                    "Projection write failed for event " + event.getEventId() + ": " + e.getMessage(), e);
        }
    }

    private ApplyOutcome doApply(TaskEvent event, long streamVersion) {
        Optional<TaskProjection> existing = repository.findByTenantIdAndTaskId(event.getTenantId(), event.getTaskId());

        if (existing.isPresent() && streamVersion <= existing.get().getVersion()) {
            log.debug("Duplicate event skipped: eventId={}, taskId={}, streamVersion={}, rowVersion={}",
                    event.getEventId(), event.getTaskId(), streamVersion, existing.get().getVersion());
            return ApplyOutcome.DUPLICATE;
        }

        if (event.getKind() == EventKind.CREATED) {
            if (existing.isPresent() || streamVersion != 1) {
                throw new MalformedEventException("Created event out of place for task " + event.getTaskId()
                        + ": eventId=" + event.getEventId() + ", streamVersion=" + streamVersion);
            }
            repository.saveAndFlush(newRow((TaskCreated) event));
            log.debug("Projection row created: tenantId={}, taskId={}", event.getTenantId(), event.getTaskId());
            return ApplyOutcome.APPLIED;
        }

        TaskProjection row = existing.orElseThrow(() -> new ProjectionOutOfOrderException(
                event.getTenantId(), event.getTaskId(), event.getEventId()));
        if (row.isDeleted()) {
            throw new MalformedEventException("Event after deletion for task " + event.getTaskId()
                    + ": eventId=" + event.getEventId() + ", type=" + event.getEventType());
        }
        if (streamVersion > row.getVersion() + 1) {
            throw new ProjectionOutOfOrderException(event.getTenantId(), event.getTaskId(), event.getEventId(),
                    row.getVersion(), streamVersion);
        }
        if (!EventIds.isAfter(event.getEventId(), row.getLastAppliedEventId())) {
            throw new MalformedEventException("Event id does not sort after the last applied one for task "
                    + event.getTaskId() + ": eventId=" + event.getEventId()
                    + ", lastApplied=" + row.getLastAppliedEventId());
        }

        ApplyOutcome outcome = ApplyOutcome.APPLIED;
        switch (event.getKind()) {
            case UPDATED -> {
                TaskUpdated updated = (TaskUpdated) event;
                if (updated.getTitle() != null) row.setTitle(updated.getTitle());
                if (updated.getDescription() != null) {
                    row.setDescription(updated.getDescription().isEmpty() ? null : updated.getDescription());
                }
                if (updated.getTags() != null) row.setTags(new ArrayList<>(updated.getTags()));
            }
            case ASSIGNED -> row.setAssigneeId(((TaskAssigned) event).getAssigneeId());
            case COMPLETED -> {
                if (row.getCompletedAt() == null) row.setCompletedAt(event.getOccurredAt());
                row.setStatus(TaskStatus.COMPLETED);
                row.setActive(false);
            }
            case REOPENED -> {
                row.setStatus(TaskStatus.ACTIVE);
                row.setActive(true);
                row.setCompletedAt(null);
            }
            case DELETED -> {
                row.setStatus(TaskStatus.DELETED);
                row.setActive(false);
                row.setDeleted(true);
                row.setDeletedAt(event.getOccurredAt());
            }
            case UNKNOWN -> {
                log.warn("Unknown event type ignored by projection: eventId={}, type={}, taskId={}",
                        event.getEventId(), event.getEventType(), event.getTaskId());
                outcome = ApplyOutcome.IGNORED;
            }
            case CREATED -> throw new IllegalStateException("handled above");
        }

        if (outcome == ApplyOutcome.APPLIED) {
            row.setUpdatedAt(event.getOccurredAt());
        }
        row.setVersion(streamVersion);
        row.setLastAppliedEventId(event.getEventId());
        row.setProjectedAt(clock.instant());
        repository.saveAndFlush(row);
        return outcome;
    }

    private TaskProjection newRow(TaskCreated created) {
        return TaskProjection.builder()
                .tenantId(created.getTenantId())
                .taskId(created.getTaskId())
                .title(created.getTitle())
                .description(created.getDescription())
                .tags(new ArrayList<>(created.getTags()))
                .status(TaskStatus.ACTIVE)
                .active(true)
                .deleted(false)
                .createdBy(created.getActorId())
                .createdAt(created.getOccurredAt())
                .updatedAt(created.getOccurredAt())
                .version(1)
                .lastAppliedEventId(created.getEventId())
                .projectedAt(clock.instant())
                .build();
    }
}

package com.tasksync.shared.domain;

import com.tasksync.shared.errors.CorruptStreamException;
import com.tasksync.shared.events.EventKind;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEvents.TaskAssigned;
import com.tasksync.shared.events.TaskEvents.TaskCreated;
import com.tasksync.shared.events.TaskEvents.TaskUpdated;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds an ordered event sequence into a {@link TaskState}.
 *
 * Deterministic: the same events (and base) always produce an equal state. Each event
 * advances the version by exactly one whatever its kind. Errors are never caught here:
 * a stream that cannot be folded stops replay with {@link CorruptStreamException}.
 */
@Slf4j
public class TaskAggregateReconstructor {

    private final UnknownEventPolicy unknownEventPolicy;

    public TaskAggregateReconstructor(UnknownEventPolicy unknownEventPolicy) {
        this.unknownEventPolicy = Objects.requireNonNull(unknownEventPolicy, "unknownEventPolicy");
    }

    public Optional<TaskState> reconstruct(List<? extends TaskEvent> events) {
        return reconstruct(events, null);
    }

    /**
     * @param events events in stream order; when {@code base} is given, only those after its cutoff
     * @param base   snapshot state to start from, or null to replay from genesis
     * @return the folded state, or empty when there is neither a base nor any event
     */
    public Optional<TaskState> reconstruct(List<? extends TaskEvent> events, TaskState base) {
        TaskState state = base;
        for (TaskEvent event : events) {
            state = apply(state, event);
        }
        return Optional.ofNullable(state);
    }

    /** Applies a single event. {@code state} is null before the first event of a stream. */
    public TaskState apply(TaskState state, TaskEvent event) {
        if (state == null) {
            if (event.getKind() != EventKind.CREATED) {
                throw corrupt(event, "First event of stream is " + event.getEventType() + ", expected created");
            }
            return created((TaskCreated) event);
        }

        if (!state.getTaskId().equals(event.getTaskId()) || !state.getTenantId().equals(event.getTenantId())) {
            throw corrupt(event, "Event belongs to tenantId=" + event.getTenantId() + ", taskId="
                    + event.getTaskId() + " but stream is tenantId=" + state.getTenantId());
        }
        if (state.isDeleted()) {
            throw corrupt(event, "Event " + event.getEventType() + " follows the deletion tombstone");
        }

        TaskState.TaskStateBuilder next = state.toBuilder()
                .version(state.getVersion() + 1)
                .lastEventId(event.getEventId());

        switch (event.getKind()) {
            case CREATED -> throw corrupt(event, "Duplicate created event at version " + (state.getVersion() + 1));
            case UPDATED -> {
                TaskUpdated updated = (TaskUpdated) event;
                if (updated.getTitle() != null) next.title(updated.getTitle());
                if (updated.getDescription() != null) {
                    // an empty description in an update clears it
                    next.description(updated.getDescription().isEmpty() ? null : updated.getDescription());
                }
                if (updated.getTags() != null) next.tags(List.copyOf(updated.getTags()));
                next.updatedAt(event.getOccurredAt());
            }
            case ASSIGNED -> next
                    .assigneeId(((TaskAssigned) event).getAssigneeId())
                    .updatedAt(event.getOccurredAt());
            case COMPLETED -> {
                // completing twice keeps the first completion time
                if (!state.isCompleted()) {
                    next.status(TaskStatus.COMPLETED).completedAt(event.getOccurredAt());
                }
                next.updatedAt(event.getOccurredAt());
            }
            case REOPENED -> next
                    .status(TaskStatus.ACTIVE)
                    .completedAt(null)
                    .updatedAt(event.getOccurredAt());
            case DELETED -> next
                    .status(TaskStatus.DELETED)
                    .updatedAt(event.getOccurredAt());
            case UNKNOWN -> {
                if (unknownEventPolicy == UnknownEventPolicy.REJECT) {
                    throw corrupt(event, "Unknown event type " + event.getEventType());
                }
                log.warn("Skipping unknown event type during replay: taskId={}, eventId={}, type={}",
                        event.getTaskId(), event.getEventId(), event.getEventType());
            }
        }
        return next.build();
    }

    private TaskState created(TaskCreated event) {
        return TaskState.builder()
                .taskId(event.getTaskId())
                .tenantId(event.getTenantId())
                .title(event.getTitle())
                .description(event.getDescription())
                .tags(List.copyOf(event.getTags()))
                .status(TaskStatus.ACTIVE)
                .createdBy(event.getActorId())
                .createdAt(event.getOccurredAt())
                .updatedAt(event.getOccurredAt())
                .version(1)
                .lastEventId(event.getEventId())
                .build();
    }

    private CorruptStreamException corrupt(TaskEvent event, String message) {
        log.error("Corrupt event stream: tenantId={}, taskId={}, eventId={}, reason={}",
                event.getTenantId(), event.getTaskId(), event.getEventId(), message);
        return new CorruptStreamException(event.getTaskId(), event.getEventId(), message);
    }
}

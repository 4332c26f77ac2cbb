package com.tasksync.shared.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Base of every task domain event.
 *
 * Events are immutable facts: no setters, and once appended they are never rewritten.
 * Every event carries:
 *  - eventId:       ULID, time-sortable, unique across the platform
 *  - eventType:     wire discriminator, see {@link EventTypes}
 *  - schemaVersion: payload schema revision for this event type
 *  - tenantId:      owning family
 *  - taskId:        aggregate the event belongs to
 *  - actorId:       user who issued the command
 *  - correlationId: request that produced the event, if known
 *
 * Unknown event types deserialize to {@link TaskEvents.UnknownTaskEvent} instead of failing,
 * so an older reader never chokes on a newer writer.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "eventType", visible = true, defaultImpl = TaskEvents.UnknownTaskEvent.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = TaskEvents.TaskCreated.class, name = EventTypes.TASK_CREATED),
        @JsonSubTypes.Type(value = TaskEvents.TaskUpdated.class, name = EventTypes.TASK_UPDATED),
        @JsonSubTypes.Type(value = TaskEvents.TaskAssigned.class, name = EventTypes.TASK_ASSIGNED),
        @JsonSubTypes.Type(value = TaskEvents.TaskCompleted.class, name = EventTypes.TASK_COMPLETED),
        @JsonSubTypes.Type(value = TaskEvents.TaskReopened.class, name = EventTypes.TASK_REOPENED),
        @JsonSubTypes.Type(value = TaskEvents.TaskDeleted.class, name = EventTypes.TASK_DELETED)
})
public abstract class TaskEvent {

    private String eventId;
    private String eventType;
    private int schemaVersion;
    private String tenantId;
    private String taskId;
    private String actorId;
    private Instant occurredAt;
    private String correlationId;

    /** Deserialization only. */
    protected TaskEvent() {
    }

    protected TaskEvent(String eventType, int schemaVersion, EventMetadata metadata) {
        this.eventId = metadata.getEventId();
        this.eventType = eventType;
        this.schemaVersion = schemaVersion;
        this.tenantId = metadata.getTenantId();
        this.taskId = metadata.getTaskId();
        this.actorId = metadata.getActorId();
        this.occurredAt = metadata.getOccurredAt();
        this.correlationId = metadata.getCorrelationId();
    }

    @JsonIgnore
    public abstract EventKind getKind();
}

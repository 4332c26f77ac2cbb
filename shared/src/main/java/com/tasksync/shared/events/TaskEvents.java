package com.tasksync.shared.events;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All task event payload classes.
 * Each event extends TaskEvent and adds its kind-specific payload.
 *
 * Naming: Task{PastTense}. The private no-arg constructors exist for Jackson only.
 */
public final class TaskEvents {

    private TaskEvents() {}

    // ─── Lifecycle ─────────────────────────────────────────────────────────────

    /**
     * Schema 2 added tags. Schema 1 payloads have no tags field and read back with an
     * empty list.
     */
    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class TaskCreated extends TaskEvent {
        public static final int SCHEMA_VERSION = 2;

        private String title;
        private String description;
        private List<String> tags = List.of();

        private TaskCreated() {
        }

        public TaskCreated(EventMetadata metadata, String title, String description, List<String> tags) {
            super(EventTypes.TASK_CREATED, SCHEMA_VERSION, metadata);
            this.title = title;
            this.description = description;
            this.tags = tags != null ? List.copyOf(tags) : List.of();
        }

        public List<String> getTags() {
            return tags != null ? tags : List.of();
        }

        @Override
        public EventKind getKind() {
            return EventKind.CREATED;
        }
    }

    /** Absent fields mean "unchanged". */
    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class TaskUpdated extends TaskEvent {
        private String title;
        private String description;
        private List<String> tags;

        private TaskUpdated() {
        }

        public TaskUpdated(EventMetadata metadata, String title, String description, List<String> tags) {
            super(EventTypes.TASK_UPDATED, 1, metadata);
            this.title = title;
            this.description = description;
            this.tags = tags != null ? List.copyOf(tags) : null;
        }

        @Override
        public EventKind getKind() {
            return EventKind.UPDATED;
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class TaskAssigned extends TaskEvent {
        private String assigneeId;

        private TaskAssigned() {
        }

        public TaskAssigned(EventMetadata metadata, String assigneeId) {
            super(EventTypes.TASK_ASSIGNED, 1, metadata);
            this.assigneeId = assigneeId;
        }

        @Override
        public EventKind getKind() {
            return EventKind.ASSIGNED;
        }
    }

    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class TaskCompleted extends TaskEvent {

        private TaskCompleted() {
        }

        public TaskCompleted(EventMetadata metadata) {
            super(EventTypes.TASK_COMPLETED, 1, metadata);
        }

        @Override
        public EventKind getKind() {
            return EventKind.COMPLETED;
        }
    }

    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class TaskReopened extends TaskEvent {

        private TaskReopened() {
        }

        public TaskReopened(EventMetadata metadata) {
            super(EventTypes.TASK_REOPENED, 1, metadata);
        }

        @Override
        public EventKind getKind() {
            return EventKind.REOPENED;
        }
    }

    /** Tombstone. Nothing may follow it in a stream. */
    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class TaskDeleted extends TaskEvent {
        private String reason;

        private TaskDeleted() {
        }

        public TaskDeleted(EventMetadata metadata, String reason) {
            super(EventTypes.TASK_DELETED, 1, metadata);
            this.reason = reason;
        }

        @Override
        public EventKind getKind() {
            return EventKind.DELETED;
        }
    }

    // ─── Forward compatibility ─────────────────────────────────────────────────

    /**
     * An event whose type this build does not recognise. The envelope is still readable;
     * the payload is kept verbatim so re-serializing it loses nothing.
     */
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static class UnknownTaskEvent extends TaskEvent {
        private final Map<String, Object> payload = new LinkedHashMap<>();

        UnknownTaskEvent() {
        }

        @JsonAnySetter
        void putPayload(String name, Object value) {
            payload.put(name, value);
        }

        @JsonAnyGetter
        public Map<String, Object> getPayload() {
            return payload;
        }

        @Override
        public EventKind getKind() {
            return EventKind.UNKNOWN;
        }
    }
}

package com.tasksync.shared.events;

/**
 * Canonical event type, topic and header names.
 * Event types are persisted with every event: renaming one is a breaking change for replay.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Task Domain ───────────────────────────────────────────────────────────
    public static final String TASK_CREATED   = "task.created";
    public static final String TASK_UPDATED   = "task.updated";
    public static final String TASK_ASSIGNED  = "task.assigned";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_REOPENED  = "task.reopened";
    public static final String TASK_DELETED   = "task.deleted";

    // ── Kafka Topics ──────────────────────────────────────────────────────────
    public static final String TOPIC_TASK_EVENTS     = "tasks.events";
    public static final String TOPIC_DLQ_TASK_EVENTS = "tasks.events.dlq";

    // ── Kafka Headers ─────────────────────────────────────────────────────────
    public static final String HEADER_EVENT_ID       = "event-id";
    public static final String HEADER_EVENT_TYPE     = "event-type";
    public static final String HEADER_TENANT_ID      = "tenant-id";
    public static final String HEADER_TASK_ID        = "task-id";
    public static final String HEADER_STREAM_VERSION = "stream-version";
    public static final String HEADER_CORRELATION_ID = "correlation-id";
    public static final String HEADER_DLQ_REASON     = "dlq-reason";
    public static final String HEADER_DLQ_EXCEPTION  = "dlq-exception";
}

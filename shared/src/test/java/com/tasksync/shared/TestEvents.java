package com.tasksync.shared;

import com.tasksync.shared.events.EventIds;
import com.tasksync.shared.events.EventMetadata;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEventSerializer;
import com.tasksync.shared.events.TaskEvents.*;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Event factory for tests: fresh ULIDs, strictly increasing timestamps. */
public final class TestEvents {

    public static final String TENANT = "family-1";
    public static final String USER = "user-alice";

    private static final Instant BASE = Instant.parse("2026-01-01T08:00:00Z");
    private static final AtomicLong TICK = new AtomicLong();

    private TestEvents() {}

    public static EventMetadata meta(String taskId) {
        return EventMetadata.builder()
                .eventId(EventIds.next())
                .tenantId(TENANT)
                .taskId(taskId)
                .actorId(USER)
                .occurredAt(BASE.plusSeconds(TICK.incrementAndGet()))
                .correlationId("corr-test")
                .build();
    }

    public static TaskCreated created(String taskId, String title) {
        return new TaskCreated(meta(taskId), title, null, List.of("home"));
    }

    public static TaskUpdated updated(String taskId, String title, String description) {
        return new TaskUpdated(meta(taskId), title, description, null);
    }

    public static TaskAssigned assigned(String taskId, String assigneeId) {
        return new TaskAssigned(meta(taskId), assigneeId);
    }

    public static TaskCompleted completed(String taskId) {
        return new TaskCompleted(meta(taskId));
    }

    public static TaskReopened reopened(String taskId) {
        return new TaskReopened(meta(taskId));
    }

    public static TaskDeleted deleted(String taskId) {
        return new TaskDeleted(meta(taskId), "no longer needed");
    }

    /** An event of a type this build does not know, as a newer producer would write it. */
    public static TaskEvent unknown(String taskId) {
        String json = "{\"eventType\":\"task.starred\",\"schemaVersion\":1,\"eventId\":\"" + EventIds.next()
                + "\",\"tenantId\":\"" + TENANT + "\",\"taskId\":\"" + taskId
                + "\",\"actorId\":\"" + USER + "\",\"occurredAt\":\"2026-01-02T00:00:00Z\",\"starred\":true}";
        return new TaskEventSerializer(TaskEventSerializer.defaultObjectMapper()).deserialize(json);
    }
}

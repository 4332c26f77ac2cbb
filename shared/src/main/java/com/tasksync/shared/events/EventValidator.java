package com.tasksync.shared.events;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema checks applied to every event before it is appended.
 * Returns all violations at once rather than failing on the first.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    public static List<String> validate(TaskEvent event) {
        List<String> errors = new ArrayList<>();

        if (!EventIds.isValid(event.getEventId())) {
            errors.add("eventId must be a ULID: " + event.getEventId());
        }
        if (isBlank(event.getEventType())) {
            errors.add("eventType must not be blank");
        }
        if (isBlank(event.getTenantId())) {
            errors.add("tenantId must not be blank");
        }
        if (isBlank(event.getTaskId())) {
            errors.add("taskId must not be blank");
        }
        if (isBlank(event.getActorId())) {
            errors.add("actorId must not be blank");
        }
        if (event.getOccurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (event.getSchemaVersion() < 1) {
            errors.add("schemaVersion must be >= 1");
        }

        switch (event.getKind()) {
            case CREATED -> {
                if (isBlank(((TaskEvents.TaskCreated) event).getTitle())) {
                    errors.add("created event requires a title");
                }
            }
            case ASSIGNED -> {
                if (isBlank(((TaskEvents.TaskAssigned) event).getAssigneeId())) {
                    errors.add("assigned event requires an assigneeId");
                }
            }
            case UNKNOWN -> errors.add("unknown event type cannot be appended: " + event.getEventType());
            case UPDATED, COMPLETED, REOPENED, DELETED -> {
                // no required payload fields
            }
        }
        return errors;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

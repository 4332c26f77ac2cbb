package com.tasksync.shared.eventstore;

import com.tasksync.shared.errors.ValidationException;
import com.tasksync.shared.errors.VersionConflictException;
import com.tasksync.shared.events.EventKind;
import com.tasksync.shared.events.EventValidator;
import com.tasksync.shared.events.TaskEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch-level checks shared by every {@link EventStore} implementation. Runs before any write,
 * so a rejected batch leaves the stream untouched.
 */
public final class AppendValidator {

    private AppendValidator() {}

    public static void validate(String tenantId, String taskId, long expectedVersion, List<TaskEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new ValidationException("Event batch must not be empty");
        }
        if (expectedVersion < 0) {
            throw new ValidationException("expectedVersion must be >= 0, was " + expectedVersion);
        }

        List<String> errors = new ArrayList<>();
        String previousId = null;
        for (int i = 0; i < events.size(); i++) {
            TaskEvent event = events.get(i);
            for (String error : EventValidator.validate(event)) {
                errors.add("events[" + i + "]: " + error);
            }
            if (!tenantId.equals(event.getTenantId()) || !taskId.equals(event.getTaskId())) {
                errors.add("events[" + i + "]: belongs to tenantId=" + event.getTenantId()
                        + ", taskId=" + event.getTaskId());
            }
            if (previousId != null && event.getEventId() != null && event.getEventId().compareTo(previousId) <= 0) {
                errors.add("events[" + i + "]: eventId is not after the previous event in the batch");
            }
            boolean created = event.getKind() == EventKind.CREATED;
            if (created && (expectedVersion > 0 || i > 0)) {
                errors.add("events[" + i + "]: created event must open the stream");
            }
            if (!created && expectedVersion == 0 && i == 0) {
                errors.add("events[0]: a new stream must start with a created event");
            }
            previousId = event.getEventId();
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * The batch must continue the stream's id order: its first event id sorts after the last
     * stored one. Raised as a version conflict so the writer reloads and mints fresh ids.
     */
    public static void requireAfter(String tenantId, String taskId, long version, String lastEventId,
                                    List<TaskEvent> events) {
        String first = events.get(0).getEventId();
        if (lastEventId != null && first.compareTo(lastEventId) <= 0) {
            throw VersionConflictException.eventIdNotAfter(tenantId, taskId, version, lastEventId, first);
        }
    }
}

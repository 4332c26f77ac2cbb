package com.tasksync.shared.events;

import java.util.Arrays;

/**
 * Closed set of task event kinds. Adding a kind is a compile-time decision: every
 * {@code switch} over this enum in the reconstructor and projection must handle it.
 */
public enum EventKind {

    CREATED(EventTypes.TASK_CREATED),
    UPDATED(EventTypes.TASK_UPDATED),
    ASSIGNED(EventTypes.TASK_ASSIGNED),
    COMPLETED(EventTypes.TASK_COMPLETED),
    REOPENED(EventTypes.TASK_REOPENED),
    DELETED(EventTypes.TASK_DELETED),
    /** Any type this build does not know, e.g. written by a newer producer. */
    UNKNOWN(null);

    private final String eventType;

    EventKind(String eventType) {
        this.eventType = eventType;
    }

    public String eventType() {
        return eventType;
    }

    public static EventKind fromEventType(String eventType) {
        return Arrays.stream(values())
                .filter(k -> k.eventType != null && k.eventType.equals(eventType))
                .findFirst()
                .orElse(UNKNOWN);
    }
}

package com.tasksync.shared.domain;

/** What replay does with an event type this build does not know. */
public enum UnknownEventPolicy {
    /** Log a warning, count the event towards the version, leave business fields untouched. */
    SKIP,
    /** Stop replay with a corrupt-stream error. */
    REJECT
}

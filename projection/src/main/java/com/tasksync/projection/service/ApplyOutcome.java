package com.tasksync.projection.service;

public enum ApplyOutcome {
    /** The event changed the row. */
    APPLIED,
    /** Already folded in by an earlier delivery; nothing written. */
    DUPLICATE,
    /** Unknown event kind: position advanced, fields untouched. */
    IGNORED
}

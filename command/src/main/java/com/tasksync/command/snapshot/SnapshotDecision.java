package com.tasksync.command.snapshot;

public enum SnapshotDecision {
    NONE,
    EVENT_COUNT,
    AGE;

    public boolean shouldSnapshot() {
        return this != NONE;
    }
}

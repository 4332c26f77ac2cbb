package com.tasksync.shared.domain;

public enum TaskStatus {
    ACTIVE,
    COMPLETED,
    DELETED
}

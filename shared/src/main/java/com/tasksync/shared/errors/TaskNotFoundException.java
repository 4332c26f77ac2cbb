package com.tasksync.shared.errors;

public class TaskNotFoundException extends TaskSyncException {

    public TaskNotFoundException(String tenantId, String taskId) {
        super(ErrorKind.NOT_FOUND, "Task not found: tenantId=" + tenantId + ", taskId=" + taskId);
    }
}

package com.tasksync.shared.eventstore;

import com.tasksync.shared.events.TaskEvent;
import lombok.Value;

import java.util.List;

@Value
public class AppendResult {
    String tenantId;
    String taskId;
    long newVersion;
    List<TaskEvent> events;

    /** Stream version assigned to the first event of the batch. */
    public long firstVersion() {
        return newVersion - events.size() + 1;
    }
}

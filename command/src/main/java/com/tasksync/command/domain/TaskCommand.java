package com.tasksync.command.domain;

import com.tasksync.shared.security.RequestContext;
import lombok.Getter;
import lombok.ToString;

/**
 * A write intent against one task. {@code taskId} is null for creation: the processor
 * mints the id.
 */
@Getter
@ToString
public abstract class TaskCommand {

    private final RequestContext context;
    private final String taskId;

    protected TaskCommand(RequestContext context, String taskId) {
        this.context = context;
        this.taskId = taskId;
    }

    public abstract CommandType getType();
}

package com.tasksync.command.domain;

import com.tasksync.shared.security.RequestContext;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * All task command classes.
 *
 * Naming: {Verb}Task. Fields hold the input as received; {@link CommandValidator} returns
 * normalized copies.
 */
public final class TaskCommands {

    private TaskCommands() {}

    @Getter
    @ToString(callSuper = true)
    public static class CreateTask extends TaskCommand {
        private final String title;
        private final String description;
        private final List<String> tags;
        /** Null assigns the task to its creator. */
        private final String assigneeId;

        public CreateTask(RequestContext context, String title, String description, List<String> tags,
                          String assigneeId) {
            super(context, null);
            this.title = title;
            this.description = description;
            this.tags = tags;
            this.assigneeId = assigneeId;
        }

        @Override
        public CommandType getType() {
            return CommandType.CREATE;
        }
    }

    /** Null fields are left unchanged. */
    @Getter
    @ToString(callSuper = true)
    public static class UpdateTask extends TaskCommand {
        private final String title;
        private final String description;
        private final List<String> tags;

        public UpdateTask(RequestContext context, String taskId, String title, String description,
                          List<String> tags) {
            super(context, taskId);
            this.title = title;
            this.description = description;
            this.tags = tags;
        }

        @Override
        public CommandType getType() {
            return CommandType.UPDATE;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static class AssignTask extends TaskCommand {
        private final String assigneeId;

        public AssignTask(RequestContext context, String taskId, String assigneeId) {
            super(context, taskId);
            this.assigneeId = assigneeId;
        }

        @Override
        public CommandType getType() {
            return CommandType.ASSIGN;
        }
    }

    public static class CompleteTask extends TaskCommand {

        public CompleteTask(RequestContext context, String taskId) {
            super(context, taskId);
        }

        @Override
        public CommandType getType() {
            return CommandType.COMPLETE;
        }
    }

    public static class ReopenTask extends TaskCommand {

        public ReopenTask(RequestContext context, String taskId) {
            super(context, taskId);
        }

        @Override
        public CommandType getType() {
            return CommandType.REOPEN;
        }
    }

    @Getter
    @ToString(callSuper = true)
    public static class DeleteTask extends TaskCommand {
        private final String reason;

        public DeleteTask(RequestContext context, String taskId, String reason) {
            super(context, taskId);
            this.reason = reason;
        }

        @Override
        public CommandType getType() {
            return CommandType.DELETE;
        }
    }
}

package com.tasksync.command.domain;

import com.tasksync.shared.domain.TaskState;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of an accepted command. {@code eventIds} is empty when the command was a no-op
 * (completing a completed task, for example).
 */
@Value
@Builder
@Jacksonized
public class CommandResult {
    String taskId;
    CommandType type;
    long version;
    List<String> eventIds;
    TaskState state;
    /** True when served from the idempotency store rather than executed. */
    @With
    boolean replayed;
}

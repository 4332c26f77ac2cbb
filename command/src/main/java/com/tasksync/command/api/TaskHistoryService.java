package com.tasksync.command.api;

import com.tasksync.shared.domain.TaskAggregateLoader;
import com.tasksync.shared.domain.TaskState;
import com.tasksync.shared.errors.TaskNotFoundException;
import com.tasksync.shared.eventstore.EventStore;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.security.RequestContext;
import com.tasksync.shared.security.TenantMembershipChecker;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read access to the write side: a task's state straight from its event stream, and its
 * event history. Deleted tasks stay readable here; that is the audit trail.
 */
@Service
@RequiredArgsConstructor
public class TaskHistoryService {

    private final TaskAggregateLoader loader;
    private final EventStore eventStore;
    private final TenantMembershipChecker membershipChecker;

    public TaskState currentState(RequestContext ctx, String taskId) {
        membershipChecker.checkMember(ctx);
        return loader.load(ctx.getTenantId(), taskId)
                .orElseThrow(() -> new TaskNotFoundException(ctx.getTenantId(), taskId));
    }

    public List<TaskEvent> history(RequestContext ctx, String taskId) {
        membershipChecker.checkMember(ctx);
        List<TaskEvent> events = eventStore.read(ctx.getTenantId(), taskId);
        if (events.isEmpty()) {
            throw new TaskNotFoundException(ctx.getTenantId(), taskId);
        }
        return events;
    }
}

package com.tasksync.projection.query;

import com.tasksync.projection.domain.TaskProjection;
import com.tasksync.projection.repository.TaskProjectionRepository;
import com.tasksync.shared.domain.TaskStatus;
import com.tasksync.shared.errors.TaskNotFoundException;
import com.tasksync.shared.errors.ValidationException;
import com.tasksync.shared.security.RequestContext;
import com.tasksync.shared.security.TenantMembershipChecker;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Task Query Service: Read Side (CQRS)
 *
 * Served from the projection table only; results may trail the event store by the
 * change-feed lag. Lists are ordered by task id, which sorts by creation time.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TaskQueryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private final TaskProjectionRepository repository;
    private final TenantMembershipChecker membershipChecker;

    public TaskView get(RequestContext ctx, String taskId) {
        membershipChecker.checkMember(ctx);
        return repository.findByTenantIdAndTaskId(ctx.getTenantId(), taskId)
                .filter(row -> !row.isDeleted())
                .map(TaskView::from)
                .orElseThrow(() -> new TaskNotFoundException(ctx.getTenantId(), taskId));
    }

    /**
     * @param status "active" (default) or "completed"
     * @param limit  defaults to 50, at most 100
     * @param after  task id of the last item of the previous page, or null
     */
    public TaskPage list(RequestContext ctx, String status, Integer limit, String after) {
        membershipChecker.checkMember(ctx);
        int pageSize = limit == null ? DEFAULT_LIMIT : limit;
        if (pageSize < 1 || pageSize > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        String cursor = after == null ? "" : after;
        // one extra row tells whether another page exists
        PageRequest page = PageRequest.of(0, pageSize + 1);

        List<TaskProjection> rows = switch (status == null ? "active" : status.toLowerCase()) {
            case "active" -> repository.findByTenantIdAndActiveTrueAndTaskIdGreaterThanOrderByTaskIdAsc(
                    ctx.getTenantId(), cursor, page);
            case "completed" -> repository.findByTenantIdAndStatusAndTaskIdGreaterThanOrderByTaskIdAsc(
                    ctx.getTenantId(), TaskStatus.COMPLETED, cursor, page);
            default -> throw new ValidationException("status must be 'active' or 'completed'");
        };

        boolean hasMore = rows.size() > pageSize;
        List<TaskView> tasks = rows.stream().limit(pageSize).map(TaskView::from).toList();
        String nextToken = hasMore ? tasks.get(tasks.size() - 1).getTaskId() : null;
        return new TaskPage(tasks, hasMore, nextToken);
    }
}

package com.tasksync.projection.api;

import com.tasksync.projection.query.TaskPage;
import com.tasksync.projection.query.TaskQueryService;
import com.tasksync.projection.query.TaskView;
import com.tasksync.shared.security.RequestContext;
import com.tasksync.shared.web.CorrelationIdFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Task read endpoints, served from the projection.
 *
 * GET /api/tasks?status=active|completed&limit=50&after={taskId}
 * GET /api/tasks/{taskId}
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskQueryController {

    private final TaskQueryService queryService;

    @GetMapping
    public ResponseEntity<TaskPage> listTasks(
            @RequestHeader(RequestContext.TENANT_HEADER) String tenantId,
            @RequestHeader(RequestContext.USER_HEADER) String userId,
            @RequestHeader(value = RequestContext.MEMBERSHIPS_HEADER, required = false) String memberships,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String after) {
        return ResponseEntity.ok(queryService.list(context(tenantId, userId, memberships), status, limit, after));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskView> getTask(
            @PathVariable String taskId,
            @RequestHeader(RequestContext.TENANT_HEADER) String tenantId,
            @RequestHeader(RequestContext.USER_HEADER) String userId,
            @RequestHeader(value = RequestContext.MEMBERSHIPS_HEADER, required = false) String memberships) {
        return ResponseEntity.ok(queryService.get(context(tenantId, userId, memberships), taskId));
    }

    private static RequestContext context(String tenantId, String userId, String memberships) {
        return RequestContext.fromHeaders(tenantId, userId, memberships,
                CorrelationIdFilter.currentCorrelationId(), null);
    }
}

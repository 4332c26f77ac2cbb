package com.tasksync.command.api;

import com.tasksync.command.domain.CommandResult;
import com.tasksync.command.domain.TaskCommandProcessor;
import com.tasksync.command.domain.TaskCommands.*;
import com.tasksync.shared.domain.TaskState;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.security.RequestContext;
import com.tasksync.shared.web.CorrelationIdFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Task command REST controller.
 *
 * Write endpoints go through {@link TaskCommandProcessor}; every successful response carries
 * the task's new version and state. The two GET endpoints read the event store directly.
 *
 * Identity headers are asserted by the gateway: X-Tenant-Id, X-User-Id, X-Tenant-Memberships.
 */
@Slf4j
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskCommandController {

    private final TaskCommandProcessor processor;
    private final TaskHistoryService historyService;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<CommandResult> createTask(@Valid @RequestBody CreateTaskRequest request,
                                                    HttpServletRequest http) {
        CommandResult result = processor.handle(new CreateTask(context(http), request.getTitle(),
                request.getDescription(), request.getTags(), request.getAssigneeId()));
        return ResponseEntity
                .created(URI.create("/api/tasks/" + result.getTaskId()))
                .body(result);
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<CommandResult> updateTask(@PathVariable String taskId,
                                                    @Valid @RequestBody UpdateTaskRequest request,
                                                    HttpServletRequest http) {
        return ResponseEntity.ok(processor.handle(new UpdateTask(context(http), taskId,
                request.getTitle(), request.getDescription(), request.getTags())));
    }

    @PostMapping("/{taskId}/assign")
    public ResponseEntity<CommandResult> assignTask(@PathVariable String taskId,
                                                    @Valid @RequestBody AssignTaskRequest request,
                                                    HttpServletRequest http) {
        return ResponseEntity.ok(processor.handle(new AssignTask(context(http), taskId, request.getAssigneeId())));
    }

    @PostMapping("/{taskId}/complete")
    public ResponseEntity<CommandResult> completeTask(@PathVariable String taskId, HttpServletRequest http) {
        return ResponseEntity.ok(processor.handle(new CompleteTask(context(http), taskId)));
    }

    @PostMapping("/{taskId}/reopen")
    public ResponseEntity<CommandResult> reopenTask(@PathVariable String taskId, HttpServletRequest http) {
        return ResponseEntity.ok(processor.handle(new ReopenTask(context(http), taskId)));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<CommandResult> deleteTask(@PathVariable String taskId,
                                                    @RequestBody(required = false) Map<String, String> body,
                                                    HttpServletRequest http) {
        String reason = body != null ? body.get("reason") : null;
        return ResponseEntity.ok(processor.handle(new DeleteTask(context(http), taskId, reason)));
    }

    // ─── Event Store Reads ────────────────────────────────────────────────────

    @GetMapping("/{taskId}/state")
    public ResponseEntity<TaskState> getState(@PathVariable String taskId, HttpServletRequest http) {
        return ResponseEntity.ok(historyService.currentState(context(http), taskId));
    }

    @GetMapping("/{taskId}/events")
    public ResponseEntity<Map<String, Object>> getEvents(@PathVariable String taskId, HttpServletRequest http) {
        List<TaskEvent> events = historyService.history(context(http), taskId);
        return ResponseEntity.ok(Map.of(
                "taskId", taskId,
                "events", events,
                "count", events.size()
        ));
    }

    private static RequestContext context(HttpServletRequest http) {
        return RequestContext.fromHeaders(
                http.getHeader(RequestContext.TENANT_HEADER),
                http.getHeader(RequestContext.USER_HEADER),
                http.getHeader(RequestContext.MEMBERSHIPS_HEADER),
                CorrelationIdFilter.currentCorrelationId(),
                http.getHeader(RequestContext.IDEMPOTENCY_KEY_HEADER));
    }
}

// ─── Request DTOs ─────────────────────────────────────────────────────────────
// Shape checks only; CommandValidator owns trimming and limits.

@Data
class CreateTaskRequest {
    @NotBlank private String title;
    private String description;
    private List<@Size(max = 50) String> tags;
    private String assigneeId;
}

@Data
class UpdateTaskRequest {
    private String title;
    private String description;
    private List<String> tags;
}

@Data
class AssignTaskRequest {
    @NotBlank private String assigneeId;
}

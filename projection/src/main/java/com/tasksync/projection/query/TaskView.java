package com.tasksync.projection.query;

import com.tasksync.projection.domain.TaskProjection;
import com.tasksync.shared.domain.TaskStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** API shape of a projected task. */
@Value
@Builder
public class TaskView {
    String taskId;
    String title;
    String description;
    List<String> tags;
    String assigneeId;
    String status;
    boolean completed;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;
    Instant completedAt;
    long version;

    public static TaskView from(TaskProjection row) {
        return TaskView.builder()
                .taskId(row.getTaskId())
                .title(row.getTitle())
                .description(row.getDescription())
                .tags(List.copyOf(row.getTags()))
                .assigneeId(row.getAssigneeId())
                .status(row.getStatus().name())
                .completed(row.getStatus() == TaskStatus.COMPLETED)
                .createdBy(row.getCreatedBy())
                .createdAt(row.getCreatedAt())
                .updatedAt(row.getUpdatedAt())
                .completedAt(row.getCompletedAt())
                .version(row.getVersion())
                .build();
    }
}

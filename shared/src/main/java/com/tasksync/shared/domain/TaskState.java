package com.tasksync.shared.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

/**
 * Current state of one task, derived by folding its events in order.
 *
 * Never persisted as the source of truth: snapshots and projection rows are caches of it.
 * {@code version} is the number of events folded since genesis; {@code lastEventId} is the
 * id of the last one.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TaskState {

    private String taskId;
    private String tenantId;
    private String title;
    private String description;
    @Builder.Default
    private List<String> tags = List.of();
    private String assigneeId;
    private TaskStatus status;
    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
    private long version;
    private String lastEventId;

    @JsonIgnore
    public boolean isActive() {
        return status == TaskStatus.ACTIVE;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    @JsonIgnore
    public boolean isDeleted() {
        return status == TaskStatus.DELETED;
    }
}

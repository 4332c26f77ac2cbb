package com.tasksync.projection.domain;

import com.tasksync.shared.domain.TaskStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Task JPA Entity: Read Model (CQRS)
 *
 * Derived entirely from the change-feed; the event store stays the source of truth.
 * {@code active} backs the (tenant_id, active, task_id) index the task list is served from.
 * {@code lastAppliedEventId} is the duplicate filter: event ids are time-ordered, so any
 * event at or below it has already been folded in.
 */
@Entity
@IdClass(TaskProjectionKey.class)
@Table(name = "task_projections", indexes = {
    @Index(name = "idx_task_projections_active", columnList = "tenant_id, active, task_id"),
    @Index(name = "idx_task_projections_status", columnList = "tenant_id, status, task_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskProjection {

    @Id
    @Column(name = "tenant_id", length = 100)
    private String tenantId;

    @Id
    @Column(name = "task_id", length = 26)
    private String taskId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", length = 1000)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", nullable = false, columnDefinition = "jsonb")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(name = "assignee_id", length = 100)
    private String assigneeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_by", nullable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    /** Events applied so far; equals the stream version of {@code lastAppliedEventId}. */
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "last_applied_event_id", nullable = false, length = 26)
    private String lastAppliedEventId;

    @Column(name = "projected_at", nullable = false)
    private Instant projectedAt;

    @Version
    @Column(name = "row_version")
    private Long rowVersion;
}

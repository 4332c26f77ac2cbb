package com.tasksync.command.eventstore;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One row of the append-only task event log.
 *
 * The unique (tenant_id, task_id, stream_version) constraint is what makes the version check
 * hold under concurrency: of two writers that both saw version N, only one can insert N+1.
 * Rows are never updated or deleted.
 */
@Entity
@Table(name = "task_events",
        uniqueConstraints = @UniqueConstraint(name = "uq_task_events_stream_version",
                columnNames = {"tenant_id", "task_id", "stream_version"}),
        indexes = {
            @Index(name = "idx_task_events_tenant", columnList = "tenant_id, id"),
            @Index(name = "idx_task_events_correlation_id", columnList = "correlation_id")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskEventRecord implements Persistable<String> {

    @Id
    @Column(name = "id", length = 26)
    private String id;                 // Event ULID

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "task_id", nullable = false, length = 26)
    private String taskId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;

    @Column(name = "stream_version", nullable = false)
    private long streamVersion;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    @Column(name = "actor_id", nullable = false, length = 100)
    private String actorId;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    /** Always insert: an id collision must fail, never merge into an existing row. */
    @Transient
    @Builder.Default
    private boolean fresh = true;

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.fresh = false;
    }
}

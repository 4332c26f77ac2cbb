package com.tasksync.command.snapshot;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Persisted snapshot, keyed by its cutoff event id. The state column holds the serialized
 * {@link com.tasksync.shared.domain.TaskState}; rows are only ever inserted, marked for
 * expiry, or purged.
 */
@Entity
@Table(name = "task_snapshots", indexes = {
    @Index(name = "idx_task_snapshots_latest", columnList = "tenant_id, task_id, stream_version"),
    @Index(name = "idx_task_snapshots_expires_at", columnList = "expires_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSnapshotRecord {

    @Id
    @Column(name = "cutoff_event_id", length = 26)
    private String cutoffEventId;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "task_id", nullable = false, length = 26)
    private String taskId;

    @Column(name = "stream_version", nullable = false)
    private long streamVersion;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "state", nullable = false, columnDefinition = "jsonb")
    private String state;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;
}

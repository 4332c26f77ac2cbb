package com.tasksync.shared.outbox;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Change-feed entry, written in the same transaction as the task events it announces.
 *
 *   1. BEGIN TRANSACTION
 *      INSERT INTO task_events (...)   -- the event log
 *      INSERT INTO outbox (...)        -- one row per appended event
 *   2. COMMIT
 *   3. Relay reads outbox, publishes to Kafka, marks published
 *
 * Either both the events and their feed entries are committed, or neither is. The relay may
 * publish a row more than once; consumers are idempotent on event id.
 */
@Entity
@Table(name = "outbox", indexes = {
    @Index(name = "idx_outbox_unpublished",
           columnList = "published_at, retry_count, created_at"),
    @Index(name = "idx_outbox_task",
           columnList = "tenant_id, task_id, stream_version")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxRecord {

    public static final int MAX_ATTEMPTS = 5;

    /** Same ULID as the event: one feed entry per event. */
    @Id
    @Column(name = "id", length = 26)
    private String id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(name = "task_id", nullable = false, length = 26)
    private String taskId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "stream_version", nullable = false)
    private long streamVersion;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @Column(name = "topic", nullable = false, length = 200)
    private String topic;

    /** Serialized event JSON, published as the record value unchanged */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    /** NULL until successfully published to Kafka */
    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    /** Relay skips records where nextRetryAt > NOW() */
    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onPrePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onPreUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isExhausted() {
        return retryCount >= MAX_ATTEMPTS;
    }

    public void markPublished(Instant now) {
        this.publishedAt = now;
        this.updatedAt = now;
    }

    /** Record a failure and schedule the next attempt: 5s, 10s, 20s, 40s, 80s */
    public void recordFailure(String errorMessage, Instant now) {
        this.retryCount++;
        this.lastError = errorMessage;
        long backoffSeconds = (1L << (retryCount - 1)) * 5L;
        this.nextRetryAt = now.plusSeconds(backoffSeconds);
        this.updatedAt = now;
    }
}

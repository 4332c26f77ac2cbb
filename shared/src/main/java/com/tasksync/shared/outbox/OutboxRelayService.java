package com.tasksync.shared.outbox;

import com.tasksync.shared.events.EventTypes;
import com.tasksync.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.LockModeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.jpa.repository.*;
import org.springframework.data.repository.query.Param;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outbox JPA Repository
 */
interface OutboxRepository extends JpaRepository<OutboxRecord, String> {

    /**
     * Fetch unpublished records eligible for relay, oldest first.
     *
     * Only the head of each task's backlog qualifies: a record waits while an earlier version
     * of the same task is unpublished, whether that one is backing off, exhausted, or locked
     * by another relay instance. Per-task publish order therefore equals stream order.
     * SKIP LOCKED lets several relay instances drain the table without blocking each other.
     */
    @Query(value = """
        SELECT * FROM outbox o
        WHERE o.published_at IS NULL
          AND o.retry_count < 5
          AND (o.next_retry_at IS NULL OR o.next_retry_at <= :now)
          AND NOT EXISTS (
                SELECT 1 FROM outbox earlier
                WHERE earlier.tenant_id = o.tenant_id
                  AND earlier.task_id = o.task_id
                  AND earlier.stream_version < o.stream_version
                  AND earlier.published_at IS NULL)
        ORDER BY o.created_at ASC, o.id ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    List<OutboxRecord> findUnpublishedForRelay(@Param("now") Instant now, @Param("limit") int limit);

    @Query("SELECT COUNT(o) FROM OutboxRecord o WHERE o.publishedAt IS NULL AND o.retryCount < 5")
    long countUnpublished();
}

/**
 * Outbox Relay: the change-feed. Polls the outbox table and publishes each event to the
 * task events topic, keyed by task id.
 *
 * Delivery is at-least-once: a crash between the Kafka ack and the commit republishes the
 * batch on the next poll. Within a task, events reach the topic in stream order; once one
 * fails, the task's later events wait for it.
 */
@Slf4j
@Service
public class OutboxRelayService {

    private final OutboxRepository outboxRepository;
    private final EventPublisher eventPublisher;
    private final Clock clock;
    private final int batchSize;
    private final Counter relayedCounter;
    private final Counter relayErrorCounter;

    public OutboxRelayService(OutboxRepository outboxRepository,
                              EventPublisher eventPublisher,
                              MeterRegistry meterRegistry,
                              Clock clock,
                              @Value("${tasksync.outbox.batch-size:50}") int batchSize) {
        this.outboxRepository = outboxRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.batchSize = batchSize;
        this.relayedCounter = Counter.builder("outbox.records.relayed")
                .description("Outbox records successfully relayed to Kafka")
                .register(meterRegistry);
        this.relayErrorCounter = Counter.builder("outbox.relay.errors")
                .description("Errors during outbox relay")
                .register(meterRegistry);
        Gauge.builder("outbox.backlog", outboxRepository, OutboxRepository::countUnpublished)
                .description("Unpublished outbox records still eligible for relay")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${tasksync.outbox.poll-interval-ms:1000}")
    @Transactional
    public int relay() {
        List<OutboxRecord> records = outboxRepository.findUnpublishedForRelay(clock.instant(), batchSize);
        if (records.isEmpty()) return 0;

        log.debug("Outbox relay: processing {} records", records.size());

        int published = 0;
        Set<String> blockedTasks = new HashSet<>();
        for (OutboxRecord record : records) {
            String streamKey = record.getTenantId() + "#" + record.getTaskId();
            if (blockedTasks.contains(streamKey)) {
                log.debug("Outbox record held behind a failed earlier event: id={}, taskId={}, version={}",
                        record.getId(), record.getTaskId(), record.getStreamVersion());
                continue;
            }
            try {
                eventPublisher.publishAndWait(record.getTopic(), record.getTaskId(), record.getPayload(),
                        headersOf(record));
                record.markPublished(clock.instant());
                relayedCounter.increment();
                published++;
            } catch (EventPublisher.EventPublishException ex) {
                log.error("Failed to relay outbox record: id={}, eventType={}, attempt={}",
                        record.getId(), record.getEventType(), record.getRetryCount() + 1, ex);
                record.recordFailure(ex.getMessage(), clock.instant());
                relayErrorCounter.increment();
                blockedTasks.add(streamKey);
                if (record.isExhausted()) {
                    log.error("Outbox record exhausted retries, manual replay required: id={}, taskId={}",
                            record.getId(), record.getTaskId());
                }
            }
        }

        outboxRepository.saveAll(records);
        return published;
    }

    private static Map<String, String> headersOf(OutboxRecord record) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(EventTypes.HEADER_EVENT_ID, record.getId());
        headers.put(EventTypes.HEADER_EVENT_TYPE, record.getEventType());
        headers.put(EventTypes.HEADER_TENANT_ID, record.getTenantId());
        headers.put(EventTypes.HEADER_TASK_ID, record.getTaskId());
        headers.put(EventTypes.HEADER_STREAM_VERSION, String.valueOf(record.getStreamVersion()));
        headers.put(EventTypes.HEADER_CORRELATION_ID, record.getCorrelationId());
        return headers;
    }
}

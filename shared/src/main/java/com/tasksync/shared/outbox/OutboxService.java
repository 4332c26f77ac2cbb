package com.tasksync.shared.outbox;

import com.tasksync.shared.events.EventTypes;
import com.tasksync.shared.events.TaskEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes change-feed entries for appended events.
 * Joins the caller's transaction and refuses to run without one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxService {

    private final OutboxRepository outboxRepository;

    /**
     * @param payload       the event exactly as stored in the event log
     * @param streamVersion version the event store assigned to this event
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void append(TaskEvent event, long streamVersion, String payload) {
        OutboxRecord record = OutboxRecord.builder()
                .id(event.getEventId())
                .tenantId(event.getTenantId())
                .taskId(event.getTaskId())
                .eventType(event.getEventType())
                .streamVersion(streamVersion)
                .correlationId(event.getCorrelationId())
                .topic(EventTypes.TOPIC_TASK_EVENTS)
                .payload(payload)
                .retryCount(0)
                .build();

        outboxRepository.save(record);

        log.debug("Outbox record appended: eventId={}, type={}, taskId={}, version={}",
                event.getEventId(), event.getEventType(), event.getTaskId(), streamVersion);
    }
}

package com.tasksync.command.eventstore;

import com.tasksync.shared.errors.CorruptStreamException;
import com.tasksync.shared.errors.TransientInfrastructureException;
import com.tasksync.shared.errors.VersionConflictException;
import com.tasksync.shared.eventstore.AppendResult;
import com.tasksync.shared.eventstore.AppendValidator;
import com.tasksync.shared.eventstore.CutoffNotFoundException;
import com.tasksync.shared.eventstore.EventStore;
import com.tasksync.shared.events.MalformedEventException;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEventSerializer;
import com.tasksync.shared.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL event store.
 *
 * An append writes the event rows and their outbox rows in one transaction. The version
 * read up front gives a cheap early conflict; the unique stream-version constraint catches
 * the writer that raced past it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaEventStore implements EventStore {

    private final TaskEventRecordRepository repository;
    private final OutboxService outboxService;
    private final TaskEventSerializer serializer;
    private final Clock clock;

    @Override
    @Transactional
    public AppendResult append(String tenantId, String taskId, long expectedVersion, List<TaskEvent> events) {
        AppendValidator.validate(tenantId, taskId, expectedVersion, events);

        try {
            long current = repository.findMaxStreamVersion(tenantId, taskId);
            if (current != expectedVersion) {
                throw new VersionConflictException(tenantId, taskId, expectedVersion, current);
            }
            if (current > 0) {
                String lastEventId = repository.findFirstByTenantIdAndTaskIdOrderByStreamVersionDesc(tenantId, taskId)
                        .map(TaskEventRecord::getId)
                        .orElse(null);
                AppendValidator.requireAfter(tenantId, taskId, current, lastEventId, events);
            }
        } catch (TransientDataAccessException e) {
            throw new TransientInfrastructureException("Event store unavailable", e);
        }

        List<TaskEventRecord> records = new ArrayList<>(events.size());
        List<String> payloads = new ArrayList<>(events.size());
        long version = expectedVersion;
        for (TaskEvent event : events) {
            String payload = serializer.serialize(event);
            payloads.add(payload);
            records.add(TaskEventRecord.builder()
                    .id(event.getEventId())
                    .tenantId(tenantId)
                    .taskId(taskId)
                    .eventType(event.getEventType())
                    .schemaVersion(event.getSchemaVersion())
                    .streamVersion(++version)
                    .payload(payload)
                    .actorId(event.getActorId())
                    .correlationId(event.getCorrelationId())
                    .occurredAt(event.getOccurredAt())
                    .recordedAt(clock.instant())
                    .build());
        }

        try {
            repository.saveAllAndFlush(records);
        } catch (DataIntegrityViolationException e) {
            throw new VersionConflictException(tenantId, taskId, expectedVersion, e);
        } catch (TransientDataAccessException e) {
            throw new TransientInfrastructureException("Event store unavailable", e);
        }

        for (int i = 0; i < events.size(); i++) {
            outboxService.append(events.get(i), records.get(i).getStreamVersion(), payloads.get(i));
        }

        log.debug("Events appended: tenantId={}, taskId={}, count={}, version={}",
                tenantId, taskId, events.size(), version);
        return new AppendResult(tenantId, taskId, version, List.copyOf(events));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskEvent> read(String tenantId, String taskId) {
        return decode(repository.findByTenantIdAndTaskIdOrderByStreamVersionAsc(tenantId, taskId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskEvent> readSince(String tenantId, String taskId, String afterEventId) {
        TaskEventRecord cutoff = repository.findByIdAndTenantIdAndTaskId(afterEventId, tenantId, taskId)
                .orElseThrow(() -> new CutoffNotFoundException(taskId, afterEventId));
        return decode(repository.findByTenantIdAndTaskIdAndStreamVersionGreaterThanOrderByStreamVersionAsc(
                tenantId, taskId, cutoff.getStreamVersion()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskEvent> readTenant(String tenantId) {
        return decode(repository.findByTenantIdOrderByIdAsc(tenantId));
    }

    @Override
    @Transactional(readOnly = true)
    public long currentVersion(String tenantId, String taskId) {
        return repository.findMaxStreamVersion(tenantId, taskId);
    }

    private List<TaskEvent> decode(List<TaskEventRecord> records) {
        List<TaskEvent> events = new ArrayList<>(records.size());
        for (TaskEventRecord record : records) {
            try {
                events.add(serializer.deserialize(record.getPayload()));
            } catch (MalformedEventException e) {
                log.error("Unreadable stored event: taskId={}, eventId={}, version={}",
                        record.getTaskId(), record.getId(), record.getStreamVersion(), e);
                throw new CorruptStreamException(record.getTaskId(), record.getId(),
                        "Stored event cannot be decoded", e);
            }
        }
        return events;
    }
}

package com.tasksync.command.eventstore;

import com.tasksync.shared.errors.CorruptStreamException;
import com.tasksync.shared.errors.TransientInfrastructureException;
import com.tasksync.shared.errors.ValidationException;
import com.tasksync.shared.errors.VersionConflictException;
import com.tasksync.shared.eventstore.AppendResult;
import com.tasksync.shared.eventstore.CutoffNotFoundException;
import com.tasksync.shared.events.EventIds;
import com.tasksync.shared.events.EventMetadata;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEventSerializer;
import com.tasksync.shared.events.TaskEvents.TaskAssigned;
import com.tasksync.shared.events.TaskEvents.TaskCompleted;
import com.tasksync.shared.events.TaskEvents.TaskCreated;
import com.tasksync.shared.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests: JpaEventStore
 *
 * The repository is mocked; tests cover version assignment, outbox writes and the
 * translation of database failures into the error taxonomy.
 */
@ExtendWith(MockitoExtension.class)
class JpaEventStoreTest {

    private static final String TENANT = "family-1";
    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock TaskEventRecordRepository repository;
    @Mock OutboxService outboxService;

    TaskEventSerializer serializer = new TaskEventSerializer(TaskEventSerializer.defaultObjectMapper());
    JpaEventStore store;
    String taskId;

    @BeforeEach
    void setUp() {
        store = new JpaEventStore(repository, outboxService, serializer, Clock.fixed(NOW, ZoneOffset.UTC));
        taskId = EventIds.next();
    }

    private EventMetadata meta() {
        return EventMetadata.builder()
                .eventId(EventIds.next())
                .tenantId(TENANT)
                .taskId(taskId)
                .actorId("user-alice")
                .occurredAt(NOW)
                .correlationId("corr-1")
                .build();
    }

    private List<TaskEvent> newTask() {
        return List.of(new TaskCreated(meta(), "Buy milk", null, List.of()), new TaskAssigned(meta(), "user-alice"));
    }

    @Test
    @DisplayName("append — assigns consecutive stream versions and writes one outbox row per event")
    @SuppressWarnings("unchecked")
    void append_shouldAssignVersionsAndWriteOutbox() {
        when(repository.findMaxStreamVersion(TENANT, taskId)).thenReturn(0L);
        List<TaskEvent> events = newTask();

        AppendResult result = store.append(TENANT, taskId, 0, events);

        assertThat(result.getNewVersion()).isEqualTo(2);
        ArgumentCaptor<List<TaskEventRecord>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAllAndFlush(saved.capture());
        assertThat(saved.getValue()).extracting(TaskEventRecord::getStreamVersion).containsExactly(1L, 2L);
        assertThat(saved.getValue()).allSatisfy(r -> {
            assertThat(r.isNew()).isTrue();
            assertThat(r.getRecordedAt()).isEqualTo(NOW);
        });
        verify(outboxService).append(eq(events.get(0)), eq(1L), anyString());
        verify(outboxService).append(eq(events.get(1)), eq(2L), anyString());
    }

    @Test
    @DisplayName("append — a stale expected version is a version conflict and nothing is written")
    void append_shouldRejectStaleVersion() {
        when(repository.findMaxStreamVersion(TENANT, taskId)).thenReturn(3L);

        assertThatThrownBy(() -> store.append(TENANT, taskId, 2, List.of(new TaskCompleted(meta()))))
                .isInstanceOf(VersionConflictException.class)
                .satisfies(ex -> assertThat(((VersionConflictException) ex).getActualVersion()).isEqualTo(3));
        verify(repository, never()).saveAllAndFlush(any());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("append — an event id not after the stored last id is a version conflict and nothing is written")
    void append_shouldRejectEventIdBeforeLastStoredId() {
        TaskCompleted completed = new TaskCompleted(meta());
        TaskEventRecord last = TaskEventRecord.builder()
                .id(EventIds.next()).tenantId(TENANT).taskId(taskId).streamVersion(2).build();
        when(repository.findMaxStreamVersion(TENANT, taskId)).thenReturn(2L);
        when(repository.findFirstByTenantIdAndTaskIdOrderByStreamVersionDesc(TENANT, taskId))
                .thenReturn(Optional.of(last));

        assertThatThrownBy(() -> store.append(TENANT, taskId, 2, List.of(completed)))
                .isInstanceOf(VersionConflictException.class)
                .hasMessageContaining(last.getId());
        verify(repository, never()).saveAllAndFlush(any());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("append — a unique-constraint violation from a racing writer becomes a version conflict")
    void append_shouldTranslateUniqueViolation() {
        when(repository.findMaxStreamVersion(TENANT, taskId)).thenReturn(2L);
        when(repository.saveAllAndFlush(anyList())).thenThrow(new DataIntegrityViolationException("uq_task_events_stream_version"));

        assertThatThrownBy(() -> store.append(TENANT, taskId, 2, List.of(new TaskCompleted(meta()))))
                .isInstanceOf(VersionConflictException.class);
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("append — a transient database failure is reported as retryable")
    void append_shouldTranslateTransientFailure() {
        when(repository.findMaxStreamVersion(TENANT, taskId)).thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> store.append(TENANT, taskId, 0, newTask()))
                .isInstanceOf(TransientInfrastructureException.class)
                .satisfies(ex -> assertThat(((TransientInfrastructureException) ex).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("append — an invalid batch is rejected before touching the database")
    void append_shouldValidateBeforeWriting() {
        assertThatThrownBy(() -> store.append(TENANT, taskId, 0, List.of(new TaskCompleted(meta()))))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("read — a stored payload that no longer decodes is a corrupt stream")
    void read_shouldReportCorruptPayload() {
        TaskEventRecord broken = TaskEventRecord.builder()
                .id(EventIds.next()).tenantId(TENANT).taskId(taskId).streamVersion(1).payload("{not json").build();
        when(repository.findByTenantIdAndTaskIdOrderByStreamVersionAsc(TENANT, taskId)).thenReturn(List.of(broken));

        assertThatThrownBy(() -> store.read(TENANT, taskId))
                .isInstanceOf(CorruptStreamException.class);
    }

    @Test
    @DisplayName("readSince — returns events after the cutoff and fails for an unknown cutoff")
    void readSince_shouldUseCutoffVersion() {
        TaskCompleted completed = new TaskCompleted(meta());
        TaskEventRecord cutoff = TaskEventRecord.builder()
                .id("01CUTOFF").tenantId(TENANT).taskId(taskId).streamVersion(2).build();
        TaskEventRecord after = TaskEventRecord.builder()
                .id(completed.getEventId()).tenantId(TENANT).taskId(taskId).streamVersion(3)
                .payload(serializer.serialize(completed)).build();
        when(repository.findByIdAndTenantIdAndTaskId("01CUTOFF", TENANT, taskId)).thenReturn(Optional.of(cutoff));
        when(repository.findByTenantIdAndTaskIdAndStreamVersionGreaterThanOrderByStreamVersionAsc(TENANT, taskId, 2L))
                .thenReturn(List.of(after));
        when(repository.findByIdAndTenantIdAndTaskId("missing", TENANT, taskId)).thenReturn(Optional.empty());

        assertThat(store.readSince(TENANT, taskId, "01CUTOFF")).containsExactly(completed);
        assertThatThrownBy(() -> store.readSince(TENANT, taskId, "missing"))
                .isInstanceOf(CutoffNotFoundException.class);
    }
}

package com.tasksync.projection.service;

import com.tasksync.projection.domain.TaskProjection;
import com.tasksync.projection.repository.TaskProjectionRepository;
import com.tasksync.shared.domain.TaskStatus;
import com.tasksync.shared.errors.TransientInfrastructureException;
import com.tasksync.shared.events.EventIds;
import com.tasksync.shared.events.MalformedEventException;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEventSerializer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.tasksync.projection.ProjectionTestEvents.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests: ProjectionUpdater
 *
 * The repository mock is backed by a map so rows persist across applies.
 */
@ExtendWith(MockitoExtension.class)
class ProjectionUpdaterTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    @Mock TaskProjectionRepository repository;

    Map<String, TaskProjection> rows = new HashMap<>();
    ProjectionUpdater updater;
    String taskId;

    @BeforeEach
    void setUp() {
        lenient().when(repository.findByTenantIdAndTaskId(anyString(), anyString()))
                .thenAnswer(inv -> Optional.ofNullable(rows.get(inv.getArgument(0) + "#" + inv.getArgument(1))));
        lenient().when(repository.saveAndFlush(any(TaskProjection.class))).thenAnswer(inv -> {
            TaskProjection row = inv.getArgument(0);
            rows.put(row.getTenantId() + "#" + row.getTaskId(), row);
            return row;
        });
        updater = new ProjectionUpdater(repository, Clock.fixed(NOW, ZoneOffset.UTC), new SimpleMeterRegistry());
        taskId = EventIds.next();
    }

    private TaskProjection row() {
        return rows.get(TENANT + "#" + taskId);
    }

    @Test
    @DisplayName("apply — created then completed leaves the row out of the active index")
    void apply_createThenComplete_shouldDeactivateRow() {
        assertThat(updater.apply(created(taskId, "Buy milk"), 1)).isEqualTo(ApplyOutcome.APPLIED);
        assertThat(row().isActive()).isTrue();

        TaskEvent completed = completed(taskId);
        assertThat(updater.apply(completed, 2)).isEqualTo(ApplyOutcome.APPLIED);

        assertThat(row().isActive()).isFalse();
        assertThat(row().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(row().getCompletedAt()).isEqualTo(completed.getOccurredAt());
        assertThat(row().getVersion()).isEqualTo(2);
        assertThat(row().getLastAppliedEventId()).isEqualTo(completed.getEventId());
        assertThat(row().getProjectedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("apply — every redelivery of an applied event is a duplicate and changes nothing")
    void apply_shouldBeIdempotent() {
        List<TaskEvent> stream = List.of(created(taskId, "Buy milk"), assigned(taskId, "user-bob"),
                updated(taskId, "Buy oat milk", "2 litres"), completed(taskId), reopened(taskId));
        for (int i = 0; i < stream.size(); i++) {
            updater.apply(stream.get(i), i + 1);
        }
        String title = row().getTitle();
        long version = row().getVersion();

        for (int i = 0; i < stream.size(); i++) {
            assertThat(updater.apply(stream.get(i), i + 1)).isEqualTo(ApplyOutcome.DUPLICATE);
        }

        assertThat(row().getTitle()).isEqualTo(title).isEqualTo("Buy oat milk");
        assertThat(row().getAssigneeId()).isEqualTo("user-bob");
        assertThat(row().getDescription()).isEqualTo("2 litres");
        assertThat(row().isActive()).isTrue();
        assertThat(row().getCompletedAt()).isNull();
        assertThat(row().getVersion()).isEqualTo(version).isEqualTo(5);
    }

    @Test
    @DisplayName("apply — an event that overtakes its predecessor is retried, and the late one still lands")
    void apply_shouldRetryAcrossVersionGap() {
        TaskEvent create = created(taskId, "Buy milk");
        TaskEvent update = updated(taskId, "Buy oat milk", null);
        TaskEvent complete = completed(taskId);
        updater.apply(create, 1);

        assertThatThrownBy(() -> updater.apply(complete, 3))
                .isInstanceOf(ProjectionOutOfOrderException.class)
                .isInstanceOf(TransientInfrastructureException.class)
                .hasMessageContaining("rowVersion=1");
        assertThat(row().getVersion()).isEqualTo(1);
        assertThat(row().isActive()).isTrue();

        assertThat(updater.apply(update, 2)).isEqualTo(ApplyOutcome.APPLIED);
        assertThat(updater.apply(complete, 3)).isEqualTo(ApplyOutcome.APPLIED);

        assertThat(row().getTitle()).isEqualTo("Buy oat milk");
        assertThat(row().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(row().getVersion()).isEqualTo(3);
        assertThat(row().getLastAppliedEventId()).isEqualTo(complete.getEventId());
    }

    @Test
    @DisplayName("apply — an event whose id does not sort after the last applied one is a permanent error")
    void apply_shouldRejectEventIdNotAfterLastApplied() {
        TaskEvent mintedEarlier = completed(taskId);
        updater.apply(created(taskId, "Buy milk"), 1);
        updater.apply(assigned(taskId, "user-bob"), 2);

        assertThatThrownBy(() -> updater.apply(mintedEarlier, 3))
                .isInstanceOf(MalformedEventException.class);
        assertThat(row().getVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("apply — delete is a soft delete and later events on the row are permanent errors")
    void apply_deleteShouldSoftDelete() {
        updater.apply(created(taskId, "Buy milk"), 1);
        updater.apply(deleted(taskId), 2);

        assertThat(row().isDeleted()).isTrue();
        assertThat(row().isActive()).isFalse();
        assertThat(row().getStatus()).isEqualTo(TaskStatus.DELETED);
        assertThat(row().getDeletedAt()).isNotNull();

        assertThatThrownBy(() -> updater.apply(completed(taskId), 3))
                .isInstanceOf(MalformedEventException.class);
    }

    @Test
    @DisplayName("apply — a created event anywhere but version one is a permanent error")
    void apply_shouldRejectMisplacedCreated() {
        updater.apply(created(taskId, "Buy milk"), 1);

        assertThatThrownBy(() -> updater.apply(created(taskId, "Buy milk again"), 2))
                .isInstanceOf(MalformedEventException.class);
        String otherTask = EventIds.next();
        assertThatThrownBy(() -> updater.apply(created(otherTask, "Walk dog"), 3))
                .isInstanceOf(MalformedEventException.class);
        assertThat(rows).doesNotContainKey(TENANT + "#" + otherTask);
    }

    @Test
    @DisplayName("apply — an event for a row not created yet is retried later")
    void apply_shouldReportOutOfOrder() {
        assertThatThrownBy(() -> updater.apply(completed(taskId), 2))
                .isInstanceOf(ProjectionOutOfOrderException.class)
                .isInstanceOf(TransientInfrastructureException.class);
    }

    @Test
    @DisplayName("apply — an unknown event type advances the position without touching fields")
    void apply_shouldIgnoreUnknownEvent() {
        updater.apply(created(taskId, "Buy milk"), 1);
        String json = "{\"eventType\":\"task.starred\",\"schemaVersion\":1,\"eventId\":\"" + EventIds.next()
                + "\",\"tenantId\":\"" + TENANT + "\",\"taskId\":\"" + taskId
                + "\",\"actorId\":\"user-alice\",\"occurredAt\":\"2026-02-01T00:00:00Z\",\"starred\":true}";
        TaskEvent unknown = new TaskEventSerializer(TaskEventSerializer.defaultObjectMapper()).deserialize(json);

        assertThat(updater.apply(unknown, 2)).isEqualTo(ApplyOutcome.IGNORED);
        assertThat(row().getVersion()).isEqualTo(2);
        assertThat(row().getLastAppliedEventId()).isEqualTo(unknown.getEventId());
        assertThat(row().getTitle()).isEqualTo("Buy milk");
    }

    @Test
    @DisplayName("apply — a concurrent row update surfaces as a transient failure")
    void apply_shouldTranslateOptimisticLockFailure() {
        updater.apply(created(taskId, "Buy milk"), 1);
        doThrow(new ObjectOptimisticLockingFailureException(TaskProjection.class, taskId))
                .when(repository).saveAndFlush(any(TaskProjection.class));

        assertThatThrownBy(() -> updater.apply(completed(taskId), 2))
                .isInstanceOf(TransientInfrastructureException.class);
    }
}

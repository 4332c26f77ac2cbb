package com.tasksync.shared.domain;

import com.tasksync.shared.TestEvents;
import com.tasksync.shared.errors.CorruptStreamException;
import com.tasksync.shared.events.EventIds;
import com.tasksync.shared.events.TaskEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tasksync.shared.TestEvents.*;
import static org.assertj.core.api.Assertions.*;

class TaskAggregateReconstructorTest {

    private final TaskAggregateReconstructor reconstructor = new TaskAggregateReconstructor(UnknownEventPolicy.SKIP);

    private List<TaskEvent> richHistory(String taskId) {
        List<TaskEvent> events = new ArrayList<>();
        events.add(created(taskId, "Buy milk"));
        events.add(assigned(taskId, "user-bob"));
        events.add(updated(taskId, "Buy oat milk", "2 litres"));
        events.add(completed(taskId));
        events.add(reopened(taskId));
        events.add(updated(taskId, null, "3 litres"));
        events.add(completed(taskId));
        events.add(completed(taskId));
        events.add(deleted(taskId));
        return events;
    }

    @Test
    @DisplayName("reconstruct — create then complete yields completed state at version 2")
    void reconstruct_createThenComplete() {
        String taskId = EventIds.next();
        TaskState state = reconstructor.reconstruct(List.of(created(taskId, "Buy milk"), completed(taskId)))
                .orElseThrow();

        assertThat(state.getTitle()).isEqualTo("Buy milk");
        assertThat(state.isCompleted()).isTrue();
        assertThat(state.getVersion()).isEqualTo(2);
        assertThat(state.getCompletedAt()).isNotNull();
        assertThat(state.getCreatedBy()).isEqualTo(TestEvents.USER);
    }

    @Test
    @DisplayName("reconstruct — folding the same events twice yields equal states")
    void reconstruct_isDeterministic() {
        List<TaskEvent> events = richHistory(EventIds.next());

        assertThat(reconstructor.reconstruct(events)).isEqualTo(reconstructor.reconstruct(events));
    }

    @Test
    @DisplayName("reconstruct — snapshot plus delta equals full replay at every cut point")
    void reconstruct_snapshotEquivalence() {
        List<TaskEvent> events = richHistory(EventIds.next());
        TaskState full = reconstructor.reconstruct(events).orElseThrow();

        for (int k = 1; k <= events.size(); k++) {
            TaskState base = reconstructor.reconstruct(events.subList(0, k)).orElseThrow();
            TaskState resumed = reconstructor.reconstruct(events.subList(k, events.size()), base).orElseThrow();
            assertThat(resumed).as("cut at %d", k).isEqualTo(full);
        }
    }

    @Test
    @DisplayName("reconstruct — version counts every event, lastEventId tracks the last one")
    void reconstruct_versionEqualsEventCount() {
        List<TaskEvent> events = richHistory(EventIds.next());
        TaskState state = reconstructor.reconstruct(events).orElseThrow();

        assertThat(state.getVersion()).isEqualTo(events.size());
        assertThat(state.getLastEventId()).isEqualTo(events.get(events.size() - 1).getEventId());
        assertThat(state.isDeleted()).isTrue();
    }

    @Test
    @DisplayName("reconstruct — stream starting with an update is corrupt")
    void reconstruct_firstEventNotCreated_throwsCorruptStream() {
        String taskId = EventIds.next();

        assertThatThrownBy(() -> reconstructor.reconstruct(List.of(updated(taskId, "x", null))))
                .isInstanceOf(CorruptStreamException.class)
                .hasMessageContaining("expected created");
    }

    @Test
    @DisplayName("reconstruct — no events and no base yields empty")
    void reconstruct_emptyStream() {
        assertThat(reconstructor.reconstruct(List.of())).isEmpty();
    }

    @Test
    @DisplayName("reconstruct — second created event is corrupt")
    void reconstruct_duplicateCreated_throwsCorruptStream() {
        String taskId = EventIds.next();

        assertThatThrownBy(() -> reconstructor.reconstruct(List.of(created(taskId, "a"), created(taskId, "b"))))
                .isInstanceOf(CorruptStreamException.class);
    }

    @Test
    @DisplayName("reconstruct — any event after the tombstone is corrupt")
    void reconstruct_eventAfterDelete_throwsCorruptStream() {
        String taskId = EventIds.next();

        assertThatThrownBy(() -> reconstructor.reconstruct(
                List.of(created(taskId, "a"), deleted(taskId), completed(taskId))))
                .isInstanceOf(CorruptStreamException.class)
                .hasMessageContaining("tombstone");
    }

    @Test
    @DisplayName("reconstruct — event of another task is corrupt")
    void reconstruct_foreignEvent_throwsCorruptStream() {
        String taskId = EventIds.next();

        assertThatThrownBy(() -> reconstructor.reconstruct(
                List.of(created(taskId, "a"), completed(EventIds.next()))))
                .isInstanceOf(CorruptStreamException.class);
    }

    @Test
    @DisplayName("reconstruct — completing twice keeps the flag and first completion time")
    void reconstruct_completeTwice_isIdempotentExceptVersion() {
        String taskId = EventIds.next();
        TaskEvent first = completed(taskId);
        TaskState once = reconstructor.reconstruct(List.of(created(taskId, "a"), first)).orElseThrow();
        TaskState twice = reconstructor.reconstruct(List.of(completed(taskId)), once).orElseThrow();

        assertThat(twice.isCompleted()).isTrue();
        assertThat(twice.getCompletedAt()).isEqualTo(first.getOccurredAt());
        assertThat(twice.getVersion()).isEqualTo(once.getVersion() + 1);
    }

    @Test
    @DisplayName("reconstruct — reopen clears completion")
    void reconstruct_reopen() {
        String taskId = EventIds.next();
        TaskState state = reconstructor.reconstruct(
                List.of(created(taskId, "a"), completed(taskId), reopened(taskId))).orElseThrow();

        assertThat(state.isActive()).isTrue();
        assertThat(state.getCompletedAt()).isNull();
    }

    @Test
    @DisplayName("reconstruct — update replaces only the fields present")
    void reconstruct_partialUpdate() {
        String taskId = EventIds.next();
        TaskState state = reconstructor.reconstruct(List.of(
                created(taskId, "Buy milk"),
                updated(taskId, null, "semi-skimmed"))).orElseThrow();

        assertThat(state.getTitle()).isEqualTo("Buy milk");
        assertThat(state.getDescription()).isEqualTo("semi-skimmed");
        assertThat(state.getTags()).containsExactly("home");
    }

    @Test
    @DisplayName("reconstruct — unknown event is skipped but still advances the version")
    void reconstruct_unknownEvent_skippedUnderSkipPolicy() {
        String taskId = EventIds.next();
        TaskEvent unknown = TestEvents.unknown(taskId);
        TaskState state = reconstructor.reconstruct(List.of(created(taskId, "a"), unknown)).orElseThrow();

        assertThat(state.getVersion()).isEqualTo(2);
        assertThat(state.getLastEventId()).isEqualTo(unknown.getEventId());
        assertThat(state.getTitle()).isEqualTo("a");
    }

    @Test
    @DisplayName("reconstruct — unknown event stops replay under reject policy")
    void reconstruct_unknownEvent_rejectedUnderRejectPolicy() {
        TaskAggregateReconstructor strict = new TaskAggregateReconstructor(UnknownEventPolicy.REJECT);
        String taskId = EventIds.next();

        assertThatThrownBy(() -> strict.reconstruct(List.of(created(taskId, "a"), TestEvents.unknown(taskId))))
                .isInstanceOf(CorruptStreamException.class)
                .hasMessageContaining("task.starred");
    }
}

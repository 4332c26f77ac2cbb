package com.tasksync.projection.service;

import com.tasksync.shared.errors.TransientInfrastructureException;
import com.tasksync.shared.events.EventIds;
import com.tasksync.shared.events.EventTypes;
import com.tasksync.shared.events.MalformedEventException;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEventSerializer;
import com.tasksync.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.listener.BatchListenerFailedException;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static com.tasksync.projection.ProjectionTestEvents.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit Tests: ProjectionBatchProcessor and ChangeFeedConsumer
 *
 * Covers per-record failure isolation: poison records are dead-lettered without stopping
 * the batch, transient failures stop it at the failing index.
 */
@ExtendWith(MockitoExtension.class)
class ProjectionBatchProcessorTest {

    @Mock ProjectionUpdater updater;
    @Mock EventPublisher eventPublisher;
    @Mock Acknowledgment ack;

    TaskEventSerializer serializer = new TaskEventSerializer(TaskEventSerializer.defaultObjectMapper());
    ProjectionBatchProcessor processor;
    String taskId;

    @BeforeEach
    void setUp() {
        DeadLetterPublisher deadLetterPublisher = new DeadLetterPublisher(eventPublisher,
                new SimpleMeterRegistry(), EventTypes.TOPIC_DLQ_TASK_EVENTS);
        processor = new ProjectionBatchProcessor(updater, serializer, deadLetterPublisher);
        taskId = EventIds.next();
    }

    private ConsumerRecord<String, String> record(long offset, String payload) {
        ConsumerRecord<String, String> record =
                new ConsumerRecord<>(EventTypes.TOPIC_TASK_EVENTS, 0, offset, taskId, payload);
        record.headers().add(EventTypes.HEADER_EVENT_ID, ("evt-" + offset).getBytes(StandardCharsets.UTF_8));
        record.headers().add(EventTypes.HEADER_CORRELATION_ID, "corr-feed".getBytes(StandardCharsets.UTF_8));
        record.headers().add(EventTypes.HEADER_STREAM_VERSION,
                String.valueOf(offset + 1).getBytes(StandardCharsets.UTF_8));
        return record;
    }

    private ConsumerRecord<String, String> record(long offset, TaskEvent event) {
        return record(offset, serializer.serialize(event));
    }

    @Test
    @DisplayName("process — applies every record and counts outcomes")
    void process_shouldApplyAll() {
        when(updater.apply(any(), anyLong())).thenReturn(ApplyOutcome.APPLIED, ApplyOutcome.DUPLICATE);

        BatchResult result = processor.process(List.of(
                record(0, created(taskId, "Buy milk")), record(1, completed(taskId))));

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getApplied()).isEqualTo(1);
        assertThat(result.getDuplicates()).isEqualTo(1);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("process — an unreadable payload is dead-lettered with its reason and the batch continues")
    @SuppressWarnings("unchecked")
    void process_shouldDeadLetterPoisonRecord() {
        when(updater.apply(any(), anyLong())).thenReturn(ApplyOutcome.APPLIED);

        BatchResult result = processor.process(List.of(
                record(0, created(taskId, "Buy milk")), record(1, "{not json"), record(2, completed(taskId))));

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getApplied()).isEqualTo(2);
        assertThat(result.getDeadLettered()).isEqualTo(1);

        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(eventPublisher).publishAndWait(eq(EventTypes.TOPIC_DLQ_TASK_EVENTS), eq(taskId), eq("{not json"),
                headers.capture());
        assertThat(headers.getValue())
                .containsEntry(EventTypes.HEADER_EVENT_ID, "evt-1")
                .containsEntry(EventTypes.HEADER_DLQ_EXCEPTION, MalformedEventException.class.getName())
                .containsKey(EventTypes.HEADER_DLQ_REASON);
    }

    @Test
    @DisplayName("process — passes the stream-version header to the updater and dead-letters a record without it")
    void process_shouldUseStreamVersionHeader() {
        when(updater.apply(any(), anyLong())).thenReturn(ApplyOutcome.APPLIED);
        TaskEvent create = created(taskId, "Buy milk");
        TaskEvent complete = completed(taskId);
        ConsumerRecord<String, String> unversioned = record(1, completed(taskId));
        unversioned.headers().remove(EventTypes.HEADER_STREAM_VERSION);

        BatchResult result = processor.process(List.of(record(0, create), unversioned, record(2, complete)));

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getApplied()).isEqualTo(2);
        assertThat(result.getDeadLettered()).isEqualTo(1);
        verify(updater).apply(create, 1L);
        verify(updater).apply(complete, 3L);
        verify(eventPublisher).publishAndWait(eq(EventTypes.TOPIC_DLQ_TASK_EVENTS), eq(taskId),
                eq(unversioned.value()), anyMap());
    }

    @Test
    @DisplayName("process — a permanent apply error is dead-lettered, a transient one stops the batch")
    void process_shouldStopAtFirstTransientFailure() {
        TransientInfrastructureException transientFailure = new TransientInfrastructureException("db down");
        when(updater.apply(any(), anyLong()))
                .thenThrow(new MalformedEventException("event after deletion"))
                .thenThrow(transientFailure);

        BatchResult result = processor.process(List.of(
                record(0, completed(taskId)), record(1, reopened(taskId)), record(2, completed(taskId))));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getFailedIndex()).isEqualTo(1);
        assertThat(result.getFailure()).isSameAs(transientFailure);
        assertThat(result.getDeadLettered()).isEqualTo(1);
        verify(updater, times(2)).apply(any(), anyLong());
    }

    @Test
    @DisplayName("onBatch — acknowledges a clean batch and reports the failed index otherwise")
    void onBatch_shouldAckOrThrowWithIndex() {
        ChangeFeedConsumer consumer = new ChangeFeedConsumer(processor);
        when(updater.apply(any(), anyLong()))
                .thenReturn(ApplyOutcome.APPLIED)
                .thenThrow(new ProjectionOutOfOrderException(TENANT, taskId, "e"));

        consumer.onBatch(List.of(record(0, created(taskId, "Buy milk"))), ack);
        verify(ack).acknowledge();

        List<ConsumerRecord<String, String>> batch = List.of(record(1, completed(taskId)));
        assertThatThrownBy(() -> consumer.onBatch(batch, ack))
                .isInstanceOf(BatchListenerFailedException.class)
                .satisfies(ex -> assertThat(((BatchListenerFailedException) ex).getIndex()).isEqualTo(0));
        verifyNoMoreInteractions(ack);
    }
}

package com.tasksync.command.snapshot;

import com.tasksync.shared.events.EventTypes;
import com.tasksync.shared.kafka.KafkaHeaders;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Re-evaluates the snapshot policy of every task that appears on the change-feed.
 *
 * Snapshots are an optimization: a failure is logged and the offset is still committed,
 * since the next event on the same task evaluates the policy again.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotTriggerConsumer {

    private final SnapshotManager snapshotManager;

    @KafkaListener(
            topics = EventTypes.TOPIC_TASK_EVENTS,
            groupId = "task-snapshots",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void onTaskEvent(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String tenantId = KafkaHeaders.lastValue(record, EventTypes.HEADER_TENANT_ID);
        String taskId = KafkaHeaders.lastValue(record, EventTypes.HEADER_TASK_ID);
        if (tenantId == null || taskId == null) {
            log.warn("Change-feed record without tenant/task headers: partition={}, offset={}",
                    record.partition(), record.offset());
            ack.acknowledge();
            return;
        }

        try {
            snapshotManager.maybeSnapshot(tenantId, taskId);
        } catch (RuntimeException ex) {
            log.warn("Snapshot attempt failed: tenantId={}, taskId={}, error={}",
                    tenantId, taskId, ex.getMessage(), ex);
        }
        ack.acknowledge();
    }
}

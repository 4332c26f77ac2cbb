package com.tasksync.projection.service;

import com.tasksync.shared.events.EventTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.listener.BatchListenerFailedException;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Task change-feed consumer (group task-projection).
 *
 * A clean batch is acknowledged. Otherwise the failed index is handed to the container's
 * error handler, which commits everything before it and redelivers the rest with backoff;
 * a record that keeps failing is finally published to the dead-letter topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeFeedConsumer {

    private final ProjectionBatchProcessor batchProcessor;

    @KafkaListener(
            topics = EventTypes.TOPIC_TASK_EVENTS,
            groupId = "task-projection",
            containerFactory = "batchListenerContainerFactory"
    )
    public void onBatch(List<ConsumerRecord<String, String>> records, Acknowledgment ack) {
        BatchResult result = batchProcessor.process(records);
        if (!result.isFailed()) {
            ack.acknowledge();
            return;
        }
        ConsumerRecord<String, String> failed = records.get(result.getFailedIndex());
        log.warn("Batch failed at index={}, partition={}, offset={}; handing to error handler",
                result.getFailedIndex(), failed.partition(), failed.offset());
        throw new BatchListenerFailedException("Projection failed for record at offset " + failed.offset(),
                result.getFailure(), result.getFailedIndex());
    }
}

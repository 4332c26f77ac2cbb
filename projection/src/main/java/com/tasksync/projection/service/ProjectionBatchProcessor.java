package com.tasksync.projection.service;

import com.tasksync.shared.events.EventTypes;
import com.tasksync.shared.events.MalformedEventException;
import com.tasksync.shared.events.TaskEvent;
import com.tasksync.shared.events.TaskEventSerializer;
import com.tasksync.shared.kafka.EventPublisher.EventPublishException;
import com.tasksync.shared.kafka.KafkaHeaders;
import com.tasksync.shared.web.CorrelationIdFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Applies a batch of change-feed records in order, isolating failures per record.
 *
 * A record that can never be applied is dead-lettered and the batch moves on. The first
 * transient failure stops the batch: later records of the same task must not overtake it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectionBatchProcessor {

    private final ProjectionUpdater updater;
    private final TaskEventSerializer serializer;
    private final DeadLetterPublisher deadLetterPublisher;

    public BatchResult process(List<ConsumerRecord<String, String>> records) {
        int applied = 0;
        int duplicates = 0;
        int ignored = 0;
        int deadLettered = 0;

        for (int i = 0; i < records.size(); i++) {
            ConsumerRecord<String, String> record = records.get(i);
            String correlationId = KafkaHeaders.lastValue(record, EventTypes.HEADER_CORRELATION_ID);
            if (correlationId != null) {
                MDC.put(CorrelationIdFilter.MDC_KEY, correlationId);
            }
            try {
                TaskEvent event = serializer.deserialize(record.value());
                switch (updater.apply(event, streamVersionOf(record))) {
                    case APPLIED -> applied++;
                    case DUPLICATE -> duplicates++;
                    case IGNORED -> ignored++;
                }
            } catch (MalformedEventException e) {
                try {
                    deadLetterPublisher.publish(record, e);
                    deadLettered++;
                } catch (EventPublishException publishFailure) {
                    log.warn("Dead-letter publish failed, batch stops: partition={}, offset={}",
                            record.partition(), record.offset());
                    return BatchResult.failedAt(i, publishFailure, applied, duplicates, ignored, deadLettered);
                }
            } catch (RuntimeException e) {
                log.warn("Transient failure applying record, batch stops: partition={}, offset={}, error={}",
                        record.partition(), record.offset(), e.getMessage());
                return BatchResult.failedAt(i, e, applied, duplicates, ignored, deadLettered);
            } finally {
                MDC.remove(CorrelationIdFilter.MDC_KEY);
            }
        }

        log.debug("Batch processed: size={}, applied={}, duplicates={}, ignored={}, deadLettered={}",
                records.size(), applied, duplicates, ignored, deadLettered);
        return BatchResult.completed(applied, duplicates, ignored, deadLettered);
    }

    private static long streamVersionOf(ConsumerRecord<String, String> record) {
        String header = KafkaHeaders.lastValue(record, EventTypes.HEADER_STREAM_VERSION);
        if (header == null) {
            throw new MalformedEventException("Missing " + EventTypes.HEADER_STREAM_VERSION + " header at offset "
                    + record.offset());
        }
        try {
            return Long.parseLong(header.trim());
        } catch (NumberFormatException e) {
            throw new MalformedEventException("Invalid " + EventTypes.HEADER_STREAM_VERSION + " header '" + header
                    + "' at offset " + record.offset(), e);
        }
    }
}

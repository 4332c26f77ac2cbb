package com.tasksync.projection.service;

import com.tasksync.shared.events.EventTypes;
import com.tasksync.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routes a change-feed record that can never be applied to the dead-letter topic.
 * The original payload, key and headers are kept; the reason and exception class are added.
 */
@Slf4j
@Component
public class DeadLetterPublisher {

    private final EventPublisher eventPublisher;
    private final String dlqTopic;
    private final Counter deadLettered;

    public DeadLetterPublisher(EventPublisher eventPublisher,
                               MeterRegistry meterRegistry,
                               @Value("${tasksync.projection.dlq-topic:" + EventTypes.TOPIC_DLQ_TASK_EVENTS + "}") String dlqTopic) {
        this.eventPublisher = eventPublisher;
        this.dlqTopic = dlqTopic;
        this.deadLettered = Counter.builder("tasks.projection.dead_lettered")
                .description("Change-feed records routed to the dead-letter topic")
                .register(meterRegistry);
    }

    /** Blocks until the broker has the record, so the offset is never committed past a lost message. */
    public void publish(ConsumerRecord<String, String> record, Exception reason) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Header header : record.headers()) {
            if (header.value() != null) {
                headers.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
            }
        }
        headers.put(EventTypes.HEADER_DLQ_REASON, String.valueOf(reason.getMessage()));
        headers.put(EventTypes.HEADER_DLQ_EXCEPTION, reason.getClass().getName());

        eventPublisher.publishAndWait(dlqTopic, record.key(), record.value(), headers);
        deadLettered.increment();
        log.warn("Record dead-lettered: topic={}, partition={}, offset={}, key={}, reason={}",
                record.topic(), record.partition(), record.offset(), record.key(), reason.getMessage());
    }
}

package com.tasksync.shared.kafka;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

import java.nio.charset.StandardCharsets;

/** Header access for consumers. */
public final class KafkaHeaders {

    private KafkaHeaders() {}

    /** Last value of the header as UTF-8, or null when absent. */
    public static String lastValue(ConsumerRecord<?, ?> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null && header.value() != null
                ? new String(header.value(), StandardCharsets.UTF_8)
                : null;
    }
}

package com.tasksync.shared.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON codec for task events, used by the event store, the outbox and the change-feed consumer.
 */
public class TaskEventSerializer {

    private final ObjectMapper objectMapper;

    public TaskEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** The mapper configuration every service registers as its ObjectMapper bean. */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String serialize(TaskEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event: eventId=" + event.getEventId()
                    + ", type=" + event.getEventType(), e);
        }
    }

    public TaskEvent deserialize(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedEventException("Empty event payload");
        }
        TaskEvent event;
        try {
            event = objectMapper.readValue(payload, TaskEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Unreadable event payload: " + e.getOriginalMessage(), e);
        }
        if (event.getEventId() == null || event.getTaskId() == null || event.getTenantId() == null) {
            throw new MalformedEventException("Event envelope incomplete: eventId=" + event.getEventId()
                    + ", taskId=" + event.getTaskId());
        }
        return event;
    }
}

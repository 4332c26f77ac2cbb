package com.tasksync.shared.events;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Envelope attributes shared by every task event. */
@Value
@Builder
public class EventMetadata {
    String eventId;
    String tenantId;
    String taskId;
    String actorId;
    Instant occurredAt;
    String correlationId;
}

package com.tasksync.command.idempotency;

import com.tasksync.command.domain.CommandResult;

/**
 * Remembers the outcome of commands sent with an {@code Idempotency-Key}, so a caller that
 * timed out can re-send the same command and learn whether the first attempt was written
 * instead of appending it twice.
 */
public interface CommandIdempotencyStore {

    IdempotencyClaim claim(String tenantId, String key);

    void complete(String tenantId, String key, CommandResult result);

    /** Frees a claimed key after a failed command so the caller may retry it. */
    void release(String tenantId, String key);
}

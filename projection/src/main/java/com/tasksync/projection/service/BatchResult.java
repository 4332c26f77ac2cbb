package com.tasksync.projection.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one change-feed batch. When {@link #isFailed()}, every record before
 * {@code failedIndex} was handled and the rest must be redelivered.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BatchResult {

    private final int applied;
    private final int duplicates;
    private final int ignored;
    private final int deadLettered;
    private final int failedIndex;
    private final Exception failure;

    static BatchResult completed(int applied, int duplicates, int ignored, int deadLettered) {
        return new BatchResult(applied, duplicates, ignored, deadLettered, -1, null);
    }

    static BatchResult failedAt(int index, Exception failure, int applied, int duplicates, int ignored,
                                int deadLettered) {
        return new BatchResult(applied, duplicates, ignored, deadLettered, index, failure);
    }

    public boolean isFailed() {
        return failedIndex >= 0;
    }
}

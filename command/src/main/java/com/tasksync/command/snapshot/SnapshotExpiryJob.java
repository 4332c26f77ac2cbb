package com.tasksync.command.snapshot;

import com.tasksync.shared.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/** Removes snapshots whose expiry grace period has passed. */
@Slf4j
@Component
@RequiredArgsConstructor
public class SnapshotExpiryJob {

    private final SnapshotStore snapshotStore;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${tasksync.snapshots.purge-interval-ms:300000}")
    public int purge() {
        int removed = snapshotStore.purgeExpired(clock.instant());
        if (removed > 0) {
            log.info("Expired snapshots purged: count={}", removed);
        }
        return removed;
    }
}

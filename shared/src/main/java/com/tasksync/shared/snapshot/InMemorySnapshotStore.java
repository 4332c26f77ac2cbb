package com.tasksync.shared.snapshot;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, TaskSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(TaskSnapshot snapshot) {
        snapshots.putIfAbsent(key(snapshot.getTenantId(), snapshot.getTaskId(), snapshot.getCutoffEventId()), snapshot);
    }

    @Override
    public Optional<TaskSnapshot> findLatest(String tenantId, String taskId) {
        return snapshots.values().stream()
                .filter(s -> s.getTenantId().equals(tenantId) && s.getTaskId().equals(taskId))
                .filter(s -> s.getExpiresAt() == null)
                .max(Comparator.comparingLong(TaskSnapshot::getStreamVersion));
    }

    @Override
    public int markSupersededForExpiry(String tenantId, String taskId, String keepCutoffEventId, Instant expiresAt) {
        int marked = 0;
        for (Map.Entry<String, TaskSnapshot> entry : snapshots.entrySet()) {
            TaskSnapshot s = entry.getValue();
            if (s.getTenantId().equals(tenantId) && s.getTaskId().equals(taskId)
                    && !s.getCutoffEventId().equals(keepCutoffEventId) && s.getExpiresAt() == null) {
                entry.setValue(s.withExpiresAt(expiresAt));
                marked++;
            }
        }
        return marked;
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = snapshots.size();
        snapshots.values().removeIf(s -> s.isExpiredAt(now));
        return before - snapshots.size();
    }

    /** Including snapshots already marked for expiry. */
    public long count(String tenantId, String taskId) {
        return snapshots.values().stream()
                .filter(s -> s.getTenantId().equals(tenantId) && s.getTaskId().equals(taskId))
                .count();
    }

    private static String key(String tenantId, String taskId, String cutoffEventId) {
        return tenantId + "#" + taskId + "#" + cutoffEventId;
    }
}

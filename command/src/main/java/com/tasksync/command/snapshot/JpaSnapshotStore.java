package com.tasksync.command.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasksync.shared.domain.TaskState;
import com.tasksync.shared.snapshot.SnapshotStore;
import com.tasksync.shared.snapshot.TaskSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaSnapshotStore implements SnapshotStore {

    private final TaskSnapshotRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void save(TaskSnapshot snapshot) {
        if (repository.existsById(snapshot.getCutoffEventId())) {
            return;
        }
        String state;
        try {
            state = objectMapper.writeValueAsString(snapshot.getState());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize snapshot state", e);
        }
        repository.save(TaskSnapshotRecord.builder()
                .cutoffEventId(snapshot.getCutoffEventId())
                .tenantId(snapshot.getTenantId())
                .taskId(snapshot.getTaskId())
                .streamVersion(snapshot.getStreamVersion())
                .state(state)
                .createdAt(snapshot.getCreatedAt())
                .expiresAt(snapshot.getExpiresAt())
                .build());
    }

    /**
     * A row whose state no longer decodes is treated as absent: the loader then replays the
     * full stream, which is always correct.
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<TaskSnapshot> findLatest(String tenantId, String taskId) {
        return repository.findFirstByTenantIdAndTaskIdAndExpiresAtIsNullOrderByStreamVersionDesc(tenantId, taskId)
                .flatMap(this::toSnapshot);
    }

    @Override
    @Transactional
    public int markSupersededForExpiry(String tenantId, String taskId, String keepCutoffEventId, Instant expiresAt) {
        return repository.markSuperseded(tenantId, taskId, keepCutoffEventId, expiresAt);
    }

    @Override
    @Transactional
    public int purgeExpired(Instant now) {
        return repository.deleteExpired(now);
    }

    private Optional<TaskSnapshot> toSnapshot(TaskSnapshotRecord record) {
        try {
            TaskState state = objectMapper.readValue(record.getState(), TaskState.class);
            return Optional.of(TaskSnapshot.builder()
                    .tenantId(record.getTenantId())
                    .taskId(record.getTaskId())
                    .state(state)
                    .cutoffEventId(record.getCutoffEventId())
                    .streamVersion(record.getStreamVersion())
                    .createdAt(record.getCreatedAt())
                    .expiresAt(record.getExpiresAt())
                    .build());
        } catch (JsonProcessingException e) {
            log.warn("Ignoring undecodable snapshot: taskId={}, cutoffEventId={}, error={}",
                    record.getTaskId(), record.getCutoffEventId(), e.getMessage());
            return Optional.empty();
        }
    }
}

package com.tasksync.command.snapshot;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface TaskSnapshotRecordRepository extends JpaRepository<TaskSnapshotRecord, String> {

    Optional<TaskSnapshotRecord> findFirstByTenantIdAndTaskIdAndExpiresAtIsNullOrderByStreamVersionDesc(
            String tenantId, String taskId);

    @Modifying
    @Query("UPDATE TaskSnapshotRecord s SET s.expiresAt = :expiresAt " +
           "WHERE s.tenantId = :tenantId AND s.taskId = :taskId " +
           "AND s.cutoffEventId <> :keep AND s.expiresAt IS NULL")
    int markSuperseded(@Param("tenantId") String tenantId,
                       @Param("taskId") String taskId,
                       @Param("keep") String keepCutoffEventId,
                       @Param("expiresAt") Instant expiresAt);

    @Modifying
    @Query("DELETE FROM TaskSnapshotRecord s WHERE s.expiresAt IS NOT NULL AND s.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
